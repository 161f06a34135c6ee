package org.openhab.binding.ewelink.internal.model;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;

@NonNullByDefault
public class DeviceSummary {
    public String deviceId = "";
    public @Nullable String name;
    public @Nullable String model;
    public @Nullable String brand;
    public boolean online;
}
