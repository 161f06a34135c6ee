package org.openhab.binding.ewelink.internal.model;

import java.time.Instant;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;

@NonNullByDefault
public class DeviceStatus {
    public String deviceId = "";
    public boolean online;
    public @Nullable SwitchState switchState;
    public @Nullable Instant lastUpdated;
}
