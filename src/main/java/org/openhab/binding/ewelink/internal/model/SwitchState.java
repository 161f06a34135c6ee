package org.openhab.binding.ewelink.internal.model;

import java.util.Locale;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;

/**
 * Desired or reported state of a switch output.
 */
@NonNullByDefault
public enum SwitchState {
    ON("on"),
    OFF("off");

    private final String providerValue;

    SwitchState(String providerValue) {
        this.providerValue = providerValue;
    }

    public String getProviderValue() {
        return providerValue;
    }

    public static @Nullable SwitchState fromProviderValue(@Nullable String value) {
        if (value == null) {
            return null;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "on" -> ON;
            case "off" -> OFF;
            default -> null;
        };
    }
}
