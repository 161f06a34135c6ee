package org.openhab.binding.ewelink.internal;

import java.time.Duration;

import org.openhab.binding.ewelink.internal.api.SwitchSequence;
import org.openhab.core.config.core.Configuration;

public class DeviceConfiguration {
    public String deviceId = "";
    public String deviceName = "";
    public int blinkCycles = SwitchSequence.DEFAULT_BLINK_CYCLES;
    public long blinkIntervalMs = SwitchSequence.DEFAULT_BLINK_DELAY.toMillis();

    public static DeviceConfiguration from(Configuration cfg) {
        DeviceConfiguration c = new DeviceConfiguration();
        Object id = cfg.get(EWeLinkBindingConstants.CONFIG_DEVICE_ID);
        if (id != null) {
            c.deviceId = id.toString().trim();
        }
        Object name = cfg.get(EWeLinkBindingConstants.CONFIG_DEVICE_NAME);
        if (name != null) {
            c.deviceName = name.toString().trim();
        }
        Object cycles = cfg.get(EWeLinkBindingConstants.CONFIG_BLINK_CYCLES);
        if (cycles instanceof Number) {
            c.blinkCycles = Math.max(1, ((Number) cycles).intValue());
        }
        Object interval = cfg.get(EWeLinkBindingConstants.CONFIG_BLINK_INTERVAL_MS);
        if (interval instanceof Number) {
            c.blinkIntervalMs = Math.max(0, ((Number) interval).longValue());
        }
        return c;
    }

    public SwitchSequence blinkSequence() {
        return SwitchSequence.blink(blinkCycles, Duration.ofMillis(blinkIntervalMs));
    }
}
