package org.openhab.binding.ewelink.internal.model;

import java.util.Objects;

import org.eclipse.jdt.annotation.NonNullByDefault;

import com.google.gson.JsonObject;

/**
 * A single switch command for one device. Built per call and never persisted.
 */
@NonNullByDefault
public final class DeviceCommand {
    /** Target type "device" in the thing status API. */
    public static final int TARGET_TYPE_DEVICE = 1;

    private final String deviceId;
    private final SwitchState desiredState;

    public DeviceCommand(String deviceId, SwitchState desiredState) {
        if (deviceId == null || deviceId.isBlank()) {
            throw new IllegalArgumentException("Device id must not be empty");
        }
        this.deviceId = deviceId.trim();
        this.desiredState = Objects.requireNonNull(desiredState, "desiredState");
    }

    public String getDeviceId() {
        return deviceId;
    }

    public SwitchState getDesiredState() {
        return desiredState;
    }

    public JsonObject toPayload() {
        JsonObject params = new JsonObject();
        params.addProperty("switch", desiredState.getProviderValue());
        JsonObject payload = new JsonObject();
        payload.addProperty("type", TARGET_TYPE_DEVICE);
        payload.addProperty("id", deviceId);
        payload.add("params", params);
        return payload;
    }

    @Override
    public String toString() {
        return "DeviceCommand[" + deviceId + " -> " + desiredState + "]";
    }
}
