package org.openhab.binding.ewelink.internal.api;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.ewelink.internal.model.DeviceCommand;
import org.openhab.binding.ewelink.internal.model.DeviceStatus;
import org.openhab.binding.ewelink.internal.model.DeviceSummary;
import org.openhab.binding.ewelink.internal.model.RegionEndpoint;
import org.openhab.binding.ewelink.internal.model.SwitchState;
import org.openhab.binding.ewelink.internal.model.TokenSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Issues device commands and queries with the current access token. Requests always go to the region that
 * issued the token. The token is read from the {@link CredentialStore} for every request, and a refused token is
 * refreshed once before the request is repeated.
 */
@NonNullByDefault
public class DeviceCommandDispatcher implements SwitchCommandTarget {
    public static final String STATUS_PATH = "/v2/device/thing/status";
    public static final String THING_PATH = "/v2/device/thing";
    static final int PAGE_SIZE = 30;
    private static final int MAX_PAGES = 20;

    private final Logger logger = Objects.requireNonNull(LoggerFactory.getLogger(DeviceCommandDispatcher.class));

    private final CredentialStore store;
    private final TokenAcquisitionProtocol protocol;
    private final EWeLinkTransport transport;
    private final RetryPolicy retryPolicy;
    private final Clock clock;

    public DeviceCommandDispatcher(CredentialStore store, TokenAcquisitionProtocol protocol,
            EWeLinkTransport transport) {
        this(store, protocol, transport, RetryPolicy.dispatch(), Clock.systemUTC());
    }

    public DeviceCommandDispatcher(CredentialStore store, TokenAcquisitionProtocol protocol,
            EWeLinkTransport transport, RetryPolicy retryPolicy, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.protocol = Objects.requireNonNull(protocol, "protocol");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void setState(String deviceId, SwitchState state) throws EWeLinkApiException {
        send(new DeviceCommand(deviceId, state));
    }

    /**
     * Sends {@code command} to the region of the current token.
     *
     * @throws EWeLinkApiException of kind {@link ErrorKind#DEVICE_COMMAND_REJECTED} carrying the provider message
     *             if the provider did not report success
     */
    public void send(DeviceCommand command) throws EWeLinkApiException {
        send(null, command);
    }

    /**
     * Sends {@code command} to {@code target}.
     *
     * @throws EWeLinkApiException of kind {@link ErrorKind#REGION_MISMATCH}, before anything is sent, if the current
     *             token was issued by another region
     */
    public void send(@Nullable RegionEndpoint target, DeviceCommand command) throws EWeLinkApiException {
        String context = "Switching " + command.getDeviceId() + " " + command.getDesiredState().getProviderValue();
        String body = command.toPayload().toString();
        ApiEnvelope envelope = withToken(context, target,
                tokens -> transport.post(tokens.getRegion().resolve(STATUS_PATH), headers(tokens), body));
        if (!envelope.isProviderSuccess()) {
            throw envelope.toException(context, ErrorKind.DEVICE_COMMAND_REJECTED);
        }
        logger.debug("Device {} switched {}", command.getDeviceId(), command.getDesiredState());
    }

    /**
     * Lists the devices of the account. Groups and shared scenes without a device id are skipped.
     */
    public List<DeviceSummary> listDevices() throws EWeLinkApiException {
        List<DeviceSummary> devices = new ArrayList<>();
        for (int page = 0; page < MAX_PAGES; page++) {
            String query = "?lang=en&num=" + PAGE_SIZE + "&beginIndex=" + (page * PAGE_SIZE);
            ApiEnvelope envelope = withToken("Device list", null,
                    tokens -> transport.get(tokens.getRegion().resolve(THING_PATH + query), headers(tokens)));
            if (!envelope.isProviderSuccess()) {
                throw envelope.toException("Device list", ErrorKind.DEVICE_COMMAND_REJECTED);
            }
            JsonElement thingList = envelope.getData().get("thingList");
            if (thingList == null || !thingList.isJsonArray()) {
                break;
            }
            JsonArray things = thingList.getAsJsonArray();
            for (JsonElement thing : things) {
                if (thing.isJsonObject()) {
                    DeviceSummary summary = toSummary(thing.getAsJsonObject());
                    if (summary != null) {
                        devices.add(summary);
                    }
                }
            }
            if (things.size() < PAGE_SIZE) {
                break;
            }
        }
        return devices;
    }

    /**
     * Reads the reported switch state of one device.
     */
    public DeviceStatus getStatus(String deviceId) throws EWeLinkApiException {
        String context = "Status of " + deviceId;
        String query = "?type=" + DeviceCommand.TARGET_TYPE_DEVICE + "&id="
                + URLEncoder.encode(deviceId, StandardCharsets.UTF_8);
        ApiEnvelope envelope = withToken(context, null,
                tokens -> transport.get(tokens.getRegion().resolve(STATUS_PATH + query), headers(tokens)));
        if (!envelope.isProviderSuccess()) {
            throw envelope.toException(context, ErrorKind.DEVICE_COMMAND_REJECTED);
        }
        JsonObject data = envelope.getData();
        DeviceStatus status = new DeviceStatus();
        status.deviceId = deviceId;
        // the status endpoint only answers for reachable devices unless it says otherwise
        JsonElement online = data.get("online");
        status.online = online == null || !online.isJsonPrimitive() || online.getAsBoolean();
        status.lastUpdated = clock.instant();
        JsonElement params = data.get("params");
        if (params != null && params.isJsonObject()) {
            status.switchState = switchState(params.getAsJsonObject());
        }
        return status;
    }

    private ApiEnvelope withToken(String context, @Nullable RegionEndpoint target, TokenCall call)
            throws EWeLinkApiException {
        for (int attempt = 1;; attempt++) {
            TokenSet tokens = store.current();
            if (target != null && !tokens.isIssuedBy(target)) {
                throw new EWeLinkApiException(ErrorKind.REGION_MISMATCH, context + ": token was issued by region "
                        + tokens.getRegion().getId() + ", not " + target.getId());
            }
            try {
                if (tokens.isExpired(clock.instant())) {
                    throw new EWeLinkApiException(ErrorKind.TOKEN_EXPIRED,
                            context + ": access token expired at " + tokens.getExpiresAt());
                }
                ApiEnvelope envelope = call.execute(tokens);
                if (envelope.isTokenRejected()) {
                    throw new EWeLinkApiException(ErrorKind.TOKEN_EXPIRED, context + ": access token was refused",
                            envelope.getError(), envelope.getProviderMessage());
                }
                return envelope;
            } catch (EWeLinkApiException e) {
                if (!retryPolicy.shouldRetry(attempt, e)) {
                    throw e;
                }
                logger.debug("{}; refreshing the access token and trying again", e.getMessage());
                protocol.markExpired();
                protocol.refresh();
                pause(context, retryPolicy.getBackoff());
            }
        }
    }

    private static void pause(String context, Duration backoff) throws EWeLinkApiException {
        if (backoff.isZero() || backoff.isNegative()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EWeLinkApiException(ErrorKind.CANCELLED, context + ": interrupted before retrying", e);
        }
    }

    private Map<String, String> headers(TokenSet tokens) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "application/json");
        headers.put("Authorization", "Bearer " + tokens.getAccessToken());
        headers.put("X-CK-Appid", store.getIdentity().getAppId());
        return headers;
    }

    private static @Nullable DeviceSummary toSummary(JsonObject thing) {
        JsonObject item = thing;
        JsonElement itemData = thing.get("itemData");
        if (itemData != null && itemData.isJsonObject()) {
            item = itemData.getAsJsonObject();
        }
        String deviceId = string(item, "deviceid");
        if (deviceId == null) {
            return null;
        }
        DeviceSummary summary = new DeviceSummary();
        summary.deviceId = deviceId;
        summary.name = string(item, "name");
        summary.model = string(item, "productModel");
        summary.brand = string(item, "brandName");
        JsonElement online = item.get("online");
        summary.online = online != null && online.isJsonPrimitive() && online.getAsBoolean();
        return summary;
    }

    private static @Nullable SwitchState switchState(JsonObject params) {
        SwitchState state = SwitchState.fromProviderValue(string(params, "switch"));
        if (state != null) {
            return state;
        }
        // multi-channel devices report an array of outlets; the first one is the main output
        JsonElement switches = params.get("switches");
        if (switches != null && switches.isJsonArray() && !switches.getAsJsonArray().isEmpty()) {
            JsonElement first = switches.getAsJsonArray().get(0);
            if (first.isJsonObject()) {
                return SwitchState.fromProviderValue(string(first.getAsJsonObject(), "switch"));
            }
        }
        return null;
    }

    private static @Nullable String string(JsonObject object, String key) {
        JsonElement element = object.get(key);
        if (element == null || !element.isJsonPrimitive()) {
            return null;
        }
        String value = element.getAsString();
        return value.isBlank() ? null : value;
    }

    @FunctionalInterface
    private interface TokenCall {
        ApiEnvelope execute(TokenSet tokens) throws EWeLinkApiException;
    }
}
