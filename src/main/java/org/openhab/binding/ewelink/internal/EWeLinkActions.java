package org.openhab.binding.ewelink.internal;

import java.time.Duration;
import java.util.Objects;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.ewelink.internal.api.EWeLinkApiException;
import org.openhab.binding.ewelink.internal.api.SequenceRunner;
import org.openhab.binding.ewelink.internal.api.SwitchSequence;
import org.openhab.binding.ewelink.internal.model.SwitchState;
import org.openhab.core.automation.annotation.ActionInput;
import org.openhab.core.automation.annotation.ActionOutput;
import org.openhab.core.automation.annotation.RuleAction;
import org.openhab.core.thing.binding.ThingActions;
import org.openhab.core.thing.binding.ThingActionsScope;
import org.openhab.core.thing.binding.ThingHandler;
import org.osgi.service.component.annotations.Component;
import org.osgi.service.component.annotations.ServiceScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rule actions of the account bridge. They run on the calling rule's thread, so a blink blocks the rule until
 * the sequence has finished.
 */
@NonNullByDefault
@Component(service = ThingActions.class, configurationPid = "binding.ewelink", scope = ServiceScope.PROTOTYPE)
@ThingActionsScope(name = "ewelink")
public class EWeLinkActions implements ThingActions {
    private final Logger logger = Objects.requireNonNull(LoggerFactory.getLogger(EWeLinkActions.class));

    private @Nullable AccountBridgeHandler handler;

    @Override
    public void setThingHandler(ThingHandler thingHandler) {
        if (thingHandler instanceof AccountBridgeHandler accountHandler) {
            handler = accountHandler;
        } else {
            throw new IllegalArgumentException("eWeLink actions only support AccountBridgeHandler");
        }
    }

    @Override
    public @Nullable ThingHandler getThingHandler() {
        return handler;
    }

    @RuleAction(label = "get authorization URL", description = "Returns the signed page to open for a new "
            + "authorization code")
    public @ActionOutput(name = "url", type = "java.lang.String") @Nullable String getAuthorizationUrl() {
        AccountBridgeHandler localHandler = handler;
        if (localHandler == null) {
            return null;
        }
        try {
            return localHandler.authorizationUrl();
        } catch (IllegalStateException e) {
            logger.warn("Cannot build the authorization URL: {}", e.getMessage());
            return null;
        }
    }

    @RuleAction(label = "exchange authorization code", description = "Exchanges a captured authorization code "
            + "for an access token")
    public @ActionOutput(name = "success", type = "java.lang.Boolean") Boolean exchangeAuthorizationCode(
            @ActionInput(name = "code", label = "authorization code") @Nullable String code) {
        AccountBridgeHandler localHandler = handler;
        if (localHandler == null || code == null || code.isBlank()) {
            return false;
        }
        try {
            localHandler.exchangeAuthorizationCode(code);
            return true;
        } catch (EWeLinkApiException | IllegalStateException e) {
            logger.warn("Exchanging the authorization code failed: {}", e.getMessage());
            return false;
        }
    }

    @RuleAction(label = "switch device", description = "Switches an eWeLink device on or off")
    public @ActionOutput(name = "success", type = "java.lang.Boolean") Boolean switchDevice(
            @ActionInput(name = "deviceId", label = "device id") @Nullable String deviceId,
            @ActionInput(name = "on", label = "on") @Nullable Boolean on) {
        AccountBridgeHandler localHandler = handler;
        if (localHandler == null || deviceId == null || deviceId.isBlank() || on == null) {
            return false;
        }
        try {
            localHandler.setDeviceState(deviceId, on ? SwitchState.ON : SwitchState.OFF);
            return true;
        } catch (EWeLinkApiException e) {
            logger.warn("Switching {} failed: {}", deviceId, e.getMessage());
            return false;
        }
    }

    @RuleAction(label = "blink device", description = "Switches a device on and off repeatedly and leaves it on")
    public @ActionOutput(name = "success", type = "java.lang.Boolean") Boolean blinkDevice(
            @ActionInput(name = "deviceId", label = "device id") @Nullable String deviceId,
            @ActionInput(name = "cycles", label = "cycles") @Nullable Integer cycles,
            @ActionInput(name = "intervalMs", label = "interval in milliseconds") @Nullable Long intervalMs) {
        AccountBridgeHandler localHandler = handler;
        if (localHandler == null || deviceId == null || deviceId.isBlank()) {
            return false;
        }
        SwitchSequence sequence = SwitchSequence.blink(
                cycles == null || cycles < 1 ? SwitchSequence.DEFAULT_BLINK_CYCLES : cycles,
                intervalMs == null || intervalMs < 0 ? SwitchSequence.DEFAULT_BLINK_DELAY
                        : Duration.ofMillis(intervalMs));
        try {
            SequenceRunner.Outcome outcome = new SequenceRunner(localHandler::setDeviceState).run(deviceId,
                    sequence);
            return !outcome.isCancelled();
        } catch (EWeLinkApiException e) {
            logger.warn("Blinking {} failed: {}", deviceId, e.getMessage());
            return false;
        }
    }

    public static @Nullable String getAuthorizationUrl(ThingActions actions) {
        return ((EWeLinkActions) actions).getAuthorizationUrl();
    }

    public static boolean exchangeAuthorizationCode(ThingActions actions, @Nullable String code) {
        return ((EWeLinkActions) actions).exchangeAuthorizationCode(code);
    }

    public static boolean switchDevice(ThingActions actions, @Nullable String deviceId, @Nullable Boolean on) {
        return ((EWeLinkActions) actions).switchDevice(deviceId, on);
    }

    public static boolean blinkDevice(ThingActions actions, @Nullable String deviceId) {
        return ((EWeLinkActions) actions).blinkDevice(deviceId, null, null);
    }
}
