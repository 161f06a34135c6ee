package org.openhab.binding.ewelink.internal;

import java.util.Objects;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.ewelink.internal.api.EWeLinkApiException;
import org.openhab.binding.ewelink.internal.api.SequenceAbortedException;
import org.openhab.binding.ewelink.internal.api.SequenceRunner;
import org.openhab.binding.ewelink.internal.api.SwitchSequence;
import org.openhab.binding.ewelink.internal.model.DeviceStatus;
import org.openhab.binding.ewelink.internal.model.SwitchState;
import org.openhab.core.library.types.OnOffType;
import org.openhab.core.thing.Bridge;
import org.openhab.core.thing.ChannelUID;
import org.openhab.core.thing.Thing;
import org.openhab.core.thing.ThingStatus;
import org.openhab.core.thing.ThingStatusDetail;
import org.openhab.core.thing.ThingStatusInfo;
import org.openhab.core.thing.binding.BaseThingHandler;
import org.openhab.core.types.Command;
import org.openhab.core.types.RefreshType;
import org.openhab.core.types.UnDefType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles one switchable eWeLink device. The {@code switch} channel sets the output, the {@code blink} channel
 * plays the blink sequence while ON and cancels it when set to OFF.
 */
@NonNullByDefault
public class EWeLinkDeviceHandler extends BaseThingHandler {
    private final Logger logger = Objects.requireNonNull(LoggerFactory.getLogger(EWeLinkDeviceHandler.class));

    private DeviceConfiguration cfg = new DeviceConfiguration();
    private final Object blinkLock = new Object();
    private @Nullable SequenceRunner activeRunner;

    public EWeLinkDeviceHandler(Thing thing) {
        super(thing);
    }

    @Override
    public void initialize() {
        DeviceConfiguration localCfg = DeviceConfiguration.from(getConfig());
        if (localCfg.deviceId.isBlank() && localCfg.deviceName.isBlank()) {
            updateStatus(ThingStatus.OFFLINE, ThingStatusDetail.CONFIGURATION_ERROR,
                    "Neither deviceId nor deviceName is configured");
            return;
        }
        cfg = localCfg;
        Bridge bridge = getBridge();
        if (bridge == null) {
            updateStatus(ThingStatus.OFFLINE, ThingStatusDetail.BRIDGE_UNINITIALIZED);
            return;
        }
        if (bridge.getStatus() != ThingStatus.ONLINE) {
            updateStatus(ThingStatus.OFFLINE, ThingStatusDetail.BRIDGE_OFFLINE);
            return;
        }
        updateStatus(ThingStatus.UNKNOWN);
        scheduler.execute(this::refreshStatus);
    }

    @Override
    public void bridgeStatusChanged(ThingStatusInfo bridgeStatusInfo) {
        if (bridgeStatusInfo.getStatus() == ThingStatus.ONLINE) {
            updateStatus(ThingStatus.UNKNOWN);
            scheduler.execute(this::refreshStatus);
        } else {
            cancelBlink();
            updateStatus(ThingStatus.OFFLINE, ThingStatusDetail.BRIDGE_OFFLINE);
        }
    }

    @Override
    public void handleCommand(ChannelUID channelUID, Command command) {
        switch (channelUID.getId()) {
            case EWeLinkBindingConstants.CHANNEL_SWITCH:
                if (command == RefreshType.REFRESH) {
                    scheduler.execute(this::refreshStatus);
                } else if (command instanceof OnOffType onOff) {
                    SwitchState state = onOff == OnOffType.ON ? SwitchState.ON : SwitchState.OFF;
                    scheduler.execute(() -> switchTo(state));
                }
                break;
            case EWeLinkBindingConstants.CHANNEL_BLINK:
                if (command == OnOffType.ON) {
                    startBlink();
                } else if (command == OnOffType.OFF) {
                    cancelBlink();
                } else if (command == RefreshType.REFRESH) {
                    updateState(EWeLinkBindingConstants.CHANNEL_BLINK, isBlinking() ? OnOffType.ON : OnOffType.OFF);
                }
                break;
            default:
                logger.debug("Ignoring command {} for unknown channel {}", command, channelUID);
        }
    }

    void switchTo(SwitchState state) {
        AccountBridgeHandler bridgeHandler = getAccountBridgeHandler();
        if (bridgeHandler == null || cfg.deviceId.isBlank()) {
            logger.debug("Cannot switch {}: no account bridge or device id", getThing().getUID());
            return;
        }
        try {
            bridgeHandler.setDeviceState(cfg.deviceId, state);
            updateSwitchState(state);
            updateStatus(ThingStatus.ONLINE);
        } catch (EWeLinkApiException e) {
            logger.warn("Switching {} {} failed: {}", cfg.deviceId, state, e.getMessage());
            updateStatus(ThingStatus.OFFLINE, ThingStatusDetail.COMMUNICATION_ERROR, e.getMessage());
        }
    }

    void refreshStatus() {
        AccountBridgeHandler bridgeHandler = getAccountBridgeHandler();
        if (bridgeHandler == null) {
            return;
        }
        try {
            if (cfg.deviceId.isBlank() && !resolveDeviceId(bridgeHandler)) {
                return;
            }
            DeviceStatus status = bridgeHandler.getDeviceStatus(cfg.deviceId);
            SwitchState state = status.switchState;
            if (state != null) {
                updateSwitchState(state);
            } else {
                updateState(EWeLinkBindingConstants.CHANNEL_SWITCH, UnDefType.UNDEF);
            }
            if (status.online) {
                updateStatus(ThingStatus.ONLINE);
            } else {
                updateStatus(ThingStatus.OFFLINE, ThingStatusDetail.COMMUNICATION_ERROR,
                        "Device is not connected to the eWeLink cloud");
            }
        } catch (EWeLinkApiException e) {
            logger.debug("Status of {} not available: {}", cfg.deviceId, e.getMessage());
            updateStatus(ThingStatus.OFFLINE, ThingStatusDetail.COMMUNICATION_ERROR, e.getMessage());
        }
    }

    private boolean resolveDeviceId(AccountBridgeHandler bridgeHandler) throws EWeLinkApiException {
        String deviceId = bridgeHandler.findDeviceIdByName(cfg.deviceName);
        if (deviceId == null) {
            updateStatus(ThingStatus.OFFLINE, ThingStatusDetail.CONFIGURATION_ERROR,
                    "The account has no device named '" + cfg.deviceName + "'");
            return false;
        }
        logger.debug("Device '{}' of {} has id {}", cfg.deviceName, getThing().getUID(), deviceId);
        cfg.deviceId = deviceId;
        return true;
    }

    private void startBlink() {
        AccountBridgeHandler bridgeHandler = getAccountBridgeHandler();
        if (bridgeHandler == null || cfg.deviceId.isBlank()) {
            logger.debug("Cannot blink {}: no account bridge or device id", getThing().getUID());
            updateState(EWeLinkBindingConstants.CHANNEL_BLINK, OnOffType.OFF);
            return;
        }
        SwitchSequence sequence = cfg.blinkSequence();
        SequenceRunner runner = new SequenceRunner(bridgeHandler::setDeviceState);
        synchronized (blinkLock) {
            cancelBlinkLocked();
            activeRunner = runner;
            scheduler.execute(() -> runBlink(runner, sequence));
        }
    }

    void runBlink(SequenceRunner runner, SwitchSequence sequence) {
        updateState(EWeLinkBindingConstants.CHANNEL_BLINK, OnOffType.ON);
        try {
            SequenceRunner.Outcome outcome = runner.run(cfg.deviceId, sequence);
            SwitchState last = outcome.getLastCommandedState();
            if (last != null) {
                updateSwitchState(last);
            }
            logger.debug("Blink of {} finished after {} steps{}", cfg.deviceId, outcome.getCompletedSteps(),
                    outcome.isCancelled() ? " (cancelled)" : "");
        } catch (SequenceAbortedException e) {
            logger.warn("Blink of {} aborted: {}", cfg.deviceId, e.getMessage());
            SwitchState last = e.getLastCommandedState();
            if (last != null) {
                updateSwitchState(last);
            }
            updateStatus(ThingStatus.OFFLINE, ThingStatusDetail.COMMUNICATION_ERROR, e.getMessage());
        } finally {
            boolean superseded;
            synchronized (blinkLock) {
                if (activeRunner == runner) {
                    activeRunner = null;
                }
                superseded = activeRunner != null;
            }
            if (!superseded) {
                updateState(EWeLinkBindingConstants.CHANNEL_BLINK, OnOffType.OFF);
            }
        }
    }

    private void cancelBlink() {
        synchronized (blinkLock) {
            cancelBlinkLocked();
        }
    }

    private void cancelBlinkLocked() {
        SequenceRunner runner = activeRunner;
        if (runner != null) {
            runner.cancel();
            activeRunner = null;
        }
    }

    boolean isBlinking() {
        synchronized (blinkLock) {
            return activeRunner != null;
        }
    }

    private void updateSwitchState(SwitchState state) {
        updateState(EWeLinkBindingConstants.CHANNEL_SWITCH, state == SwitchState.ON ? OnOffType.ON : OnOffType.OFF);
    }

    public @Nullable AccountBridgeHandler getAccountBridgeHandler() {
        Bridge bridge = getBridge();
        if (bridge != null && bridge.getHandler() instanceof AccountBridgeHandler handler) {
            return handler;
        }
        return null;
    }

    @Override
    public void dispose() {
        cancelBlink();
        super.dispose();
    }
}
