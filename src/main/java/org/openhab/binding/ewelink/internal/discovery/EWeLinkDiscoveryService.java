package org.openhab.binding.ewelink.internal.discovery;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.ewelink.internal.AccountBridgeHandler;
import org.openhab.binding.ewelink.internal.EWeLinkBindingConstants;
import org.openhab.binding.ewelink.internal.api.EWeLinkApiException;
import org.openhab.binding.ewelink.internal.model.DeviceSummary;
import org.openhab.core.config.discovery.AbstractDiscoveryService;
import org.openhab.core.config.discovery.DiscoveryResultBuilder;
import org.openhab.core.config.discovery.DiscoveryService;
import org.openhab.core.thing.Bridge;
import org.openhab.core.thing.ThingStatus;
import org.openhab.core.thing.ThingTypeUID;
import org.openhab.core.thing.ThingUID;
import org.openhab.core.thing.binding.ThingHandler;
import org.openhab.core.thing.binding.ThingHandlerService;
import org.osgi.service.component.annotations.Component;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Discovers the devices of an eWeLink account.
 */
@NonNullByDefault
@Component(service = { DiscoveryService.class, ThingHandlerService.class }, configurationPid = "binding.ewelink")
public class EWeLinkDiscoveryService extends AbstractDiscoveryService implements ThingHandlerService {

    @SuppressWarnings("null")
    private static final Set<ThingTypeUID> SUPPORTED_THING_TYPES = Objects
            .requireNonNull(Set.of(EWeLinkBindingConstants.THING_TYPE_DEVICE));

    private final Logger logger = Objects.requireNonNull(LoggerFactory.getLogger(EWeLinkDiscoveryService.class));

    private @Nullable AccountBridgeHandler accountHandler;
    private @Nullable ScheduledFuture<?> bridgeOnlineRetry;

    public EWeLinkDiscoveryService() {
        super(SUPPORTED_THING_TYPES, 10, false);
    }

    @Override
    protected void startScan() {
        AccountBridgeHandler handler = accountHandler;
        if (handler == null) {
            logger.debug("Skipping discovery scan because account handler is not set");
            return;
        }

        Bridge bridge = handler.getThing();
        if (bridge.getStatus() != ThingStatus.ONLINE) {
            logger.debug("Skipping discovery scan because bridge {} is {}", bridge.getUID(), bridge.getStatus());
            return;
        }

        Instant scanTimestamp = Instant.now();
        List<DeviceSummary> devices;
        try {
            devices = handler.listDevices();
        } catch (EWeLinkApiException e) {
            logger.warn("Device discovery failed for {}: {}", bridge.getUID(), e.getMessage());
            return;
        }

        ThingUID bridgeUID = bridge.getUID();
        for (DeviceSummary summary : devices) {
            ThingUID thingUID = new ThingUID(EWeLinkBindingConstants.THING_TYPE_DEVICE, bridgeUID, summary.deviceId);
            DiscoveryResultBuilder resultBuilder = DiscoveryResultBuilder.create(thingUID).withBridge(bridgeUID)
                    .withRepresentationProperty(EWeLinkBindingConstants.PROPERTY_DEVICE_ID)
                    .withProperty(EWeLinkBindingConstants.PROPERTY_DEVICE_ID, summary.deviceId);

            String model = summary.model;
            if (model != null) {
                resultBuilder.withProperty(EWeLinkBindingConstants.PROPERTY_MODEL, model);
            }
            String brand = summary.brand;
            if (brand != null) {
                resultBuilder.withProperty(EWeLinkBindingConstants.PROPERTY_BRAND, brand);
            }
            String label = summary.name;
            resultBuilder.withLabel(label == null ? "eWeLink device " + summary.deviceId : label);

            thingDiscovered(resultBuilder.build());
        }
        removeOlderResults(scanTimestamp, bridgeUID);
    }

    @Override
    public void setThingHandler(ThingHandler handler) {
        if (handler instanceof AccountBridgeHandler accountBridgeHandler) {
            accountHandler = accountBridgeHandler;
            triggerScanWhenBridgeOnline(accountBridgeHandler);
        }
    }

    @Override
    public @Nullable ThingHandler getThingHandler() {
        return accountHandler;
    }

    @Override
    public void deactivate() {
        super.deactivate();
        cancelBridgeOnlineRetry();
        accountHandler = null;
    }

    private void triggerScanWhenBridgeOnline(AccountBridgeHandler handler) {
        if (handler.getThing().getStatus() == ThingStatus.ONLINE) {
            scheduler.execute(this::startScan);
            return;
        }

        ScheduledFuture<?> future = bridgeOnlineRetry;
        if (future == null || future.isDone()) {
            bridgeOnlineRetry = scheduler.schedule(this::retryScanWhenBridgeOnline, 2, TimeUnit.SECONDS);
        }
    }

    private void retryScanWhenBridgeOnline() {
        bridgeOnlineRetry = null;
        AccountBridgeHandler handler = accountHandler;
        if (handler != null) {
            triggerScanWhenBridgeOnline(handler);
        }
    }

    private void cancelBridgeOnlineRetry() {
        ScheduledFuture<?> future = bridgeOnlineRetry;
        if (future != null) {
            future.cancel(true);
            bridgeOnlineRetry = null;
        }
    }
}
