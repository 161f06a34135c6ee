package org.openhab.binding.ewelink.internal;

import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.core.thing.Bridge;
import org.openhab.core.thing.Thing;
import org.openhab.core.thing.ThingTypeUID;
import org.openhab.core.thing.binding.BaseThingHandlerFactory;
import org.openhab.core.thing.binding.ThingHandler;
import org.openhab.core.thing.binding.ThingHandlerFactory;
import org.osgi.service.component.annotations.Activate;
import org.osgi.service.component.annotations.Component;

@NonNullByDefault
@Component(service = { ThingHandlerFactory.class, EWeLinkHandlerFactory.class })
public class EWeLinkHandlerFactory extends BaseThingHandlerFactory {

    @SuppressWarnings("null")
    private static final Set<ThingTypeUID> SUPPORTED_THING_TYPES = Set.of(EWeLinkBindingConstants.THING_TYPE_ACCOUNT,
            EWeLinkBindingConstants.THING_TYPE_DEVICE);

    @SuppressWarnings("null")
    private final Set<AccountBridgeHandler> accountHandlers = Collections.newSetFromMap(new ConcurrentHashMap<>());

    @Activate
    public EWeLinkHandlerFactory() {
    }

    @Override
    public boolean supportsThingType(ThingTypeUID thingTypeUID) {
        return SUPPORTED_THING_TYPES.contains(thingTypeUID);
    }

    @Override
    protected @Nullable ThingHandler createHandler(Thing thing) {
        ThingTypeUID thingTypeUID = thing.getThingTypeUID();

        if (thingTypeUID.equals(EWeLinkBindingConstants.THING_TYPE_ACCOUNT)) {
            AccountBridgeHandler handler = new AccountBridgeHandler((Bridge) thing);
            accountHandlers.add(handler);
            return handler;
        } else if (thingTypeUID.equals(EWeLinkBindingConstants.THING_TYPE_DEVICE)) {
            return new EWeLinkDeviceHandler(thing);
        }

        return null;
    }

    @Override
    protected void removeHandler(ThingHandler thingHandler) {
        super.removeHandler(thingHandler);
        if (thingHandler instanceof AccountBridgeHandler accountHandler) {
            accountHandlers.remove(accountHandler);
        }
    }

    public Set<AccountBridgeHandler> getAccountHandlers() {
        return accountHandlers;
    }
}
