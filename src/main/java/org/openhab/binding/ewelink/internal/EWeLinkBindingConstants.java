package org.openhab.binding.ewelink.internal;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.openhab.core.thing.ThingTypeUID;

@NonNullByDefault
public final class EWeLinkBindingConstants {

    public static final String BINDING_ID = "ewelink";

    // Thing Type UIDs
    public static final ThingTypeUID THING_TYPE_ACCOUNT = new ThingTypeUID(BINDING_ID, "account");
    public static final ThingTypeUID THING_TYPE_DEVICE = new ThingTypeUID(BINDING_ID, "device");

    // Account config parameters
    public static final String CONFIG_APP_ID = "appId";
    public static final String CONFIG_APP_SECRET = "appSecret";
    public static final String CONFIG_REDIRECT_URL = "redirectUrl";
    public static final String CONFIG_AUTHORIZATION_CODE = "authorizationCode";
    public static final String CONFIG_EMAIL = "email";
    public static final String CONFIG_PASSWORD = "password";
    public static final String CONFIG_COUNTRY_CODE = "countryCode";
    public static final String CONFIG_REGION = "region";
    public static final String CONFIG_ENDPOINTS_OVERRIDE = "endpointsOverride";
    public static final String CONFIG_CREDENTIAL_FILE = "credentialFile";
    public static final String CONFIG_TIMEOUT_SECONDS = "timeoutSeconds";

    // Device config parameters
    public static final String CONFIG_DEVICE_ID = "deviceId";
    public static final String CONFIG_DEVICE_NAME = "deviceName";
    public static final String CONFIG_BLINK_CYCLES = "blinkCycles";
    public static final String CONFIG_BLINK_INTERVAL_MS = "blinkIntervalMs";

    // Channels
    public static final String CHANNEL_SWITCH = "switch";
    public static final String CHANNEL_BLINK = "blink";

    // Discovery properties
    public static final String PROPERTY_DEVICE_ID = "deviceId";
    public static final String PROPERTY_MODEL = "model";
    public static final String PROPERTY_BRAND = "brand";

    private EWeLinkBindingConstants() {
        // utility class
    }
}
