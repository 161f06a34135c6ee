package org.openhab.binding.ewelink.internal;

import org.openhab.binding.ewelink.internal.api.EWeLinkTransport;
import org.openhab.binding.ewelink.internal.model.AppIdentity;
import org.openhab.core.config.core.Configuration;

public class AccountConfiguration {
    static final int MIN_TIMEOUT_SECONDS = 10;
    static final int MAX_TIMEOUT_SECONDS = 30;

    public String appId = "";
    public String appSecret = "";
    public String redirectUrl = "";
    public String authorizationCode = "";
    public String email = "";
    public String password = "";
    public String countryCode = "+1";
    public String region = "";
    public String endpointsOverride = "";
    public String credentialFile = "";
    public int timeoutSeconds = (int) EWeLinkTransport.DEFAULT_TIMEOUT.toSeconds();

    public static AccountConfiguration from(Configuration cfg) {
        AccountConfiguration c = new AccountConfiguration();
        c.appId = text(cfg, EWeLinkBindingConstants.CONFIG_APP_ID, c.appId);
        c.appSecret = text(cfg, EWeLinkBindingConstants.CONFIG_APP_SECRET, c.appSecret);
        c.redirectUrl = text(cfg, EWeLinkBindingConstants.CONFIG_REDIRECT_URL, c.redirectUrl);
        c.authorizationCode = text(cfg, EWeLinkBindingConstants.CONFIG_AUTHORIZATION_CODE, c.authorizationCode);
        c.email = text(cfg, EWeLinkBindingConstants.CONFIG_EMAIL, c.email);
        c.password = text(cfg, EWeLinkBindingConstants.CONFIG_PASSWORD, c.password);
        c.countryCode = text(cfg, EWeLinkBindingConstants.CONFIG_COUNTRY_CODE, c.countryCode);
        c.region = text(cfg, EWeLinkBindingConstants.CONFIG_REGION, c.region);
        c.endpointsOverride = text(cfg, EWeLinkBindingConstants.CONFIG_ENDPOINTS_OVERRIDE, c.endpointsOverride);
        c.credentialFile = text(cfg, EWeLinkBindingConstants.CONFIG_CREDENTIAL_FILE, c.credentialFile);
        Object timeout = cfg.get(EWeLinkBindingConstants.CONFIG_TIMEOUT_SECONDS);
        if (timeout instanceof Number) {
            c.timeoutSeconds = ((Number) timeout).intValue();
        } else if (timeout != null) {
            try {
                c.timeoutSeconds = Integer.parseInt(timeout.toString().trim());
            } catch (NumberFormatException e) {
                c.timeoutSeconds = (int) EWeLinkTransport.DEFAULT_TIMEOUT.toSeconds();
            }
        }
        c.timeoutSeconds = Math.max(MIN_TIMEOUT_SECONDS, Math.min(MAX_TIMEOUT_SECONDS, c.timeoutSeconds));
        return c;
    }

    private static String text(Configuration cfg, String key, String fallback) {
        Object value = cfg.get(key);
        if (value == null) {
            return fallback;
        }
        String s = value.toString().trim();
        return s.isEmpty() ? fallback : s;
    }

    /**
     * @throws IllegalArgumentException if app id or secret are missing
     */
    public AppIdentity identity() {
        return new AppIdentity(appId, appSecret);
    }

    public boolean hasAuthorizationCode() {
        return !authorizationCode.isBlank() && !redirectUrl.isBlank();
    }

    public boolean hasPasswordLogin() {
        return !email.isBlank() && !password.isBlank();
    }
}
