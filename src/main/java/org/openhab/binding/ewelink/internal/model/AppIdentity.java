package org.openhab.binding.ewelink.internal.model;

import java.util.Objects;

import org.eclipse.jdt.annotation.NonNullByDefault;

/**
 * The application credentials issued by the eWeLink developer console.
 */
@NonNullByDefault
public final class AppIdentity {
    private final String appId;
    private final String appSecret;

    public AppIdentity(String appId, String appSecret) {
        if (appId == null || appId.isBlank()) {
            throw new IllegalArgumentException("appId must not be empty");
        }
        if (appSecret == null || appSecret.isBlank()) {
            throw new IllegalArgumentException("appSecret must not be empty");
        }
        this.appId = appId.trim();
        this.appSecret = appSecret.trim();
    }

    public String getAppId() {
        return appId;
    }

    public String getAppSecret() {
        return appSecret;
    }

    @Override
    public boolean equals(@org.eclipse.jdt.annotation.Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AppIdentity)) {
            return false;
        }
        AppIdentity other = (AppIdentity) o;
        return appId.equals(other.appId) && appSecret.equals(other.appSecret);
    }

    @Override
    public int hashCode() {
        return Objects.hash(appId, appSecret);
    }

    @Override
    public String toString() {
        return "AppIdentity[appId=" + appId + "]";
    }
}
