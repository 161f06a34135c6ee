package org.openhab.binding.ewelink.internal.model;

import java.time.Instant;
import java.util.Objects;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;

/**
 * Access and refresh token pair together with the region that issued them.
 */
@NonNullByDefault
public final class TokenSet {
    private final String accessToken;
    private final @Nullable String refreshToken;
    private final Instant obtainedAt;
    private final @Nullable Instant expiresAt;
    private final RegionEndpoint region;
    private final @Nullable String userId;

    public TokenSet(String accessToken, @Nullable String refreshToken, Instant obtainedAt,
            @Nullable Instant expiresAt, RegionEndpoint region, @Nullable String userId) {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("Access token must not be empty");
        }
        this.accessToken = accessToken;
        this.refreshToken = refreshToken == null || refreshToken.isBlank() ? null : refreshToken;
        this.obtainedAt = Objects.requireNonNull(obtainedAt, "obtainedAt");
        this.expiresAt = expiresAt;
        this.region = Objects.requireNonNull(region, "region");
        this.userId = userId;
    }

    public String getAccessToken() {
        return accessToken;
    }

    public @Nullable String getRefreshToken() {
        return refreshToken;
    }

    public Instant getObtainedAt() {
        return obtainedAt;
    }

    public @Nullable Instant getExpiresAt() {
        return expiresAt;
    }

    public RegionEndpoint getRegion() {
        return region;
    }

    public @Nullable String getUserId() {
        return userId;
    }

    public boolean isExpired(Instant now) {
        Instant localExpiry = expiresAt;
        return localExpiry != null && !now.isBefore(localExpiry);
    }

    public boolean isIssuedBy(RegionEndpoint other) {
        return region.equals(other);
    }

    @Override
    public String toString() {
        return "TokenSet[region=" + region.getId() + ", obtainedAt=" + obtainedAt + ", expiresAt=" + expiresAt
                + ", refreshable=" + (refreshToken != null) + "]";
    }
}
