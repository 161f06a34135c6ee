package org.openhab.binding.ewelink.internal.model;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;

/**
 * One regional eWeLink API cluster. An account and every token issued for it live in exactly one region.
 */
@NonNullByDefault
public final class RegionEndpoint {
    private final String id;
    private final String baseUrl;

    public RegionEndpoint(String id, String baseUrl) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Region id must not be empty");
        }
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Base URL of region " + id + " must not be empty");
        }
        this.id = id.trim().toLowerCase(Locale.ROOT);
        String trimmed = baseUrl.trim();
        this.baseUrl = trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    public String getId() {
        return id;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public URI resolve(String path) {
        return URI.create(baseUrl + path);
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RegionEndpoint)) {
            return false;
        }
        RegionEndpoint other = (RegionEndpoint) o;
        return id.equals(other.id) && baseUrl.equals(other.baseUrl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, baseUrl);
    }

    @Override
    public String toString() {
        return id.toUpperCase(Locale.ROOT) + "(" + baseUrl + ")";
    }
}
