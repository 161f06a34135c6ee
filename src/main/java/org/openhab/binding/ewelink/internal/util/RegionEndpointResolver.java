package org.openhab.binding.ewelink.internal.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.ewelink.internal.api.EWeLinkApiException;
import org.openhab.binding.ewelink.internal.api.ErrorKind;
import org.openhab.binding.ewelink.internal.api.RegionsExhaustedException;
import org.openhab.binding.ewelink.internal.model.RegionEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Knows the regional API clusters and tries them one after the other. The account's home region is not known
 * up front, so the first region that answers successfully is remembered and tried first from then on.
 */
@NonNullByDefault
public class RegionEndpointResolver {
    public static final String DEFAULTS_RESOURCE = "OH-INF/endpoints-defaults.json";

    private final Logger logger = Objects.requireNonNull(LoggerFactory.getLogger(RegionEndpointResolver.class));

    private final List<RegionEndpoint> configured;
    private final String authorizeUrl;
    private volatile @Nullable RegionEndpoint preferred;

    public RegionEndpointResolver(List<RegionEndpoint> regions, String authorizeUrl) {
        if (regions.isEmpty()) {
            throw new IllegalArgumentException("At least one region must be configured");
        }
        this.configured = List.copyOf(regions);
        this.authorizeUrl = Objects.requireNonNull(authorizeUrl, "authorizeUrl");
    }

    /**
     * Reads the endpoint configuration, preferring {@code overridePath} when it names an existing file.
     */
    public static JsonNode loadTree(ClassLoader cl, @Nullable String overridePath) throws IOException {
        ObjectMapper om = new ObjectMapper();
        if (overridePath != null && !overridePath.isBlank()) {
            Path p = Path.of(overridePath);
            if (Files.exists(p)) {
                try (InputStream in = Files.newInputStream(p)) {
                    return om.readTree(in);
                }
            }
        }
        try (InputStream in = cl.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IOException(DEFAULTS_RESOURCE + " not found in resources");
            }
            return om.readTree(in);
        }
    }

    public static RegionEndpointResolver fromTree(JsonNode root) {
        List<RegionEndpoint> regions = new ArrayList<>();
        for (JsonNode n : root.path("regions")) {
            String id = n.path("id").asText("");
            String baseUrl = n.path("baseUrl").asText("");
            if (id.isBlank() || baseUrl.isBlank()) {
                throw new IllegalArgumentException("Region entries need both id and baseUrl: " + n);
            }
            regions.add(new RegionEndpoint(id, baseUrl));
        }
        String authorizeUrl = root.path("oauth").path("authorizeUrl").asText("");
        if (authorizeUrl.isBlank()) {
            throw new IllegalArgumentException("No oauth.authorizeUrl configured");
        }
        return new RegionEndpointResolver(regions, authorizeUrl);
    }

    public String getAuthorizeUrl() {
        return authorizeUrl;
    }

    /**
     * @return the preferred region first, then the others in configured order
     */
    public List<RegionEndpoint> regions() {
        RegionEndpoint first = preferred;
        if (first == null) {
            return configured;
        }
        List<RegionEndpoint> ordered = new ArrayList<>(configured.size());
        ordered.add(first);
        for (RegionEndpoint region : configured) {
            if (!region.equals(first)) {
                ordered.add(region);
            }
        }
        return Collections.unmodifiableList(ordered);
    }

    public @Nullable RegionEndpoint find(@Nullable String id) {
        if (id == null || id.isBlank()) {
            return null;
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (RegionEndpoint region : configured) {
            if (region.getId().equals(normalized)) {
                return region;
            }
        }
        return null;
    }

    /**
     * Moves the region with the given id to the front.
     *
     * @return false if no such region is configured
     */
    public boolean preferRegion(@Nullable String id) {
        RegionEndpoint region = find(id);
        if (region == null) {
            logger.debug("Ignoring unknown preferred region '{}'", id);
            return false;
        }
        preferred = region;
        return true;
    }

    public void rememberSuccess(RegionEndpoint region) {
        if (!region.equals(preferred)) {
            logger.debug("Remembering {} as home region", region);
        }
        preferred = region;
    }

    public @Nullable RegionEndpoint getPreferredRegion() {
        return preferred;
    }

    /**
     * Runs {@code operation} against each region in turn until one succeeds. Only a cancellation stops early.
     */
    public <T> RegionResult<T> tryEachRegion(RegionOperation<T> operation) throws EWeLinkApiException {
        return tryEachRegion(operation, e -> e.getKind() == ErrorKind.CANCELLED);
    }

    /**
     * Runs {@code operation} against each region in turn until one succeeds. A failure matching
     * {@code isTerminal} is rethrown at once without trying the remaining regions.
     *
     * @throws RegionsExhaustedException if every region failed, with one entry per region in the order tried
     */
    public <T> RegionResult<T> tryEachRegion(RegionOperation<T> operation, Predicate<EWeLinkApiException> isTerminal)
            throws EWeLinkApiException {
        Map<RegionEndpoint, EWeLinkApiException> failures = new LinkedHashMap<>();
        for (RegionEndpoint region : regions()) {
            try {
                T value = operation.apply(region);
                return new RegionResult<>(value, region);
            } catch (EWeLinkApiException e) {
                if (isTerminal.test(e)) {
                    throw e;
                }
                logger.debug("Region {} failed ({}): {}", region.getId(), e.getKind(), e.getMessage());
                failures.put(region, e);
            }
        }
        throw new RegionsExhaustedException(failures);
    }

    /**
     * A network call bound to one region.
     */
    @FunctionalInterface
    public interface RegionOperation<T> {
        T apply(RegionEndpoint region) throws EWeLinkApiException;
    }

    /**
     * Value produced by the region that answered.
     */
    public static final class RegionResult<T> {
        private final T value;
        private final RegionEndpoint region;

        public RegionResult(T value, RegionEndpoint region) {
            this.value = value;
            this.region = region;
        }

        public T getValue() {
            return value;
        }

        public RegionEndpoint getRegion() {
            return region;
        }
    }
}
