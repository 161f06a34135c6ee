package org.openhab.binding.ewelink.internal.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.ewelink.internal.model.RegionEndpoint;

/**
 * Every candidate region failed. The failures are kept in the order the regions were tried.
 */
@NonNullByDefault
public class RegionsExhaustedException extends EWeLinkApiException {
    private static final long serialVersionUID = 1L;

    private final Map<RegionEndpoint, EWeLinkApiException> failures;

    public RegionsExhaustedException(Map<RegionEndpoint, EWeLinkApiException> failures) {
        super(lastKind(failures), "All regions failed: " + describe(failures), null, lastMessage(failures));
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public Map<RegionEndpoint, EWeLinkApiException> getFailures() {
        return failures;
    }

    private static String describe(Map<RegionEndpoint, EWeLinkApiException> failures) {
        if (failures.isEmpty()) {
            return "no regions configured";
        }
        return failures.entrySet().stream()
                .map(e -> e.getKey().getId() + "=" + e.getValue().getKind() + " (" + e.getValue().getMessage() + ")")
                .collect(Collectors.joining(", "));
    }

    private static ErrorKind lastKind(Map<RegionEndpoint, EWeLinkApiException> failures) {
        ErrorKind kind = ErrorKind.NETWORK_UNAVAILABLE;
        for (EWeLinkApiException e : failures.values()) {
            kind = e.getKind();
        }
        return kind;
    }

    private static @Nullable String lastMessage(Map<RegionEndpoint, EWeLinkApiException> failures) {
        String message = null;
        for (EWeLinkApiException e : failures.values()) {
            message = e.getProviderMessage();
        }
        return message;
    }
}
