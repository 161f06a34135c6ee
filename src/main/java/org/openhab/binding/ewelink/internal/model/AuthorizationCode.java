package org.openhab.binding.ewelink.internal.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

import org.eclipse.jdt.annotation.NonNullByDefault;

/**
 * A single-use authorization code captured from the OAuth redirect.
 */
@NonNullByDefault
public final class AuthorizationCode {
    private final String code;
    private final Instant obtainedAt;

    public AuthorizationCode(String code, Instant obtainedAt) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Authorization code must not be empty");
        }
        this.code = code.trim();
        this.obtainedAt = Objects.requireNonNull(obtainedAt, "obtainedAt");
    }

    public String getCode() {
        return code;
    }

    public Instant getObtainedAt() {
        return obtainedAt;
    }

    public boolean isOlderThan(Duration maxAge, Instant now) {
        return obtainedAt.plus(maxAge).isBefore(now);
    }

    @Override
    public String toString() {
        // the code itself is a credential
        return "AuthorizationCode[obtainedAt=" + obtainedAt + "]";
    }
}
