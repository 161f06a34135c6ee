package org.openhab.binding.ewelink.internal.api;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

import org.eclipse.jdt.annotation.NonNullByDefault;

/**
 * How often an operation is attempted and which failures are worth another attempt.
 */
@NonNullByDefault
public final class RetryPolicy {
    private final int maxAttempts;
    private final Duration backoff;
    private final Set<ErrorKind> retryable;

    public RetryPolicy(int maxAttempts, Duration backoff, Set<ErrorKind> retryable) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.retryable = retryable.isEmpty() ? EnumSet.noneOf(ErrorKind.class) : EnumSet.copyOf(retryable);
    }

    /**
     * Token acquisition: one attempt per (region, strategy) combination, moving on after signature, transport
     * and protocol failures. Anything else is terminal.
     */
    public static RetryPolicy acquisition(int combinations) {
        return new RetryPolicy(Math.max(1, combinations), Duration.ZERO, EnumSet.of(ErrorKind.SIGNATURE_REJECTED,
                ErrorKind.NETWORK_UNAVAILABLE, ErrorKind.MALFORMED_RESPONSE, ErrorKind.HTTP_ERROR));
    }

    /**
     * Device commands: a single retry after the token has been refreshed.
     */
    public static RetryPolicy dispatch() {
        return new RetryPolicy(2, Duration.ZERO, EnumSet.of(ErrorKind.TOKEN_EXPIRED));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getBackoff() {
        return backoff;
    }

    public boolean isRetryable(ErrorKind kind) {
        return retryable.contains(kind);
    }

    public boolean isTerminal(EWeLinkApiException e) {
        return !isRetryable(e.getKind());
    }

    /**
     * @param attempt 1-based number of the attempt that just failed
     */
    public boolean shouldRetry(int attempt, EWeLinkApiException e) {
        return attempt < maxAttempts && isRetryable(e.getKind());
    }

    @Override
    public String toString() {
        return "RetryPolicy[maxAttempts=" + maxAttempts + ", backoff=" + backoff + ", retryable=" + retryable + "]";
    }
}
