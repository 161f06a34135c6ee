package org.openhab.binding.ewelink.internal.api;

import java.util.List;
import java.util.stream.Collectors;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.ewelink.internal.model.RegionEndpoint;

/**
 * Aggregated failure of a token acquisition listing every attempted (region, signature strategy) combination.
 * {@link ErrorKind#AUTHORIZATION_CODE_EXHAUSTED} means a new authorization code is needed,
 * {@link ErrorKind#SIGNATURE_REJECTED} means no strategy was accepted and the same code may be retried.
 */
@NonNullByDefault
public class TokenAcquisitionException extends EWeLinkApiException {
    private static final long serialVersionUID = 1L;

    private final List<Attempt> attempts;

    public TokenAcquisitionException(ErrorKind kind, String message, List<Attempt> attempts) {
        super(kind, message + describe(attempts), lastCode(attempts), lastMessage(attempts));
        this.attempts = List.copyOf(attempts);
    }

    public List<Attempt> getAttempts() {
        return attempts;
    }

    public boolean isCodeExhausted() {
        return getKind() == ErrorKind.AUTHORIZATION_CODE_EXHAUSTED;
    }

    private static String describe(List<Attempt> attempts) {
        if (attempts.isEmpty()) {
            return "";
        }
        return attempts.stream().map(Attempt::toString).collect(Collectors.joining("; ", " [", "]"));
    }

    private static @Nullable Integer lastCode(List<Attempt> attempts) {
        return attempts.isEmpty() ? null : attempts.get(attempts.size() - 1).getProviderCode();
    }

    private static @Nullable String lastMessage(List<Attempt> attempts) {
        return attempts.isEmpty() ? null : attempts.get(attempts.size() - 1).getMessage();
    }

    /**
     * One request sent during an acquisition and how it failed.
     */
    public static final class Attempt {
        private final RegionEndpoint region;
        private final SignatureStrategy strategy;
        private final ErrorKind kind;
        private final @Nullable Integer providerCode;
        private final String message;

        public Attempt(RegionEndpoint region, SignatureStrategy strategy, ErrorKind kind,
                @Nullable Integer providerCode, String message) {
            this.region = region;
            this.strategy = strategy;
            this.kind = kind;
            this.providerCode = providerCode;
            this.message = message;
        }

        static Attempt of(RegionEndpoint region, SignatureStrategy strategy, EWeLinkApiException e) {
            String message = e.getProviderMessage();
            if (message == null || message.isBlank()) {
                message = e.getMessage();
            }
            return new Attempt(region, strategy, e.getKind(), e.getProviderCode(), message == null ? "" : message);
        }

        public RegionEndpoint getRegion() {
            return region;
        }

        public SignatureStrategy getStrategy() {
            return strategy;
        }

        public ErrorKind getKind() {
            return kind;
        }

        public @Nullable Integer getProviderCode() {
            return providerCode;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            return region.getId() + "/" + strategy + ": " + kind + (message.isEmpty() ? "" : " (" + message + ")");
        }
    }
}
