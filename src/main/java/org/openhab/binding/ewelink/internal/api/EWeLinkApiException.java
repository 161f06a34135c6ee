package org.openhab.binding.ewelink.internal.api;

import java.util.Objects;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;

/**
 * Failure of an eWeLink cloud operation. Carries the raw provider code and message, when the provider sent one,
 * so that a human can tell which provider-side behaviour is at play.
 */
@NonNullByDefault
public class EWeLinkApiException extends Exception {
    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final @Nullable Integer providerCode;
    private final @Nullable String providerMessage;

    public EWeLinkApiException(ErrorKind kind, String message) {
        this(kind, message, null, null, null);
    }

    public EWeLinkApiException(ErrorKind kind, String message, @Nullable Throwable cause) {
        this(kind, message, null, null, cause);
    }

    public EWeLinkApiException(ErrorKind kind, String message, @Nullable Integer providerCode,
            @Nullable String providerMessage) {
        this(kind, message, providerCode, providerMessage, null);
    }

    public EWeLinkApiException(ErrorKind kind, String message, @Nullable Integer providerCode,
            @Nullable String providerMessage, @Nullable Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.providerCode = providerCode;
        this.providerMessage = providerMessage;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public @Nullable Integer getProviderCode() {
        return providerCode;
    }

    public @Nullable String getProviderMessage() {
        return providerMessage;
    }
}
