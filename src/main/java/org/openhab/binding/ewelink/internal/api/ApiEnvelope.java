package org.openhab.binding.ewelink.internal.api;

import java.util.Locale;
import java.util.Objects;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * Response of the eWeLink API: the HTTP status plus the {@code {error, msg, data}} envelope of the body.
 */
@NonNullByDefault
public class ApiEnvelope {
    static final String SIGNATURE_FAILURE_MESSAGE = "sign verification failed";

    private final int statusCode;
    private final String bodyForLog;
    private final @Nullable JsonObject json;

    public ApiEnvelope(int statusCode, @Nullable String body, String bodyForLog) {
        this.statusCode = statusCode;
        this.bodyForLog = bodyForLog;
        this.json = parse(body == null ? "" : body);
    }

    private static @Nullable JsonObject parse(String body) {
        if (body.isBlank()) {
            return null;
        }
        try {
            JsonElement element = JsonParser.parseString(body);
            return element.isJsonObject() ? element.getAsJsonObject() : null;
        } catch (JsonParseException e) {
            return null;
        }
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isSuccessful() {
        return statusCode / 100 == 2;
    }

    /**
     * @return true if the body is a JSON object carrying a numeric {@code error} field
     */
    public boolean isWellFormed() {
        JsonObject local = json;
        if (local == null || !local.has("error")) {
            return false;
        }
        JsonElement error = local.get("error");
        return error.isJsonPrimitive() && error.getAsJsonPrimitive().isNumber();
    }

    public @Nullable Integer getError() {
        return isWellFormed() ? Objects.requireNonNull(json).get("error").getAsInt() : null;
    }

    public @Nullable String getProviderMessage() {
        JsonObject local = json;
        if (local == null) {
            return null;
        }
        JsonElement msg = local.get("msg");
        return msg != null && msg.isJsonPrimitive() ? msg.getAsString() : null;
    }

    /**
     * @return the {@code data} object, or an empty object if absent
     */
    public JsonObject getData() {
        JsonObject local = json;
        if (local != null) {
            JsonElement data = local.get("data");
            if (data != null && data.isJsonObject()) {
                return data.getAsJsonObject();
            }
        }
        return new JsonObject();
    }

    public boolean isProviderSuccess() {
        Integer error = getError();
        return isSuccessful() && error != null && error == 0;
    }

    public boolean isSignatureRejected() {
        String msg = getProviderMessage();
        return msg != null && msg.toLowerCase(Locale.ROOT).contains(SIGNATURE_FAILURE_MESSAGE);
    }

    /**
     * The access token was refused: HTTP 401 or provider codes 401 / 402.
     */
    public boolean isTokenRejected() {
        if (statusCode == 401) {
            return true;
        }
        Integer error = getError();
        return error != null && (error == 401 || error == 402);
    }

    /**
     * Classifies an unsuccessful response.
     *
     * @param context what was attempted, used as the exception message
     * @param providerErrorKind kind used for well-formed provider errors other than a signature rejection
     */
    public EWeLinkApiException toException(String context, ErrorKind providerErrorKind) {
        Integer error = getError();
        String msg = getProviderMessage();
        if (isSignatureRejected()) {
            return new EWeLinkApiException(ErrorKind.SIGNATURE_REJECTED, context + " rejected: " + msg, error, msg);
        }
        if (!isSuccessful()) {
            return new EWeLinkApiException(ErrorKind.HTTP_ERROR, context + " failed with HTTP " + statusCode, error,
                    msg);
        }
        if (!isWellFormed()) {
            return new EWeLinkApiException(ErrorKind.MALFORMED_RESPONSE,
                    context + " returned an unexpected body: " + bodyForLog);
        }
        return new EWeLinkApiException(providerErrorKind, context + " rejected with error " + error + ": " + msg,
                error, msg);
    }
}
