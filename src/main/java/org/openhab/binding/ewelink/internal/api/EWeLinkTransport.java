package org.openhab.binding.ewelink.internal.api;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

/**
 * Sends requests to the eWeLink cloud. Every request is bounded by the configured timeout; transport failures
 * are reported as {@link ErrorKind#NETWORK_UNAVAILABLE} so that callers can move on to the next region.
 */
@NonNullByDefault
public class EWeLinkTransport {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(15);

    private static final String REDACTED_VALUE = "***REDACTED***";
    private static final Set<String> SENSITIVE_HEADERS = Set.of("authorization", "x-ck-nonce");
    private static final Set<String> SENSITIVE_JSON_FIELDS = Set.of("clientSecret", "password", "code", "accessToken",
            "refreshToken", "at", "rt");
    private static final Pattern QUERY_SECRET_PATTERN = Pattern.compile("((?:code|authorization)=)([^&\\s]+)",
            Pattern.CASE_INSENSITIVE);
    private static final int MAX_LOGGED_BODY = 1024;

    private final Logger logger = Objects.requireNonNull(LoggerFactory.getLogger(EWeLinkTransport.class));

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public EWeLinkTransport(Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).followRedirects(HttpClient.Redirect.NORMAL).build(),
                timeout);
    }

    public EWeLinkTransport(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    public ApiEnvelope post(URI uri, Map<String, String> headers, String body) throws EWeLinkApiException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri).POST(HttpRequest.BodyPublishers.ofString(body));
        return send(builder, headers, body);
    }

    public ApiEnvelope get(URI uri, Map<String, String> headers) throws EWeLinkApiException {
        return send(HttpRequest.newBuilder(uri).GET(), headers, null);
    }

    private ApiEnvelope send(HttpRequest.Builder builder, Map<String, String> headers, @Nullable String body)
            throws EWeLinkApiException {
        builder.timeout(requestTimeout);
        headers.forEach(builder::setHeader);
        HttpRequest request = builder.build();
        logRequest(request, body);
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new EWeLinkApiException(ErrorKind.NETWORK_UNAVAILABLE,
                    request.method() + " " + describeUri(request.uri()) + " timed out after " + requestTimeout, e);
        } catch (IOException e) {
            throw new EWeLinkApiException(ErrorKind.NETWORK_UNAVAILABLE,
                    request.method() + " " + describeUri(request.uri()) + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EWeLinkApiException(ErrorKind.CANCELLED,
                    request.method() + " " + describeUri(request.uri()) + " interrupted", e);
        }
        String bodyForLog = formatBodyForLog(response.body());
        logger.trace("Received HTTP {} {} response status={} body={}", request.method(),
                describeUri(request.uri()), response.statusCode(), bodyForLog);
        return new ApiEnvelope(response.statusCode(), response.body(), bodyForLog);
    }

    private void logRequest(HttpRequest request, @Nullable String requestBody) {
        if (!logger.isTraceEnabled()) {
            return;
        }
        logger.trace("Sending HTTP {} {} headers={} body={}", request.method(), describeUri(request.uri()),
                sanitizeHeaders(request), formatBodyForLog(requestBody));
    }

    private Map<String, List<String>> sanitizeHeaders(HttpRequest request) {
        Map<String, List<String>> sanitized = new LinkedHashMap<>();
        request.headers().map().forEach((name, values) -> {
            boolean sensitive = SENSITIVE_HEADERS.contains(name.toLowerCase(Locale.ROOT));
            List<String> sanitizedValues = new ArrayList<>(values.size());
            for (String value : values) {
                sanitizedValues.add(sensitive ? REDACTED_VALUE : value);
            }
            sanitized.put(name, sanitizedValues);
        });
        return sanitized;
    }

    static String describeUri(URI uri) {
        return QUERY_SECRET_PATTERN.matcher(uri.toString()).replaceAll("$1" + REDACTED_VALUE);
    }

    static String formatBodyForLog(@Nullable String body) {
        if (body == null) {
            return "<none>";
        }
        if (body.isEmpty()) {
            return "<empty>";
        }
        String sanitized = sanitizeBody(body);
        if (sanitized.length() > MAX_LOGGED_BODY) {
            sanitized = sanitized.substring(0, MAX_LOGGED_BODY) + "...";
        }
        return sanitized;
    }

    private static String sanitizeBody(String body) {
        try {
            JsonElement element = JsonParser.parseString(body);
            sanitizeJsonElement(element);
            return element.toString();
        } catch (JsonParseException e) {
            return body;
        }
    }

    private static void sanitizeJsonElement(JsonElement element) {
        if (element instanceof JsonObject obj) {
            for (Map.Entry<String, JsonElement> entry : obj.entrySet()) {
                if (SENSITIVE_JSON_FIELDS.contains(entry.getKey()) && entry.getValue().isJsonPrimitive()) {
                    entry.setValue(new JsonPrimitive(REDACTED_VALUE));
                } else {
                    sanitizeJsonElement(entry.getValue());
                }
            }
        } else if (element instanceof JsonArray array) {
            for (JsonElement child : array) {
                sanitizeJsonElement(child);
            }
        }
    }
}
