package org.openhab.binding.ewelink.internal.api;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.eclipse.jdt.annotation.NonNullByDefault;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Computes the HMAC-SHA256 signatures the eWeLink cloud expects in the {@code Authorization: Sign ...} header.
 * Stateless; a single instance may be shared.
 */
@NonNullByDefault
public class SignatureEngine {

    private static final String ALGORITHM = "HmacSHA256";

    /**
     * Signs the UTF-8 bytes of {@code message} with {@code secret} and returns the base64 encoded digest.
     */
    public String sign(String secret, String message) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            byte[] digest = mac.doFinal(message.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(digest);
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }

    /**
     * Signs the canonical serialization of {@code body}. Callers that transmit the body must send
     * {@link #canonicalize(JsonObject)} of the same object, otherwise the signature will not verify.
     */
    public String sign(String secret, JsonObject body) {
        return sign(secret, canonicalize(body));
    }

    /**
     * Message of the identity-timestamp scheme: {@code appId_timestampMillis}.
     */
    public String identityMessage(String appId, long timestampMillis) {
        return appId + "_" + timestampMillis;
    }

    /**
     * Serializes {@code body} with recursively sorted keys and without whitespace.
     */
    public String canonicalize(JsonObject body) {
        return sorted(body).toString();
    }

    private JsonElement sorted(JsonElement element) {
        if (element.isJsonObject()) {
            JsonObject source = element.getAsJsonObject();
            List<String> keys = new ArrayList<>(source.keySet());
            Collections.sort(keys);
            JsonObject target = new JsonObject();
            for (String key : keys) {
                target.add(key, sorted(source.get(key)));
            }
            return target;
        }
        if (element.isJsonArray()) {
            JsonArray target = new JsonArray();
            for (JsonElement child : element.getAsJsonArray()) {
                target.add(sorted(child));
            }
            return target;
        }
        return element;
    }

    static String authorizationValue(String signature) {
        return "Sign " + signature;
    }
}
