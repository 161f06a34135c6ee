package org.openhab.binding.ewelink.internal.api;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.openhab.binding.ewelink.internal.model.AppIdentity;

/**
 * The ways of signing a token request that the provider has been seen to accept. The provider's expectation
 * differs between deployments, so acquisition tries them in declaration order.
 */
@NonNullByDefault
public enum SignatureStrategy {
    /** {@code Sign} over {@code appId_seq} plus nonce and sequence headers, as used by the OAuth page. */
    IDENTITY_TIMESTAMP {
        @Override
        public Map<String, String> headers(SignatureEngine engine, AppIdentity identity, String body,
                long timestampMillis, String nonce) {
            Map<String, String> headers = baseHeaders(identity, timestampMillis);
            headers.put("X-CK-Nonce", nonce);
            String message = engine.identityMessage(identity.getAppId(), timestampMillis);
            headers.put("Authorization", SignatureEngine.authorizationValue(engine.sign(identity.getAppSecret(),
                    message)));
            return headers;
        }
    },
    /** {@code Sign} over the exact JSON body that is transmitted. */
    JSON_BODY {
        @Override
        public Map<String, String> headers(SignatureEngine engine, AppIdentity identity, String body,
                long timestampMillis, String nonce) {
            Map<String, String> headers = baseHeaders(identity, timestampMillis);
            headers.put("Authorization", SignatureEngine.authorizationValue(engine.sign(identity.getAppSecret(),
                    body)));
            return headers;
        }
    },
    /** No signature at all. Last resort, mostly useful to tell signature problems from other rejections. */
    UNSIGNED {
        @Override
        public Map<String, String> headers(SignatureEngine engine, AppIdentity identity, String body,
                long timestampMillis, String nonce) {
            return baseHeaders(identity, timestampMillis);
        }
    };

    /** Strategies in the order they are tried. */
    public static final List<SignatureStrategy> ORDERED = List.of(IDENTITY_TIMESTAMP, JSON_BODY, UNSIGNED);

    /**
     * Builds the request headers for a body that is about to be sent. Pure: equal inputs give equal headers.
     */
    public abstract Map<String, String> headers(SignatureEngine engine, AppIdentity identity, String body,
            long timestampMillis, String nonce);

    private static Map<String, String> baseHeaders(AppIdentity identity, long timestampMillis) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "application/json");
        headers.put("X-CK-Appid", identity.getAppId());
        headers.put("X-CK-Seq", Long.toString(timestampMillis));
        return headers;
    }
}
