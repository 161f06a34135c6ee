package org.openhab.binding.ewelink.internal.api;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.ewelink.internal.api.TokenAcquisitionException.Attempt;
import org.openhab.binding.ewelink.internal.model.AppIdentity;
import org.openhab.binding.ewelink.internal.model.AuthorizationCode;
import org.openhab.binding.ewelink.internal.model.RegionEndpoint;
import org.openhab.binding.ewelink.internal.model.TokenSet;
import org.openhab.binding.ewelink.internal.util.RegionEndpointResolver;
import org.openhab.binding.ewelink.internal.util.RegionEndpointResolver.RegionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Obtains access tokens from the eWeLink cloud.
 * <p>
 * The provider's signature requirements for the token endpoints are not consistent, so every request is tried
 * with each {@link SignatureStrategy} in turn against each region. A "sign verification failed" answer moves on
 * to the next strategy, a transport or HTTP failure to the next region. Any other provider error means the
 * authorization code (or the password) was refused, which ends the acquisition: codes are single-use, so a
 * refused code is remembered and never sent again.
 */
@NonNullByDefault
public class TokenAcquisitionProtocol {
    public static final String TOKEN_PATH = "/v2/user/oauth/token";
    public static final String LOGIN_PATH = "/v2/user/login";
    public static final String REFRESH_PATH = "/v2/user/refresh";

    public static final Duration DEFAULT_CODE_MAX_AGE = Duration.ofMinutes(10);
    public static final Duration DEFAULT_TOKEN_LIFETIME = Duration.ofDays(30);

    private static final char[] NONCE_CHARS = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789"
            .toCharArray();

    public enum State {
        UNAUTHENTICATED,
        CODE_OBTAINED,
        TOKEN_ACQUIRED,
        EXPIRED,
        FAILED
    }

    private final Logger logger = Objects.requireNonNull(LoggerFactory.getLogger(TokenAcquisitionProtocol.class));

    private final CredentialStore store;
    private final RegionEndpointResolver resolver;
    private final EWeLinkTransport transport;
    private final SignatureEngine engine;
    private final List<SignatureStrategy> strategies;
    private final Duration codeMaxAge;
    private final Clock clock;

    private final Set<String> usedCodes = Collections.synchronizedSet(new HashSet<>());
    private volatile State state;
    private volatile @Nullable SignatureStrategy acceptedStrategy;
    private volatile int attemptLimit;

    public TokenAcquisitionProtocol(CredentialStore store, RegionEndpointResolver resolver,
            EWeLinkTransport transport) {
        this(store, resolver, transport, new SignatureEngine(), SignatureStrategy.ORDERED, DEFAULT_CODE_MAX_AGE,
                Clock.systemUTC());
    }

    public TokenAcquisitionProtocol(CredentialStore store, RegionEndpointResolver resolver,
            EWeLinkTransport transport, SignatureEngine engine, List<SignatureStrategy> strategies,
            Duration codeMaxAge, Clock clock) {
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one signature strategy is required");
        }
        this.store = Objects.requireNonNull(store, "store");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.strategies = List.copyOf(strategies);
        this.codeMaxAge = Objects.requireNonNull(codeMaxAge, "codeMaxAge");
        this.clock = Objects.requireNonNull(clock, "clock");

        TokenSet stored = store.load();
        if (stored == null) {
            state = State.UNAUTHENTICATED;
        } else {
            state = stored.isExpired(clock.instant()) ? State.EXPIRED : State.TOKEN_ACQUIRED;
        }
        resolver.preferRegion(store.lastKnownGoodRegionId());
    }

    public State getState() {
        return state;
    }

    public @Nullable SignatureStrategy getAcceptedStrategy() {
        return acceptedStrategy;
    }

    public CredentialStore getStore() {
        return store;
    }

    /**
     * Caps the requests of one exchange or login below the default of one per region and strategy.
     */
    void setAttemptLimit(int attemptLimit) {
        this.attemptLimit = attemptLimit;
    }

    /**
     * Records that the provider refused the current access token.
     */
    public void markExpired() {
        state = State.EXPIRED;
    }

    /**
     * Builds the signed OAuth page URL a person has to open to grant access and obtain an authorization code.
     */
    public String authorizationUrl(String redirectUrl, String oauthState) {
        AppIdentity identity = store.getIdentity();
        long seq = clock.millis();
        String signature = engine.sign(identity.getAppSecret(), engine.identityMessage(identity.getAppId(), seq));
        return resolver.getAuthorizeUrl() + "?state=" + encode(oauthState) + "&clientId=" + encode(identity.getAppId())
                + "&authorization=" + encode(signature) + "&seq=" + seq + "&redirectUrl=" + encode(redirectUrl)
                + "&nonce=" + nonce() + "&grantType=authorization_code&showQRCode=false";
    }

    /**
     * Asks {@code codeProvider} for a fresh authorization code and exchanges it.
     */
    public TokenSet acquire(AuthorizationCodeProvider codeProvider, String redirectUrl) throws EWeLinkApiException {
        AuthorizationCode code = codeProvider.obtainCode(authorizationUrl(redirectUrl, "ewelink-" + nonce()));
        return exchange(code, redirectUrl);
    }

    /**
     * Exchanges an authorization code for a token set and makes it the current one.
     *
     * @throws TokenAcquisitionException listing every attempt; {@link TokenAcquisitionException#isCodeExhausted()}
     *             tells whether a new code is needed
     */
    public TokenSet exchange(AuthorizationCode code, String redirectUrl) throws TokenAcquisitionException {
        if (usedCodes.contains(code.getCode())) {
            state = State.FAILED;
            throw new TokenAcquisitionException(ErrorKind.AUTHORIZATION_CODE_EXHAUSTED,
                    "Authorization code was already used; obtain a new one", List.of());
        }
        if (code.isOlderThan(codeMaxAge, clock.instant())) {
            usedCodes.add(code.getCode());
            state = State.FAILED;
            throw new TokenAcquisitionException(ErrorKind.AUTHORIZATION_CODE_EXHAUSTED,
                    "Authorization code obtained at " + code.getObtainedAt() + " is older than " + codeMaxAge,
                    List.of());
        }
        state = State.CODE_OBTAINED;

        AppIdentity identity = store.getIdentity();
        JsonObject payload = new JsonObject();
        payload.addProperty("clientId", identity.getAppId());
        payload.addProperty("clientSecret", identity.getAppSecret());
        payload.addProperty("grantType", "authorization_code");
        payload.addProperty("code", code.getCode());
        payload.addProperty("redirectUrl", redirectUrl);

        try {
            TokenSet tokens = acquireFromAnyRegion("Token exchange", TOKEN_PATH, payload,
                    ErrorKind.CODE_EXPIRED_OR_INVALID);
            usedCodes.add(code.getCode());
            return tokens;
        } catch (TokenAcquisitionException e) {
            if (e.isCodeExhausted()) {
                usedCodes.add(code.getCode());
            }
            throw e;
        }
    }

    /**
     * Logs in with the account's e-mail address and password.
     */
    public TokenSet login(String email, String password, String countryCode) throws TokenAcquisitionException {
        JsonObject payload = new JsonObject();
        payload.addProperty("email", email);
        payload.addProperty("password", password);
        payload.addProperty("countryCode", countryCode);
        return acquireFromAnyRegion("Password login", LOGIN_PATH, payload, ErrorKind.CREDENTIALS_REJECTED);
    }

    /**
     * Renews the current token set at the region that issued it.
     *
     * @throws EWeLinkApiException of kind {@link ErrorKind#TOKEN_EXPIRED} if there is no refresh token or the
     *             provider refused it, which means a new login is required
     */
    public TokenSet refresh() throws EWeLinkApiException {
        return store.withLock(() -> {
            TokenSet tokens = store.current();
            String refreshToken = tokens.getRefreshToken();
            if (refreshToken == null) {
                state = State.FAILED;
                throw new EWeLinkApiException(ErrorKind.TOKEN_EXPIRED,
                        "Access token expired and no refresh token is available; authorize again");
            }
            AppIdentity identity = store.getIdentity();
            JsonObject payload = new JsonObject();
            payload.addProperty("clientId", identity.getAppId());
            payload.addProperty("clientSecret", identity.getAppSecret());
            payload.addProperty("grantType", "refresh_token");
            payload.addProperty("refreshToken", refreshToken);
            payload.addProperty("rt", refreshToken);

            List<Attempt> attempts = new ArrayList<>();
            Accepted accepted;
            try {
                accepted = tryStrategies("Token refresh", tokens.getRegion(), REFRESH_PATH,
                        engine.canonicalize(payload), ErrorKind.TOKEN_EXPIRED, attempts, strategies.size());
            } catch (EWeLinkApiException e) {
                if (e.getKind() == ErrorKind.TOKEN_EXPIRED || e.getKind() == ErrorKind.SIGNATURE_REJECTED) {
                    state = State.FAILED;
                    throw new TokenAcquisitionException(ErrorKind.TOKEN_EXPIRED,
                            "Refresh token was refused; authorize again", attempts);
                }
                throw new TokenAcquisitionException(e.getKind(), "Token refresh failed", attempts);
            }
            TokenSet renewed = accepted.tokens;
            if (renewed.getRefreshToken() == null || renewed.getUserId() == null) {
                renewed = new TokenSet(renewed.getAccessToken(),
                        renewed.getRefreshToken() != null ? renewed.getRefreshToken() : refreshToken,
                        renewed.getObtainedAt(), renewed.getExpiresAt(), renewed.getRegion(),
                        renewed.getUserId() != null ? renewed.getUserId() : tokens.getUserId());
            }
            return accept(renewed, accepted.strategy);
        });
    }

    private TokenSet acquireFromAnyRegion(String operation, String path, JsonObject payload,
            ErrorKind providerErrorKind) throws TokenAcquisitionException {
        // the body is signed and sent in exactly this form
        String body = engine.canonicalize(payload);
        List<Attempt> attempts = new ArrayList<>();
        int combinations = strategies.size() * resolver.regions().size();
        int limit = attemptLimit;
        RetryPolicy policy = RetryPolicy.acquisition(limit > 0 ? Math.min(limit, combinations) : combinations);
        try {
            RegionResult<Accepted> result = resolver.tryEachRegion(region -> tryStrategies(operation, region, path,
                    body, providerErrorKind, attempts, policy.getMaxAttempts()), policy::isTerminal);
            resolver.rememberSuccess(result.getRegion());
            return accept(result.getValue().tokens, result.getValue().strategy);
        } catch (RegionsExhaustedException e) {
            state = State.FAILED;
            boolean onlySignatures = !attempts.isEmpty()
                    && attempts.stream().allMatch(a -> a.getKind() == ErrorKind.SIGNATURE_REJECTED);
            ErrorKind kind = onlySignatures ? ErrorKind.SIGNATURE_REJECTED : e.getKind();
            throw new TokenAcquisitionException(kind, operation + " failed in every region", attempts);
        } catch (EWeLinkApiException e) {
            state = State.FAILED;
            ErrorKind kind = e.getKind() == ErrorKind.CODE_EXPIRED_OR_INVALID ? ErrorKind.AUTHORIZATION_CODE_EXHAUSTED
                    : e.getKind();
            throw new TokenAcquisitionException(kind, operation + " was refused", attempts);
        }
    }

    private Accepted tryStrategies(String operation, RegionEndpoint region, String path, String body,
            ErrorKind providerErrorKind, List<Attempt> attempts, int maxAttempts) throws EWeLinkApiException {
        EWeLinkApiException last = null;
        for (SignatureStrategy strategy : strategyOrder()) {
            if (attempts.size() >= maxAttempts) {
                throw last != null ? last
                        : new EWeLinkApiException(ErrorKind.NETWORK_UNAVAILABLE,
                                operation + " gave up after " + maxAttempts + " attempts");
            }
            Map<String, String> headers = strategy.headers(engine, store.getIdentity(), body, clock.millis(),
                    nonce());
            EWeLinkApiException failure;
            try {
                ApiEnvelope envelope = transport.post(region.resolve(path), headers, body);
                if (envelope.isProviderSuccess()) {
                    TokenSet tokens = parseTokens(envelope.getData(), region);
                    if (tokens != null) {
                        logger.debug("{} succeeded in region {} with strategy {}", operation, region.getId(),
                                strategy);
                        return new Accepted(tokens, strategy);
                    }
                    failure = new EWeLinkApiException(ErrorKind.MALFORMED_RESPONSE,
                            operation + " succeeded without an access token");
                } else {
                    failure = envelope.toException(operation, providerErrorKind);
                }
            } catch (EWeLinkApiException e) {
                failure = e;
            }
            attempts.add(Attempt.of(region, strategy, failure));
            logger.debug("{} in region {} with strategy {} failed: {}", operation, region.getId(), strategy,
                    failure.getMessage());
            if (failure.getKind() != ErrorKind.SIGNATURE_REJECTED) {
                throw failure;
            }
            last = failure;
        }
        throw Objects.requireNonNull(last);
    }

    private List<SignatureStrategy> strategyOrder() {
        SignatureStrategy first = acceptedStrategy;
        // unsigned requests stay the last resort even after they worked once
        if (first == null || first == SignatureStrategy.UNSIGNED || !strategies.contains(first)) {
            return strategies;
        }
        List<SignatureStrategy> ordered = new ArrayList<>(strategies.size());
        ordered.add(first);
        for (SignatureStrategy strategy : strategies) {
            if (strategy != first) {
                ordered.add(strategy);
            }
        }
        return ordered;
    }

    private TokenSet accept(TokenSet tokens, SignatureStrategy strategy) throws EWeLinkApiException {
        acceptedStrategy = strategy;
        if (!store.save(tokens)) {
            logger.debug("A newer token set was stored meanwhile, keeping it");
            state = State.TOKEN_ACQUIRED;
            return store.current();
        }
        state = State.TOKEN_ACQUIRED;
        return tokens;
    }

    private @Nullable TokenSet parseTokens(JsonObject data, RegionEndpoint region) {
        String accessToken = firstString(data, "accessToken", "at");
        if (accessToken == null || accessToken.isBlank()) {
            return null;
        }
        Instant now = clock.instant();
        Instant expiresAt = now.plus(DEFAULT_TOKEN_LIFETIME);
        JsonElement expiry = data.get("atExpiredTime");
        if (expiry != null && expiry.isJsonPrimitive() && expiry.getAsJsonPrimitive().isNumber()) {
            expiresAt = Instant.ofEpochMilli(expiry.getAsLong());
        }
        String userId = null;
        JsonElement user = data.get("user");
        if (user != null && user.isJsonObject()) {
            userId = firstString(user.getAsJsonObject(), "apikey", "id", "email");
        }
        return new TokenSet(accessToken, firstString(data, "refreshToken", "rt"), now, expiresAt, region, userId);
    }

    private static @Nullable String firstString(JsonObject object, String... keys) {
        for (String key : keys) {
            JsonElement element = object.get(key);
            if (element != null && element.isJsonPrimitive()) {
                String value = element.getAsString();
                if (!value.isBlank()) {
                    return value;
                }
            }
        }
        return null;
    }

    private static String nonce() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        char[] chars = new char[8];
        for (int i = 0; i < chars.length; i++) {
            chars[i] = NONCE_CHARS[random.nextInt(NONCE_CHARS.length)];
        }
        return new String(chars);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static final class Accepted {
        final TokenSet tokens;
        final SignatureStrategy strategy;

        Accepted(TokenSet tokens, SignatureStrategy strategy) {
            this.tokens = tokens;
            this.strategy = strategy;
        }
    }
}
