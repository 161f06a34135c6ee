package org.openhab.binding.ewelink.internal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.openhab.binding.ewelink.internal.api.CredentialStore;
import org.openhab.binding.ewelink.internal.api.DeviceCommandDispatcher;
import org.openhab.binding.ewelink.internal.api.FakeCloud;
import org.openhab.binding.ewelink.internal.api.FakeCloud.Reply;
import org.openhab.binding.ewelink.internal.api.FakeCloud.Request;
import org.openhab.binding.ewelink.internal.api.TokenAcquisitionProtocol;
import org.openhab.binding.ewelink.internal.model.AppIdentity;
import org.openhab.binding.ewelink.internal.model.SwitchState;
import org.openhab.binding.ewelink.internal.model.TokenSet;
import org.openhab.core.config.core.Configuration;
import org.openhab.core.thing.Bridge;
import org.openhab.core.thing.ThingStatus;
import org.openhab.core.thing.ThingStatusDetail;
import org.openhab.core.thing.binding.ThingHandlerCallback;
import org.openhab.core.thing.binding.builder.BridgeBuilder;

@NonNullByDefault
@SuppressWarnings("null")
class AccountBridgeHandlerTest {

    private static final String TOKEN_REPLY = "{\"error\":0,\"data\":{\"accessToken\":\"AT-1\","
            + "\"refreshToken\":\"RT-1\"}}";

    @TempDir
    Path dir;

    private FakeCloud cloud;
    private Path endpoints;
    private Path credentials;
    private final ThingHandlerCallback callback = mock(ThingHandlerCallback.class);
    private @Nullable AccountBridgeHandler handler;

    @BeforeEach
    void setUp() throws Exception {
        cloud = new FakeCloud();
        endpoints = dir.resolve("endpoints.json");
        Files.writeString(endpoints, cloud.endpointsJson("us", "eu"), StandardCharsets.UTF_8);
        credentials = dir.resolve("ewelink").resolve("credentials.json");
    }

    @AfterEach
    void tearDown() {
        AccountBridgeHandler localHandler = handler;
        if (localHandler != null) {
            localHandler.dispose();
        }
        cloud.close();
    }

    private Configuration baseConfig() {
        Configuration cfg = new Configuration();
        cfg.put(EWeLinkBindingConstants.CONFIG_APP_ID, "app-id");
        cfg.put(EWeLinkBindingConstants.CONFIG_APP_SECRET, "app-secret");
        cfg.put(EWeLinkBindingConstants.CONFIG_ENDPOINTS_OVERRIDE, endpoints.toString());
        cfg.put(EWeLinkBindingConstants.CONFIG_CREDENTIAL_FILE, credentials.toString());
        return cfg;
    }

    private AccountBridgeHandler initialize(Configuration cfg) {
        Bridge bridge = BridgeBuilder.create(EWeLinkBindingConstants.THING_TYPE_ACCOUNT, "test")
                .withConfiguration(cfg).build();
        AccountBridgeHandler localHandler = new AccountBridgeHandler(bridge);
        localHandler.setCallback(callback);
        handler = localHandler;
        localHandler.initialize();
        return localHandler;
    }

    private void verifyStatus(ThingStatus status, @Nullable ThingStatusDetail detail) {
        verify(callback, timeout(5000)).statusUpdated(any(), argThat(
                info -> info.getStatus() == status && (detail == null || info.getStatusDetail() == detail)));
    }

    @Test
    void missingSecretIsAConfigurationError() {
        Configuration cfg = baseConfig();
        cfg.remove(EWeLinkBindingConstants.CONFIG_APP_SECRET);

        initialize(cfg);

        verifyStatus(ThingStatus.OFFLINE, ThingStatusDetail.CONFIGURATION_ERROR);
        assertTrue(cloud.requests().isEmpty());
    }

    @Test
    void unknownRegionIsAConfigurationError() {
        Configuration cfg = baseConfig();
        cfg.put(EWeLinkBindingConstants.CONFIG_REGION, "mars");

        initialize(cfg);

        verifyStatus(ThingStatus.OFFLINE, ThingStatusDetail.CONFIGURATION_ERROR);
    }

    @Test
    void configuredCodeIsExchangedOnceAndPersisted() throws Exception {
        cloud.respond(request -> Reply.ok(TOKEN_REPLY));
        Configuration cfg = baseConfig();
        cfg.put(EWeLinkBindingConstants.CONFIG_REDIRECT_URL, "https://example.org/callback");
        cfg.put(EWeLinkBindingConstants.CONFIG_AUTHORIZATION_CODE, "code-1");

        AccountBridgeHandler localHandler = initialize(cfg);

        verifyStatus(ThingStatus.ONLINE, null);
        assertEquals(1, cloud.requestsTo(TokenAcquisitionProtocol.TOKEN_PATH).size());
        assertTrue(Files.readString(credentials, StandardCharsets.UTF_8).contains("AT-1"));
        assertNull(localHandler.getThing().getConfiguration().get(EWeLinkBindingConstants.CONFIG_AUTHORIZATION_CODE));
        verify(callback, timeout(5000)).thingUpdated(eq(localHandler.getThing()));
    }

    @Test
    void storedTokenNeedsNoRequest() throws Exception {
        new CredentialStore(new AppIdentity("app-id", "app-secret"), credentials).save(new TokenSet("AT-STORED",
                "RT", Instant.now(), Instant.now().plus(Duration.ofDays(1)), cloud.region("eu"), null));

        AccountBridgeHandler localHandler = initialize(baseConfig());

        verifyStatus(ThingStatus.ONLINE, null);
        assertTrue(cloud.requests().isEmpty());
        assertEquals("eu", localHandler.protocol().getStore().current().getRegion().getId());
    }

    @Test
    void passwordLoginIsUsedWithoutCode() {
        cloud.respond(request -> Reply.ok("{\"error\":0,\"data\":{\"at\":\"AT-L\",\"rt\":\"RT-L\"}}"));
        Configuration cfg = baseConfig();
        cfg.put(EWeLinkBindingConstants.CONFIG_EMAIL, "user@example.com");
        cfg.put(EWeLinkBindingConstants.CONFIG_PASSWORD, "pw");

        initialize(cfg);

        verifyStatus(ThingStatus.ONLINE, null);
        assertEquals(1, cloud.requestsTo(TokenAcquisitionProtocol.LOGIN_PATH).size());
    }

    @Test
    void rejectedPasswordIsAConfigurationError() {
        cloud.respond(request -> Reply.ok("{\"error\":10001,\"msg\":\"wrong account or password\"}"));
        Configuration cfg = baseConfig();
        cfg.put(EWeLinkBindingConstants.CONFIG_EMAIL, "user@example.com");
        cfg.put(EWeLinkBindingConstants.CONFIG_PASSWORD, "wrong");

        initialize(cfg);

        verifyStatus(ThingStatus.OFFLINE, ThingStatusDetail.CONFIGURATION_ERROR);
    }

    @Test
    void withoutCredentialsTheBridgeWaitsForAuthorization() {
        Configuration cfg = baseConfig();
        cfg.put(EWeLinkBindingConstants.CONFIG_REDIRECT_URL, "https://example.org/callback");

        AccountBridgeHandler localHandler = initialize(cfg);

        verifyStatus(ThingStatus.OFFLINE, ThingStatusDetail.CONFIGURATION_PENDING);
        assertTrue(cloud.requests().isEmpty());
        assertTrue(localHandler.authorizationUrl().startsWith(FakeCloud.AUTHORIZE_URL + "?state=test"));
    }

    @Test
    void expiredTokenWithoutRefreshTokenGivesWayToTheConfiguredCode() throws Exception {
        new CredentialStore(new AppIdentity("app-id", "app-secret"), credentials).save(new TokenSet("AT-OLD", null,
                Instant.now().minus(Duration.ofDays(2)), Instant.now().minus(Duration.ofDays(1)), cloud.region("eu"),
                null));
        cloud.respond(request -> Reply.ok(TOKEN_REPLY));
        Configuration cfg = baseConfig();
        cfg.put(EWeLinkBindingConstants.CONFIG_REDIRECT_URL, "https://example.org/callback");
        cfg.put(EWeLinkBindingConstants.CONFIG_AUTHORIZATION_CODE, "code-1");

        AccountBridgeHandler localHandler = initialize(cfg);

        verifyStatus(ThingStatus.ONLINE, null);
        assertEquals(1, cloud.requestsTo(TokenAcquisitionProtocol.TOKEN_PATH).size());
        assertEquals("AT-1", localHandler.protocol().getStore().current().getAccessToken());
        assertNull(localHandler.getThing().getConfiguration().get(EWeLinkBindingConstants.CONFIG_AUTHORIZATION_CODE));
    }

    @Test
    void refusedRefreshGivesWayToThePasswordLogin() throws Exception {
        new CredentialStore(new AppIdentity("app-id", "app-secret"), credentials).save(new TokenSet("AT-OLD",
                "RT-OLD", Instant.now().minus(Duration.ofDays(2)), Instant.now().minus(Duration.ofDays(1)),
                cloud.region("us"), null));
        cloud.respond(request -> TokenAcquisitionProtocol.REFRESH_PATH.equals(request.path)
                ? Reply.ok("{\"error\":10003,\"msg\":\"refresh token invalid\"}")
                : Reply.ok("{\"error\":0,\"data\":{\"at\":\"AT-L\",\"rt\":\"RT-L\"}}"));
        Configuration cfg = baseConfig();
        cfg.put(EWeLinkBindingConstants.CONFIG_EMAIL, "user@example.com");
        cfg.put(EWeLinkBindingConstants.CONFIG_PASSWORD, "pw");

        AccountBridgeHandler localHandler = initialize(cfg);

        verifyStatus(ThingStatus.ONLINE, null);
        assertEquals(1, cloud.requestsTo(TokenAcquisitionProtocol.REFRESH_PATH).size());
        assertEquals(1, cloud.requestsTo(TokenAcquisitionProtocol.LOGIN_PATH).size());
        assertEquals("AT-L", localHandler.protocol().getStore().current().getAccessToken());
    }

    @Test
    void refusedConfiguredCodeIsRemovedFromTheConfiguration() {
        cloud.respond(request -> Reply.ok("{\"error\":10004,\"msg\":\"code is invalid\"}"));
        Configuration cfg = baseConfig();
        cfg.put(EWeLinkBindingConstants.CONFIG_REDIRECT_URL, "https://example.org/callback");
        cfg.put(EWeLinkBindingConstants.CONFIG_AUTHORIZATION_CODE, "code-1");

        AccountBridgeHandler localHandler = initialize(cfg);

        verifyStatus(ThingStatus.OFFLINE, ThingStatusDetail.CONFIGURATION_ERROR);
        assertEquals(1, cloud.requests().size());
        assertNull(localHandler.getThing().getConfiguration().get(EWeLinkBindingConstants.CONFIG_AUTHORIZATION_CODE));
        verify(callback, timeout(5000)).thingUpdated(eq(localHandler.getThing()));
    }

    @Test
    void commandAfterLostAccessLogsInAgain() throws Exception {
        AtomicInteger logins = new AtomicInteger();
        cloud.respond(request -> {
            if (TokenAcquisitionProtocol.LOGIN_PATH.equals(request.path)) {
                String at = logins.incrementAndGet() == 1 ? "AT-L" : "AT-M";
                return Reply.ok("{\"error\":0,\"data\":{\"at\":\"" + at + "\",\"rt\":\"RT-L\"}}");
            }
            if (TokenAcquisitionProtocol.REFRESH_PATH.equals(request.path)) {
                return Reply.ok("{\"error\":10003,\"msg\":\"refresh token invalid\"}");
            }
            return "Bearer AT-M".equals(request.header("Authorization")) ? Reply.ok("{\"error\":0,\"data\":{}}")
                    : new Reply(401, "{\"error\":401,\"msg\":\"token\"}");
        });
        Configuration cfg = baseConfig();
        cfg.put(EWeLinkBindingConstants.CONFIG_EMAIL, "user@example.com");
        cfg.put(EWeLinkBindingConstants.CONFIG_PASSWORD, "pw");
        AccountBridgeHandler localHandler = initialize(cfg);
        verifyStatus(ThingStatus.ONLINE, null);

        localHandler.setDeviceState("1000abc", SwitchState.ON);

        assertEquals(2, cloud.requestsTo(TokenAcquisitionProtocol.LOGIN_PATH).size());
        List<Request> commands = cloud.requestsTo(DeviceCommandDispatcher.STATUS_PATH);
        assertEquals(2, commands.size());
        assertEquals("Bearer AT-M", commands.get(1).header("Authorization"));
    }
}
