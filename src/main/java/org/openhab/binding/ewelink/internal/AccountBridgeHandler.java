package org.openhab.binding.ewelink.internal;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.ewelink.internal.api.CredentialStore;
import org.openhab.binding.ewelink.internal.api.DeviceCommandDispatcher;
import org.openhab.binding.ewelink.internal.api.EWeLinkApiException;
import org.openhab.binding.ewelink.internal.api.EWeLinkTransport;
import org.openhab.binding.ewelink.internal.api.ErrorKind;
import org.openhab.binding.ewelink.internal.api.TokenAcquisitionException;
import org.openhab.binding.ewelink.internal.api.TokenAcquisitionProtocol;
import org.openhab.binding.ewelink.internal.discovery.EWeLinkDiscoveryService;
import org.openhab.binding.ewelink.internal.model.AppIdentity;
import org.openhab.binding.ewelink.internal.model.AuthorizationCode;
import org.openhab.binding.ewelink.internal.model.DeviceStatus;
import org.openhab.binding.ewelink.internal.model.DeviceSummary;
import org.openhab.binding.ewelink.internal.model.SwitchState;
import org.openhab.binding.ewelink.internal.model.TokenSet;
import org.openhab.binding.ewelink.internal.util.RegionEndpointResolver;
import org.openhab.core.OpenHAB;
import org.openhab.core.config.core.Configuration;
import org.openhab.core.thing.Bridge;
import org.openhab.core.thing.ChannelUID;
import org.openhab.core.thing.ThingStatus;
import org.openhab.core.thing.ThingStatusDetail;
import org.openhab.core.thing.binding.BaseBridgeHandler;
import org.openhab.core.thing.binding.ThingHandlerService;
import org.openhab.core.types.Command;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Bridge for one eWeLink developer app and the account it is authorized for. Builds the cloud client from the
 * configuration and authenticates with whatever is available: a stored token, a captured authorization code or
 * the account password.
 */
@org.eclipse.jdt.annotation.NonNullByDefault
public class AccountBridgeHandler extends BaseBridgeHandler {
    private final Logger logger = Objects.requireNonNull(LoggerFactory.getLogger(AccountBridgeHandler.class));

    private @Nullable AccountConfiguration cfg;
    private @Nullable TokenAcquisitionProtocol protocol;
    private @Nullable DeviceCommandDispatcher dispatcher;

    public AccountBridgeHandler(Bridge bridge) {
        super(bridge);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Collection<Class<? extends ThingHandlerService>> getServices() {
        return Objects.requireNonNull((Collection<Class<? extends ThingHandlerService>>) (Object) Set
                .of(EWeLinkDiscoveryService.class, EWeLinkActions.class));
    }

    @Override
    public void initialize() {
        AccountConfiguration localCfg = AccountConfiguration.from(getConfig());
        cfg = localCfg;
        try {
            AppIdentity identity = localCfg.identity();
            JsonNode root = RegionEndpointResolver.loadTree(this.getClass().getClassLoader(),
                    localCfg.endpointsOverride);
            RegionEndpointResolver resolver = RegionEndpointResolver.fromTree(root);
            if (!localCfg.region.isBlank() && !resolver.preferRegion(localCfg.region)) {
                throw new IllegalArgumentException("Unknown region '" + localCfg.region + "'");
            }
            CredentialStore store = createCredentialStore(identity, credentialPath(localCfg));
            EWeLinkTransport transport = createTransport(Duration.ofSeconds(localCfg.timeoutSeconds));
            TokenAcquisitionProtocol localProtocol = new TokenAcquisitionProtocol(store, resolver, transport);
            protocol = localProtocol;
            dispatcher = new DeviceCommandDispatcher(store, localProtocol, transport);

            updateStatus(ThingStatus.UNKNOWN);
            scheduler.execute(this::authenticate);
        } catch (IOException | IllegalArgumentException e) {
            updateStatus(ThingStatus.OFFLINE, ThingStatusDetail.CONFIGURATION_ERROR, e.getMessage());
            logger.warn("Account init failed: {}", e.getMessage());
        }
    }

    protected CredentialStore createCredentialStore(AppIdentity identity, @Nullable Path file) {
        return new CredentialStore(identity, file);
    }

    protected EWeLinkTransport createTransport(Duration timeout) {
        return new EWeLinkTransport(timeout);
    }

    protected @Nullable Path credentialPath(AccountConfiguration localCfg) {
        if (!localCfg.credentialFile.isBlank()) {
            return Path.of(localCfg.credentialFile);
        }
        return Path.of(OpenHAB.getUserDataFolder(), EWeLinkBindingConstants.BINDING_ID, "credentials.json");
    }

    /**
     * Authenticates and updates the bridge status accordingly.
     */
    void authenticate() {
        try {
            authenticateWithAvailableCredentials();
            updateStatus(ThingStatus.ONLINE);
        } catch (EWeLinkApiException e) {
            updateStatusForFailure(e);
        }
    }

    private void updateStatusForFailure(EWeLinkApiException exception) {
        if (exception.getKind() == ErrorKind.UNAUTHENTICATED || exception.getKind() == ErrorKind.TOKEN_EXPIRED) {
            String url = authorizationUrlOrHint();
            logger.info("Account {} needs authorization, open {} and configure the returned code",
                    getThing().getUID(), url);
            updateStatus(ThingStatus.OFFLINE, ThingStatusDetail.CONFIGURATION_PENDING, "Authorize the app at " + url);
        } else if (exception instanceof TokenAcquisitionException e) {
            logger.warn("Authentication of {} failed: {}", getThing().getUID(), e.getMessage());
            if (e.isCodeExhausted()) {
                updateStatus(ThingStatus.OFFLINE, ThingStatusDetail.CONFIGURATION_ERROR,
                        "Authorization code was refused, capture a new one: " + authorizationUrlOrHint());
            } else if (e.getKind() == ErrorKind.CREDENTIALS_REJECTED) {
                updateStatus(ThingStatus.OFFLINE, ThingStatusDetail.CONFIGURATION_ERROR, e.getMessage());
            } else {
                updateStatus(ThingStatus.OFFLINE, ThingStatusDetail.COMMUNICATION_ERROR, e.getMessage());
            }
        } else {
            logger.warn("Authentication of {} failed: {}", getThing().getUID(), exception.getMessage());
            updateStatus(ThingStatus.OFFLINE, ThingStatusDetail.COMMUNICATION_ERROR, exception.getMessage());
        }
    }

    protected void authenticateWithAvailableCredentials() throws EWeLinkApiException {
        AccountConfiguration localCfg = Objects.requireNonNull(cfg);
        TokenAcquisitionProtocol localProtocol = requireProtocol();
        TokenSet stored = localProtocol.getStore().load();
        if (stored != null) {
            if (!stored.isExpired(Instant.now())) {
                return;
            }
            logger.debug("Stored token of {} expired, refreshing", getThing().getUID());
            try {
                localProtocol.refresh();
                return;
            } catch (EWeLinkApiException e) {
                if (e.getKind() != ErrorKind.TOKEN_EXPIRED) {
                    throw e;
                }
                logger.info("Stored token of {} cannot be renewed, logging in again: {}", getThing().getUID(),
                        e.getMessage());
                localProtocol.getStore().clear();
            }
        }
        loginWithConfiguredCredentials(localCfg, localProtocol);
    }

    private void loginWithConfiguredCredentials(AccountConfiguration localCfg, TokenAcquisitionProtocol localProtocol)
            throws EWeLinkApiException {
        if (localCfg.hasAuthorizationCode()) {
            try {
                localProtocol.exchange(new AuthorizationCode(localCfg.authorizationCode, Instant.now()),
                        localCfg.redirectUrl);
                forgetConfiguredAuthorizationCode();
                return;
            } catch (TokenAcquisitionException e) {
                if (!e.isCodeExhausted()) {
                    throw e;
                }
                forgetConfiguredAuthorizationCode();
                if (!localCfg.hasPasswordLogin()) {
                    throw e;
                }
                logger.info("Authorization code of {} was refused, trying the password login", getThing().getUID());
            }
        }
        if (localCfg.hasPasswordLogin()) {
            localProtocol.login(localCfg.email, localCfg.password, localCfg.countryCode);
            return;
        }
        throw new EWeLinkApiException(ErrorKind.UNAUTHENTICATED, "No stored token and no credentials configured");
    }

    /**
     * Replaces a token the provider no longer accepts with a new login, if the configuration allows one.
     *
     * @return true if a new token set is available
     */
    private synchronized boolean reauthenticate(EWeLinkApiException cause) {
        AccountConfiguration localCfg = cfg;
        TokenAcquisitionProtocol localProtocol = protocol;
        if (localCfg == null || localProtocol == null) {
            return false;
        }
        logger.info("Access of {} was lost ({}), logging in again", getThing().getUID(), cause.getMessage());
        localProtocol.getStore().clear();
        try {
            loginWithConfiguredCredentials(localCfg, localProtocol);
            updateStatus(ThingStatus.ONLINE);
            return true;
        } catch (EWeLinkApiException e) {
            updateStatusForFailure(e);
            return false;
        }
    }

    private <T> T withSession(DispatcherCall<T> call) throws EWeLinkApiException {
        try {
            return call.run(requireDispatcher());
        } catch (EWeLinkApiException e) {
            boolean accessLost = e.getKind() == ErrorKind.TOKEN_EXPIRED
                    || (e.getKind() == ErrorKind.UNAUTHENTICATED && dispatcher != null);
            if (!accessLost || !reauthenticate(e)) {
                throw e;
            }
            return call.run(requireDispatcher());
        }
    }

    private void forgetConfiguredAuthorizationCode() {
        // codes are single-use
        Configuration config = editConfiguration();
        config.remove(EWeLinkBindingConstants.CONFIG_AUTHORIZATION_CODE);
        updateConfiguration(config);
        AccountConfiguration localCfg = cfg;
        if (localCfg != null) {
            localCfg.authorizationCode = "";
        }
    }

    private String authorizationUrlOrHint() {
        try {
            return authorizationUrl();
        } catch (IllegalStateException e) {
            return "<configure redirectUrl to get the authorization URL>";
        }
    }

    /**
     * @throws IllegalStateException if the bridge is not initialized or has no redirect URL
     */
    public String authorizationUrl() {
        AccountConfiguration localCfg = cfg;
        if (localCfg == null || localCfg.redirectUrl.isBlank()) {
            throw new IllegalStateException("No redirectUrl configured");
        }
        return requireProtocol().authorizationUrl(localCfg.redirectUrl, getThing().getUID().getId());
    }

    /**
     * Exchanges a code captured from the OAuth redirect and brings the bridge online.
     */
    public TokenSet exchangeAuthorizationCode(String code) throws EWeLinkApiException {
        AccountConfiguration localCfg = Objects.requireNonNull(cfg);
        if (localCfg.redirectUrl.isBlank()) {
            throw new IllegalStateException("No redirectUrl configured");
        }
        TokenSet tokens = requireProtocol().exchange(new AuthorizationCode(code, Instant.now()),
                localCfg.redirectUrl);
        updateStatus(ThingStatus.ONLINE);
        return tokens;
    }

    public void setDeviceState(String deviceId, SwitchState state) throws EWeLinkApiException {
        withSession(localDispatcher -> {
            localDispatcher.setState(deviceId, state);
            return true;
        });
    }

    public DeviceStatus getDeviceStatus(String deviceId) throws EWeLinkApiException {
        return withSession(localDispatcher -> localDispatcher.getStatus(deviceId));
    }

    public List<DeviceSummary> listDevices() throws EWeLinkApiException {
        if (dispatcher == null) {
            return List.of();
        }
        return withSession(DeviceCommandDispatcher::listDevices);
    }

    /**
     * Looks a device up by its name in the eWeLink app, ignoring case.
     *
     * @return the device id, or null if the account has no device of that name
     */
    public @Nullable String findDeviceIdByName(String name) throws EWeLinkApiException {
        for (DeviceSummary device : listDevices()) {
            String deviceName = device.name;
            if (deviceName != null && deviceName.trim().equalsIgnoreCase(name.trim())) {
                return device.deviceId;
            }
        }
        return null;
    }

    public @Nullable TokenAcquisitionProtocol protocol() {
        return protocol;
    }

    private TokenAcquisitionProtocol requireProtocol() {
        TokenAcquisitionProtocol localProtocol = protocol;
        if (localProtocol == null) {
            throw new IllegalStateException("Account " + getThing().getUID() + " is not initialized");
        }
        return localProtocol;
    }

    private DeviceCommandDispatcher requireDispatcher() throws EWeLinkApiException {
        DeviceCommandDispatcher localDispatcher = dispatcher;
        if (localDispatcher == null) {
            throw new EWeLinkApiException(ErrorKind.UNAUTHENTICATED,
                    "Account " + getThing().getUID() + " is not initialized");
        }
        return localDispatcher;
    }

    @Override
    public void handleCommand(ChannelUID channelUID, Command command) {
        // no channels on bridge
    }

    @Override
    public void dispose() {
        dispatcher = null;
        protocol = null;
        super.dispose();
    }

    @FunctionalInterface
    private interface DispatcherCall<T> {
        T run(DeviceCommandDispatcher dispatcher) throws EWeLinkApiException;
    }
}
