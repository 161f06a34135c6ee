package org.openhab.binding.ewelink.internal.api;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.ewelink.internal.model.AppIdentity;
import org.openhab.binding.ewelink.internal.model.RegionEndpoint;
import org.openhab.binding.ewelink.internal.model.TokenSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

/**
 * Holds the current {@link TokenSet} of one {@link AppIdentity} and persists it to a JSON file shared with other
 * app ids. All writes go through one lock; a token obtained before the current one is never written over it.
 */
@NonNullByDefault
public class CredentialStore {
    private static final Type FILE_TYPE = new TypeToken<LinkedHashMap<String, StoredCredential>>() {
    }.getType();

    private final Logger logger = Objects.requireNonNull(LoggerFactory.getLogger(CredentialStore.class));
    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
    private final ReentrantLock lock = new ReentrantLock();

    private final AppIdentity identity;
    private final @Nullable Path file;
    private @Nullable TokenSet current;
    private @Nullable String lastKnownGoodRegion;
    private boolean loaded;

    /**
     * @param file credential file, or null to keep the credentials in memory only
     */
    public CredentialStore(AppIdentity identity, @Nullable Path file) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.file = file;
    }

    public AppIdentity getIdentity() {
        return identity;
    }

    public @Nullable Path getFile() {
        return file;
    }

    /**
     * Reads the record of this app id from disk, once. Later calls return the in-memory state.
     */
    public @Nullable TokenSet load() {
        lock.lock();
        try {
            if (!loaded) {
                loaded = true;
                StoredCredential stored = readAll().get(identity.getAppId());
                if (stored != null) {
                    lastKnownGoodRegion = stored.lastKnownGoodRegion;
                    current = stored.toTokenSet();
                    logger.debug("Loaded stored credentials for app {}: {}", identity.getAppId(), current);
                }
            }
            return current;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Makes {@code tokens} the current token set and persists it.
     *
     * @return false if the current token set was obtained after {@code tokens}; nothing is written then
     */
    public boolean save(TokenSet tokens) {
        lock.lock();
        try {
            load();
            TokenSet existing = current;
            if (existing != null && tokens.getObtainedAt().isBefore(existing.getObtainedAt())) {
                logger.debug("Discarding token set obtained at {}; the stored one is newer ({})",
                        tokens.getObtainedAt(), existing.getObtainedAt());
                return false;
            }
            current = tokens;
            lastKnownGoodRegion = tokens.getRegion().getId();
            persist();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @throws EWeLinkApiException of kind {@link ErrorKind#UNAUTHENTICATED} if there is no token set
     */
    public TokenSet current() throws EWeLinkApiException {
        TokenSet tokens = load();
        if (tokens == null) {
            throw new EWeLinkApiException(ErrorKind.UNAUTHENTICATED,
                    "No access token available for app " + identity.getAppId());
        }
        return tokens;
    }

    public @Nullable String lastKnownGoodRegionId() {
        lock.lock();
        try {
            load();
            return lastKnownGoodRegion;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forgets the token set. The last known good region is kept so the next login goes there first.
     */
    public void clear() {
        lock.lock();
        try {
            load();
            current = null;
            persist();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code action} while holding the write lock, so that a read-modify-write of the token set cannot
     * interleave with another one.
     */
    public <T> T withLock(LockedAction<T> action) throws EWeLinkApiException {
        lock.lock();
        try {
            return action.run();
        } finally {
            lock.unlock();
        }
    }

    private Map<String, StoredCredential> readAll() {
        Path localFile = file;
        if (localFile == null || !Files.exists(localFile)) {
            return new LinkedHashMap<>();
        }
        try (Reader reader = Files.newBufferedReader(localFile, StandardCharsets.UTF_8)) {
            Map<String, StoredCredential> all = gson.fromJson(reader, FILE_TYPE);
            return all == null ? new LinkedHashMap<>() : all;
        } catch (IOException | JsonParseException e) {
            logger.warn("Ignoring unreadable credential file {}: {}", localFile, e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    private void persist() {
        Path localFile = file;
        if (localFile == null) {
            return;
        }
        Map<String, StoredCredential> all = readAll();
        all.put(identity.getAppId(), StoredCredential.of(current, lastKnownGoodRegion));
        try {
            Path parent = localFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = localFile.resolveSibling(localFile.getFileName() + ".tmp");
            try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                gson.toJson(all, FILE_TYPE, writer);
            }
            Files.move(tmp, localFile, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            logger.warn("Could not write credential file {}, keeping credentials in memory only: {}", localFile,
                    e.getMessage());
        }
    }

    /**
     * Work done under the store's lock.
     */
    @FunctionalInterface
    public interface LockedAction<T> {
        T run() throws EWeLinkApiException;
    }

    /**
     * On-disk form of one app id's credentials.
     */
    static class StoredCredential {
        @Nullable
        String accessToken;
        @Nullable
        String refreshToken;
        long obtainedAt;
        @Nullable
        Long expiresAt;
        @Nullable
        String region;
        @Nullable
        String regionBaseUrl;
        @Nullable
        String userId;
        @Nullable
        String lastKnownGoodRegion;

        static StoredCredential of(@Nullable TokenSet tokens, @Nullable String lastKnownGoodRegion) {
            StoredCredential stored = new StoredCredential();
            stored.lastKnownGoodRegion = lastKnownGoodRegion;
            if (tokens != null) {
                stored.accessToken = tokens.getAccessToken();
                stored.refreshToken = tokens.getRefreshToken();
                stored.obtainedAt = tokens.getObtainedAt().toEpochMilli();
                Instant expiresAt = tokens.getExpiresAt();
                stored.expiresAt = expiresAt == null ? null : expiresAt.toEpochMilli();
                stored.region = tokens.getRegion().getId();
                stored.regionBaseUrl = tokens.getRegion().getBaseUrl();
                stored.userId = tokens.getUserId();
            }
            return stored;
        }

        @Nullable
        TokenSet toTokenSet() {
            String localToken = accessToken;
            String localRegion = region;
            String localBaseUrl = regionBaseUrl;
            if (localToken == null || localToken.isBlank() || localRegion == null || localBaseUrl == null) {
                return null;
            }
            Long localExpiry = expiresAt;
            return new TokenSet(localToken, refreshToken, Instant.ofEpochMilli(obtainedAt),
                    localExpiry == null ? null : Instant.ofEpochMilli(localExpiry),
                    new RegionEndpoint(localRegion, localBaseUrl), userId);
        }
    }
}
