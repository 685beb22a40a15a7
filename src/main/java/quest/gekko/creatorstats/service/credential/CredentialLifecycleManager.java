package quest.gekko.creatorstats.service.credential;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.creatorstats.domain.Credential;
import quest.gekko.creatorstats.domain.CredentialKey;
import quest.gekko.creatorstats.domain.TokenGrant;
import quest.gekko.creatorstats.exception.CorruptCredentialException;
import quest.gekko.creatorstats.exception.ProviderAuthException;
import quest.gekko.creatorstats.exception.ReauthRequiredException;
import quest.gekko.creatorstats.service.connector.ConnectorRegistry;
import quest.gekko.creatorstats.service.connector.PlatformConnector;
import quest.gekko.creatorstats.util.SingleFlight;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Hands out usable credentials. Expiry is detected lazily on read; an expired credential is refreshed
 * through the platform's connector, and any refresh failure evicts the stored record.
 *
 * <p>Concurrent refreshes of the same (user, platform) inside this process share one provider call.
 * Across processes the last successful write wins.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CredentialLifecycleManager {

    public enum SweepOutcome { VALID, REFRESHED, EVICTED, MISSING }

    private final CredentialStore credentialStore;
    private final ConnectorRegistry connectorRegistry;
    private final Clock clock;

    private final SingleFlight<String, Optional<Credential>> refreshFlights = new SingleFlight<>();

    /**
     * @return the stored credential, refreshed first when expired; empty when none is stored
     * @throws ReauthRequiredException when the credential was unreadable or could not be refreshed and has been removed
     */
    public Optional<Credential> getValidToken(final String userId, final String platform) {
        String key = ConnectorRegistry.normalize(platform);
        Optional<Credential> stored = load(userId, key);
        if (stored.isEmpty() || !stored.get().isExpiredAt(clock.instant())) {
            return stored;
        }
        return refreshExpired(userId, key);
    }

    /** Write path for a freshly completed authorization. */
    public Credential storeCredential(final String userId, final String platform, final TokenGrant grant) {
        if (grant.accessToken() == null || grant.accessToken().isBlank()) {
            throw new IllegalArgumentException("Token grant has no access token");
        }
        String key = ConnectorRegistry.normalize(platform);
        Credential credential = new Credential(userId, key, grant.accessToken(), grant.refreshToken(),
                grant.expiresAt(clock.instant()), grant.scope(), grant.tokenType());
        credentialStore.save(credential);
        log.info("Stored {} credential for user {} (expires {})", key, userId, credential.expiresAt());
        return credential;
    }

    /** Idempotent disconnect. */
    public boolean removeCredential(final String userId, final String platform) {
        boolean removed = credentialStore.delete(userId, ConnectorRegistry.normalize(platform));
        if (removed) {
            log.info("Removed {} credential for user {}", platform, userId);
        }
        return removed;
    }

    /** Registered platforms for which a usable credential can currently be obtained. */
    public List<String> connectedPlatforms(final String userId) {
        List<String> connected = new ArrayList<>();
        for (String platform : connectorRegistry.platforms()) {
            try {
                if (getValidToken(userId, platform).isPresent()) {
                    connected.add(platform);
                }
            } catch (ReauthRequiredException e) {
                log.info("User {} lost their {} connection: {}", userId, platform, e.getMessage());
            }
        }
        return connected;
    }

    /**
     * Refresh-or-evict pass over one stored record, used by the scheduled cleanup.
     * Records that are unreadable are evicted even when not expired.
     */
    public SweepOutcome sweep(final CredentialKey key) {
        try {
            Optional<Credential> stored = load(key.userId(), key.platform());
            if (stored.isEmpty()) {
                return SweepOutcome.MISSING;
            }
            if (!stored.get().isExpiredAt(clock.instant())) {
                return SweepOutcome.VALID;
            }
            return refreshExpired(key.userId(), key.platform()).isPresent() ? SweepOutcome.REFRESHED : SweepOutcome.MISSING;
        } catch (ReauthRequiredException e) {
            return SweepOutcome.EVICTED;
        }
    }

    private Optional<Credential> refreshExpired(final String userId, final String platform) {
        return refreshFlights.execute(userId + ":" + platform, () -> {
            // Re-read inside the flight: an earlier flight may already have refreshed or evicted it.
            Optional<Credential> current = load(userId, platform);
            if (current.isEmpty() || !current.get().isExpiredAt(clock.instant())) {
                return current;
            }
            return Optional.of(refresh(current.get()));
        });
    }

    private Credential refresh(final Credential expired) {
        String userId = expired.userId();
        String platform = expired.platform();

        if (!expired.canRefresh()) {
            evict(userId, platform, "expired and has no refresh token");
            throw new ReauthRequiredException(userId, platform, "credential expired and cannot be refreshed");
        }

        PlatformConnector connector = connectorRegistry.require(platform);
        log.info("Refreshing expired {} credential for user {}", platform, userId);

        TokenGrant grant;
        try {
            grant = connector.refresh(expired.refreshToken());
            validate(platform, grant);
        } catch (RuntimeException e) {
            evict(userId, platform, "refresh failed: " + e.getMessage());
            throw new ReauthRequiredException(userId, platform, "token refresh failed", e);
        }

        Credential refreshed = expired.refreshedWith(grant, clock.instant());
        credentialStore.save(refreshed);
        log.info("Refreshed {} credential for user {} (expires {})", platform, userId, refreshed.expiresAt());
        return refreshed;
    }

    private Optional<Credential> load(final String userId, final String platform) {
        try {
            return credentialStore.find(userId, platform);
        } catch (CorruptCredentialException e) {
            evict(userId, platform, e.getMessage());
            throw new ReauthRequiredException(userId, platform, "stored credential is unreadable", e);
        }
    }

    private void evict(final String userId, final String platform, final String reason) {
        log.warn("Evicting {} credential for user {}: {}", platform, userId, reason);
        credentialStore.delete(userId, platform);
    }

    private static void validate(final String platform, final TokenGrant grant) {
        if (grant == null || grant.accessToken() == null || grant.accessToken().isBlank()) {
            throw new ProviderAuthException(platform, "refresh response carried no access token");
        }
        if (grant.expiresInSeconds() != null && grant.expiresInSeconds() <= 0) {
            throw new ProviderAuthException(platform, "refresh response carried a non-positive expiry");
        }
    }
}
