package quest.gekko.creatorstats.service.stats;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import quest.gekko.creatorstats.domain.Credential;
import quest.gekko.creatorstats.domain.PlatformRequest;
import quest.gekko.creatorstats.domain.PlatformSnapshot;
import quest.gekko.creatorstats.exception.ProviderUnavailableException;
import quest.gekko.creatorstats.exception.ReauthRequiredException;
import quest.gekko.creatorstats.service.connector.ConnectorRegistry;
import quest.gekko.creatorstats.service.connector.PlatformConnector;
import quest.gekko.creatorstats.service.credential.CredentialLifecycleManager;
import quest.gekko.creatorstats.util.SingleFlight;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Short-lived, process-local cache in front of the provider stats connectors.
 * Concurrent misses on one key share a single upstream fetch.
 */
@Service
@Slf4j
public class StatsCache {
    private final Cache<StatsCacheKey, PlatformSnapshot> cache;
    private final CredentialLifecycleManager lifecycleManager;
    private final ConnectorRegistry connectorRegistry;
    private final Executor fetchExecutor;

    private final SingleFlight<StatsCacheKey, PlatformSnapshot> fills = new SingleFlight<>();

    public StatsCache(final Cache<StatsCacheKey, PlatformSnapshot> statsSnapshotCache,
                      final CredentialLifecycleManager lifecycleManager,
                      final ConnectorRegistry connectorRegistry,
                      @Qualifier("statsFetchExecutor") final Executor fetchExecutor) {
        this.cache = statsSnapshotCache;
        this.lifecycleManager = lifecycleManager;
        this.connectorRegistry = connectorRegistry;
        this.fetchExecutor = fetchExecutor;
    }

    /**
     * Cached snapshot for the key, fetching on a miss. With a userId the user's credential is used when one
     * can be obtained; otherwise the lookup is public.
     */
    public PlatformSnapshot getStats(final String platform, final String identifier, final String userId) {
        String name = ConnectorRegistry.normalize(platform);
        StatsCacheKey key = StatsCacheKey.of(name, identifier, userId);

        PlatformSnapshot cached = cache.getIfPresent(key);
        if (cached != null) {
            log.debug("Stats cache hit for {}", key);
            return cached;
        }
        return fills.execute(key, () -> {
            PlatformSnapshot filled = cache.getIfPresent(key);
            if (filled != null) {
                return filled;
            }
            log.debug("Stats cache miss for {}", key);
            PlatformConnector connector = connectorRegistry.require(name);
            Credential credential = userId != null ? resolveCredential(userId, name) : null;

            PlatformSnapshot snapshot = connector.fetchStats(identifier, credential);
            if (snapshot == null) {
                throw new ProviderUnavailableException(name, "empty stats response for " + identifier);
            }
            cache.put(key, snapshot);
            return snapshot;
        });
    }

    /**
     * One snapshot per request, in request order. Platforms are fetched concurrently; a failing platform yields a
     * zeroed fallback snapshot carrying the failure reason and never affects its siblings.
     */
    public List<PlatformSnapshot> getAllStats(final List<PlatformRequest> requests, final String userId) {
        List<CompletableFuture<PlatformSnapshot>> futures = requests.stream()
                .map(request -> CompletableFuture
                        .supplyAsync(() -> getStats(request.platform(), request.identifier(), userId), fetchExecutor)
                        .exceptionally(ex -> fallback(request, ex)))
                .toList();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    public void invalidateAll() {
        long size = cache.estimatedSize();
        cache.invalidateAll();
        log.info("Stats cache cleared ({} entries)", size);
    }

    public CacheSummary summary() {
        cache.cleanUp();
        List<String> entries = cache.asMap().keySet().stream().map(StatsCacheKey::toString).sorted().toList();
        return new CacheSummary(entries.size(), entries);
    }

    private Credential resolveCredential(final String userId, final String platform) {
        try {
            return lifecycleManager.getValidToken(userId, platform).orElse(null);
        } catch (ReauthRequiredException e) {
            log.warn("Falling back to a public {} lookup for user {}: {}", platform, userId, e.getMessage());
            return null;
        }
    }

    private static PlatformSnapshot fallback(final PlatformRequest request, final Throwable failure) {
        Throwable cause = failure instanceof CompletionException && failure.getCause() != null ? failure.getCause() : failure;
        String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        log.warn("Failed to fetch {} stats for {}: {}", request.platform(), request.identifier(), reason);
        return PlatformSnapshot.fallback(request.platform(), request.identifier(), reason);
    }
}
