package quest.gekko.creatorstats.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import quest.gekko.creatorstats.service.scheduling.CleanupReport;
import quest.gekko.creatorstats.service.scheduling.CredentialCleanupJob;
import quest.gekko.creatorstats.service.scheduling.MetricRetentionJob;
import quest.gekko.creatorstats.service.stats.CacheSummary;
import quest.gekko.creatorstats.service.stats.StatsCache;

import java.util.Map;

@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminController {

    private final CredentialCleanupJob credentialCleanupJob;
    private final MetricRetentionJob metricRetentionJob;
    private final StatsCache statsCache;

    // Manual credential sweep
    @PostMapping("/credentials/cleanup")
    public CleanupReport cleanupCredentials() {
        return credentialCleanupJob.cleanupExpiredTokens();
    }

    @PostMapping("/history/purge")
    public Map<String, Integer> purgeHistory() {
        return Map.of("removed", metricRetentionJob.purgeExpiredSamples());
    }

    // Used after a manual refresh request
    @PostMapping("/cache/invalidate")
    public ResponseEntity<Void> invalidateCache() {
        statsCache.invalidateAll();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/cache")
    public CacheSummary cache() {
        return statsCache.summary();
    }
}
