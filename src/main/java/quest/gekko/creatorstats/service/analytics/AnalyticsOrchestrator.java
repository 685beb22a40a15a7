package quest.gekko.creatorstats.service.analytics;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.creatorstats.domain.AnalyticsSnapshot;
import quest.gekko.creatorstats.domain.PlatformRequest;
import quest.gekko.creatorstats.domain.PlatformShare;
import quest.gekko.creatorstats.domain.PlatformSnapshot;
import quest.gekko.creatorstats.service.stats.StatsCache;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToLongFunction;

/**
 * Combines cached platform snapshots with history-backed growth and trend figures.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnalyticsOrchestrator {
    private final StatsCache statsCache;
    private final GrowthAnalyticsEngine growthEngine;
    private final MetricHistoryStore metricHistoryStore;

    /**
     * Snapshots for every requested platform. For a known user, healthy snapshots get their growth from
     * stored history and their metrics appended to it.
     */
    public List<PlatformSnapshot> getAllPlatformStats(final List<PlatformRequest> requests, final String userId) {
        List<PlatformSnapshot> snapshots = statsCache.getAllStats(requests, userId);
        if (userId == null) {
            return snapshots;
        }
        return snapshots.stream()
                .map(snapshot -> snapshot.failed() ? snapshot : withHistory(snapshot, userId))
                .toList();
    }

    public AnalyticsSnapshot buildReport(final List<PlatformSnapshot> snapshots, final String userId) {
        long totalRevenue = snapshots.stream().mapToLong(PlatformSnapshot::revenue).sum();
        double totalGrowth = round1(snapshots.stream()
                .mapToDouble(PlatformSnapshot::growth)
                .filter(g -> g > 0)
                .average()
                .orElse(0.0));

        if (totalRevenue > 0 && userId != null) {
            try {
                metricHistoryStore.recordTotalRevenue(userId, totalRevenue);
            } catch (RuntimeException e) {
                log.warn("Could not store total revenue for user {}: {}", userId, e.getMessage());
            }
        }

        // revenue share, or audience share when nothing earns yet
        ToLongFunction<PlatformSnapshot> basis = totalRevenue > 0 ? PlatformSnapshot::revenue : PlatformSnapshot::audience;
        long basisTotal = snapshots.stream().mapToLong(basis).sum();

        List<PlatformShare> breakdown = snapshots.stream()
                .map(s -> new PlatformShare(s.platform(),
                        basisTotal > 0 ? round1(basis.applyAsLong(s) * 100.0 / basisTotal) : 0.0))
                .toList();

        PlatformSnapshot top = null;
        for (PlatformSnapshot snapshot : snapshots) {
            if (top == null || basis.applyAsLong(snapshot) > basis.applyAsLong(top)) {
                top = snapshot;
            }
        }

        List<Long> trend = growthEngine.revenueTrend(userId, totalRevenue);
        return new AnalyticsSnapshot(totalRevenue, totalGrowth, top != null ? top.platform() : null, trend, breakdown);
    }

    private PlatformSnapshot withHistory(final PlatformSnapshot snapshot, final String userId) {
        boolean bySubscribers = snapshot.subscribers() > 0;
        double growth = growthEngine.growthRate(userId, snapshot.platform(), snapshot.identifier(),
                bySubscribers ? "subscribers" : "followers",
                bySubscribers ? snapshot.subscribers() : snapshot.followers());
        try {
            metricHistoryStore.recordPlatformMetrics(userId, snapshot.platform(), snapshot.identifier(), metricsOf(snapshot));
        } catch (RuntimeException e) {
            log.warn("Could not store {} metrics for user {}: {}", snapshot.platform(), userId, e.getMessage());
        }
        return snapshot.withGrowth(growth);
    }

    private static Map<String, Long> metricsOf(final PlatformSnapshot snapshot) {
        Map<String, Long> metrics = new LinkedHashMap<>();
        metrics.put("subscribers", snapshot.subscribers());
        metrics.put("followers", snapshot.followers());
        metrics.put("views", snapshot.views());
        metrics.put("viewers", snapshot.viewers());
        metrics.put("revenue", snapshot.revenue());
        return metrics;
    }

    private static double round1(final double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
