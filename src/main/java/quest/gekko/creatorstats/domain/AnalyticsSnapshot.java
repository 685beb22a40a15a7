package quest.gekko.creatorstats.domain;

import java.util.List;

/**
 * Cross-platform report. {@code monthlyTrend} always has six entries, oldest first.
 * {@code topPlatform} is null when no snapshots were supplied.
 */
public record AnalyticsSnapshot(
        long totalRevenue,
        double totalGrowth,
        String topPlatform,
        List<Long> monthlyTrend,
        List<PlatformShare> platformBreakdown
) {}
