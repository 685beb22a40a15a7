package quest.gekko.creatorstats.service.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import quest.gekko.creatorstats.config.CreatorStatsProperties;
import quest.gekko.creatorstats.service.analytics.MetricHistoryStore;

import java.time.Clock;
import java.time.Instant;

@Service
@RequiredArgsConstructor
@Slf4j
public class MetricRetentionJob {
    private final MetricHistoryStore metricHistoryStore;
    private final CreatorStatsProperties.History historyProperties;
    private final Clock clock;

    // 03:30 UTC daily unless overridden
    @Scheduled(cron = "${creator-stats.history.retention-cron:0 30 3 * * *}", zone = "UTC")
    public void runScheduledPurge() {
        purgeExpiredSamples();
    }

    public int purgeExpiredSamples() {
        Instant cutoff = clock.instant().minus(historyProperties.retention());
        int removed = metricHistoryStore.purgeOlderThan(cutoff);
        log.info("Purged {} metric samples recorded before {}", removed, cutoff);
        return removed;
    }
}
