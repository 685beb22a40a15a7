package quest.gekko.creatorstats.service.analytics;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.creatorstats.domain.MetricSample;
import quest.gekko.creatorstats.repository.MetricSampleRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Append-only history of named metrics per (user, platform, identifier). A write with an explicit
 * recordedAt that matches an existing sample overwrites its value instead of appending.
 */
@Service
@RequiredArgsConstructor
public class MetricHistoryStore {
    public static final String ALL_PLATFORMS = "all";
    public static final String TOTAL_IDENTIFIER = "total";
    public static final String REVENUE_METRIC = "revenue";

    private final MetricSampleRepository sampleRepository;
    private final Clock clock;

    @Transactional
    public MetricSample record(final String userId, final String platform, final String identifier,
                               final String metric, final long value) {
        return record(userId, platform, identifier, metric, value, null);
    }

    @Transactional
    public MetricSample record(final String userId, final String platform, final String identifier,
                               final String metric, final long value, final Instant recordedAt) {
        if (value < 0) {
            throw new IllegalArgumentException("Metric value must be non-negative: " + metric + "=" + value);
        }
        if (recordedAt != null) {
            var existing = sampleRepository
                    .findFirstByUserIdAndPlatformNameAndPlatformIdentifierAndMetricNameAndRecordedAt(
                            userId, platform, identifier, metric, recordedAt);
            if (existing.isPresent()) {
                MetricSample sample = existing.get();
                sample.setMetricValue(value);
                return sampleRepository.save(sample);
            }
        }

        MetricSample sample = new MetricSample();
        sample.setUserId(userId);
        sample.setPlatformName(platform);
        sample.setPlatformIdentifier(identifier);
        sample.setMetricName(metric);
        sample.setMetricValue(value);
        Instant now = clock.instant();
        sample.setRecordedAt(recordedAt != null ? recordedAt : now);
        sample.setCreatedAt(now);
        return sampleRepository.save(sample);
    }

    /** Stores every non-null, non-negative metric; returns how many were written. */
    @Transactional
    public int recordPlatformMetrics(final String userId, final String platform, final String identifier,
                                     final Map<String, Long> metrics) {
        int written = 0;
        for (Map.Entry<String, Long> metric : metrics.entrySet()) {
            Long value = metric.getValue();
            if (value != null && value >= 0) {
                record(userId, platform, identifier, metric.getKey(), value);
                written++;
            }
        }
        return written;
    }

    @Transactional
    public MetricSample recordTotalRevenue(final String userId, final long totalRevenue) {
        return record(userId, ALL_PLATFORMS, TOTAL_IDENTIFIER, REVENUE_METRIC, totalRevenue);
    }

    /** Samples of one exact series recorded at or after {@code since}, oldest first. */
    @Transactional(readOnly = true)
    public List<MetricSample> findSeries(final String userId, final String platform, final String identifier,
                                         final String metric, final Instant since) {
        return sampleRepository.findSeries(userId, platform, identifier, metric, since);
    }

    @Transactional(readOnly = true)
    public List<MetricSample> revenueHistory(final String userId, final Instant since) {
        return findSeries(userId, ALL_PLATFORMS, TOTAL_IDENTIFIER, REVENUE_METRIC, since);
    }

    @Transactional
    public int purgeOlderThan(final Instant cutoff) {
        return sampleRepository.deleteRecordedBefore(cutoff);
    }
}
