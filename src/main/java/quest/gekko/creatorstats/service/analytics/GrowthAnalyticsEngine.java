package quest.gekko.creatorstats.service.analytics;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.creatorstats.domain.MetricSample;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.random.RandomGenerator;
import java.util.stream.Collectors;

/**
 * Growth percentages and monthly revenue trends derived from {@link MetricHistoryStore}.
 * Storage failures never propagate out of here; callers get 0 or a synthesized trend instead.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GrowthAnalyticsEngine {
    public static final int TREND_MONTHS = 6;
    public static final Duration GROWTH_LOOKBACK = Duration.ofDays(30);

    private static final double SYNTHETIC_START = 0.85;
    private static final double SYNTHETIC_FLOOR = 0.60;
    private static final double SYNTHETIC_CEILING = 1.20;
    private static final double JITTER_MIN = 0.95;
    private static final double JITTER_SPAN = 0.10;

    private final MetricHistoryStore metricHistoryStore;
    private final Clock clock;
    private final RandomGenerator trendJitter;

    /**
     * Percentage change between the oldest sample of the last 30 days and {@code currentValue}, rounded to
     * two decimals. 0 when there is no history, the oldest value is 0, or nothing changed.
     */
    public double growthRate(final String userId, final String platform, final String identifier,
                             final String metric, final long currentValue) {
        try {
            Instant since = clock.instant().minus(GROWTH_LOOKBACK);
            List<MetricSample> samples = metricHistoryStore.findSeries(userId, platform, identifier, metric, since);
            if (samples.isEmpty()) {
                return 0.0;
            }
            long oldest = samples.get(0).getMetricValue();
            if (oldest == 0 || oldest == currentValue) {
                return 0.0;
            }
            return round2((currentValue - oldest) / (double) oldest * 100.0);
        } catch (RuntimeException e) {
            log.warn("Growth rate for {}/{}/{} unavailable: {}", platform, identifier, metric, e.getMessage());
            return 0.0;
        }
    }

    /**
     * Six monthly revenue values, oldest first, ending with the current calendar month (UTC).
     * Built from stored totals when any exist in the last six months, synthesized otherwise.
     */
    public List<Long> revenueTrend(final String userId, final long currentTotalRevenue) {
        if (userId == null) {
            return synthesizeTrend(currentTotalRevenue);
        }
        try {
            ZonedDateTime now = clock.instant().atZone(ZoneOffset.UTC);
            List<MetricSample> history = metricHistoryStore.revenueHistory(userId, now.minusMonths(TREND_MONTHS).toInstant());
            if (history.isEmpty()) {
                return synthesizeTrend(currentTotalRevenue);
            }
            return fillTrailingMonths(monthlyAverages(history), YearMonth.from(now));
        } catch (RuntimeException e) {
            log.warn("Revenue trend for user {} unavailable, synthesizing: {}", userId, e.getMessage());
            return synthesizeTrend(currentTotalRevenue);
        }
    }

    /**
     * Pseudo-trend for users without history: starts near 85% of current, wanders by 95-105% per step within
     * 60-120% of current, and always ends exactly at current. All zeros when current is 0.
     */
    public List<Long> synthesizeTrend(final long current) {
        if (current == 0) {
            return Collections.nCopies(TREND_MONTHS, 0L);
        }
        long floor = Math.round(current * SYNTHETIC_FLOOR);
        long ceiling = Math.round(current * SYNTHETIC_CEILING);

        List<Long> trend = new ArrayList<>(TREND_MONTHS);
        long value = Math.round(current * SYNTHETIC_START);
        for (int i = 0; i < TREND_MONTHS - 1; i++) {
            double jitter = JITTER_MIN + trendJitter.nextDouble() * JITTER_SPAN;
            value = Math.max(floor, Math.min(ceiling, Math.round(value * jitter)));
            trend.add(value);
        }
        trend.add(current);
        return trend;
    }

    SortedMap<YearMonth, Long> monthlyAverages(final List<MetricSample> history) {
        Map<YearMonth, List<Long>> byMonth = history.stream()
                .collect(Collectors.groupingBy(
                        s -> YearMonth.from(s.getRecordedAt().atZone(ZoneOffset.UTC)),
                        TreeMap::new,
                        Collectors.mapping(MetricSample::getMetricValue, Collectors.toList())));

        SortedMap<YearMonth, Long> averages = new TreeMap<>();
        byMonth.forEach((month, values) -> averages.put(month,
                Math.round(values.stream().mapToLong(Long::longValue).average().orElse(0))));
        return averages;
    }

    List<Long> fillTrailingMonths(final SortedMap<YearMonth, Long> monthly, final YearMonth currentMonth) {
        List<Long> trend = new ArrayList<>(TREND_MONTHS);
        for (int i = TREND_MONTHS - 1; i >= 0; i--) {
            YearMonth month = currentMonth.minusMonths(i);
            Long known = monthly.get(month);
            trend.add(known != null ? known : interpolate(monthly, month));
        }
        return trend;
    }

    /** Linear by elapsed time between the nearest known months; carries the one neighbour when only one exists. */
    private static long interpolate(final SortedMap<YearMonth, Long> monthly, final YearMonth target) {
        SortedMap<YearMonth, Long> earlier = monthly.headMap(target);
        SortedMap<YearMonth, Long> later = monthly.tailMap(target);
        if (earlier.isEmpty() && later.isEmpty()) return 0L;
        if (earlier.isEmpty()) return later.get(later.firstKey());
        if (later.isEmpty()) return earlier.get(earlier.lastKey());

        YearMonth before = earlier.lastKey();
        YearMonth after = later.firstKey();
        long beforeValue = earlier.get(before);
        long afterValue = later.get(after);

        double total = epochSecond(after) - epochSecond(before);
        double elapsed = epochSecond(target) - epochSecond(before);
        return Math.round(beforeValue + (afterValue - beforeValue) * (elapsed / total));
    }

    private static long epochSecond(final YearMonth month) {
        return month.atDay(1).atStartOfDay(ZoneOffset.UTC).toEpochSecond();
    }

    private static double round2(final double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
