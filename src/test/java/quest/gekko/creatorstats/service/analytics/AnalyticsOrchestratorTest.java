package quest.gekko.creatorstats.service.analytics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import quest.gekko.creatorstats.domain.AnalyticsSnapshot;
import quest.gekko.creatorstats.domain.PlatformRequest;
import quest.gekko.creatorstats.domain.PlatformShare;
import quest.gekko.creatorstats.domain.PlatformSnapshot;
import quest.gekko.creatorstats.service.stats.StatsCache;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnalyticsOrchestratorTest {
    static final List<Long> TREND = List.of(1L, 2L, 3L, 4L, 5L, 6L);

    @Mock StatsCache statsCache;
    @Mock GrowthAnalyticsEngine growthEngine;
    @Mock MetricHistoryStore metricHistoryStore;
    @InjectMocks AnalyticsOrchestrator orchestrator;

    private static PlatformSnapshot snapshot(String platform, long subscribers, long followers, long revenue, double growth) {
        return new PlatformSnapshot(platform, platform + "-id", platform, null, subscribers, followers, 0, 0, revenue,
                growth, false, Instant.parse("2024-06-01T12:00:00Z"), null);
    }

    @Nested
    @DisplayName("buildReport")
    class BuildReport {

        @Test
        @DisplayName("revenue drives totals, shares and the top platform")
        void revenueBreakdown() {
            when(growthEngine.revenueTrend("u1", 400)).thenReturn(TREND);

            AnalyticsSnapshot report = orchestrator.buildReport(List.of(
                    snapshot("youtube", 10, 0, 100, 0),
                    snapshot("twitch", 0, 10, 300, 0)), "u1");

            assertThat(report.totalRevenue()).isEqualTo(400);
            assertThat(report.topPlatform()).isEqualTo("twitch");
            assertThat(report.platformBreakdown()).containsExactly(
                    new PlatformShare("youtube", 25.0), new PlatformShare("twitch", 75.0));
            assertThat(report.monthlyTrend()).isEqualTo(TREND);
            verify(metricHistoryStore).recordTotalRevenue("u1", 400);
        }

        @Test
        void audienceIsUsedWhenNothingEarns() {
            when(growthEngine.revenueTrend("u1", 0)).thenReturn(TREND);

            AnalyticsSnapshot report = orchestrator.buildReport(List.of(
                    snapshot("youtube", 300, 0, 0, 0),
                    snapshot("twitch", 0, 100, 0, 0)), "u1");

            assertThat(report.topPlatform()).isEqualTo("youtube");
            assertThat(report.platformBreakdown()).extracting(PlatformShare::percentage).containsExactly(75.0, 25.0);
            verify(metricHistoryStore, never()).recordTotalRevenue(anyString(), anyLong());
        }

        @Test
        void sharesAreRoundedToOneDecimal() {
            when(growthEngine.revenueTrend(null, 3)).thenReturn(TREND);

            AnalyticsSnapshot report = orchestrator.buildReport(List.of(
                    snapshot("a", 0, 0, 1, 0),
                    snapshot("b", 0, 0, 1, 0),
                    snapshot("c", 0, 0, 1, 0)), null);

            assertThat(report.platformBreakdown()).extracting(PlatformShare::percentage).containsOnly(33.3);
            assertThat(report.topPlatform()).isEqualTo("a");
        }

        @Test
        @DisplayName("total growth averages only the platforms that grew")
        void totalGrowthIgnoresFlatAndDeclining() {
            when(growthEngine.revenueTrend(any(), anyLong())).thenReturn(TREND);

            AnalyticsSnapshot report = orchestrator.buildReport(List.of(
                    snapshot("a", 1, 0, 0, 10.0),
                    snapshot("b", 1, 0, 0, 14.67),
                    snapshot("c", 1, 0, 0, -5.0),
                    snapshot("d", 1, 0, 0, 0.0)), null);

            assertThat(report.totalGrowth()).isEqualTo(12.3);
        }

        @Test
        void emptyInput() {
            when(growthEngine.revenueTrend("u1", 0)).thenReturn(List.of(0L, 0L, 0L, 0L, 0L, 0L));

            AnalyticsSnapshot report = orchestrator.buildReport(List.of(), "u1");

            assertThat(report.totalRevenue()).isZero();
            assertThat(report.totalGrowth()).isZero();
            assertThat(report.topPlatform()).isNull();
            assertThat(report.platformBreakdown()).isEmpty();
            assertThat(report.monthlyTrend()).hasSize(6);
        }

        @Test
        void persistenceFailureDoesNotFailTheReport() {
            when(growthEngine.revenueTrend("u1", 50)).thenReturn(TREND);
            when(metricHistoryStore.recordTotalRevenue("u1", 50)).thenThrow(new IllegalStateException("db down"));

            AnalyticsSnapshot report = orchestrator.buildReport(List.of(snapshot("youtube", 1, 0, 50, 0)), "u1");

            assertThat(report.totalRevenue()).isEqualTo(50);
        }

        @Test
        void anonymousReportIsNotPersisted() {
            when(growthEngine.revenueTrend(null, 50)).thenReturn(TREND);

            orchestrator.buildReport(List.of(snapshot("youtube", 1, 0, 50, 0)), null);

            verifyNoInteractions(metricHistoryStore);
        }
    }

    @Nested
    @DisplayName("getAllPlatformStats")
    class GetAllPlatformStats {
        final List<PlatformRequest> requests = List.of(
                new PlatformRequest("youtube", "youtube-id"), new PlatformRequest("twitch", "twitch-id"));

        @Test
        void anonymousLookupIsReturnedUnchanged() {
            List<PlatformSnapshot> snapshots = List.of(snapshot("youtube", 10, 0, 0, 0));
            when(statsCache.getAllStats(requests, null)).thenReturn(snapshots);

            assertThat(orchestrator.getAllPlatformStats(requests, null)).isEqualTo(snapshots);
            verifyNoInteractions(growthEngine, metricHistoryStore);
        }

        @Test
        @DisplayName("growth uses subscribers when present and followers otherwise, and metrics are recorded")
        void enrichesWithGrowthAndRecordsMetrics() {
            when(statsCache.getAllStats(requests, "u1")).thenReturn(List.of(
                    snapshot("youtube", 1200, 0, 4, 0),
                    snapshot("twitch", 0, 500, 5, 0)));
            when(growthEngine.growthRate("u1", "youtube", "youtube-id", "subscribers", 1200)).thenReturn(20.0);
            when(growthEngine.growthRate("u1", "twitch", "twitch-id", "followers", 500)).thenReturn(-2.5);

            List<PlatformSnapshot> result = orchestrator.getAllPlatformStats(requests, "u1");

            assertThat(result).extracting(PlatformSnapshot::growth).containsExactly(20.0, -2.5);
            verify(metricHistoryStore).recordPlatformMetrics("u1", "youtube", "youtube-id",
                    Map.of("subscribers", 1200L, "followers", 0L, "views", 0L, "viewers", 0L, "revenue", 4L));
            verify(metricHistoryStore).recordPlatformMetrics(eq("u1"), eq("twitch"), eq("twitch-id"), anyMap());
        }

        @Test
        void failedSnapshotsAreLeftAlone() {
            PlatformSnapshot failed = PlatformSnapshot.fallback("twitch", "twitch-id", "boom");
            when(statsCache.getAllStats(requests, "u1")).thenReturn(List.of(failed));

            assertThat(orchestrator.getAllPlatformStats(requests, "u1")).containsExactly(failed);
            verifyNoInteractions(growthEngine, metricHistoryStore);
        }

        @Test
        void recordingFailureKeepsTheSnapshot() {
            when(statsCache.getAllStats(requests, "u1")).thenReturn(List.of(snapshot("youtube", 10, 0, 0, 0)));
            when(growthEngine.growthRate(any(), any(), any(), any(), anyLong())).thenReturn(5.0);
            when(metricHistoryStore.recordPlatformMetrics(any(), any(), any(), anyMap()))
                    .thenThrow(new IllegalStateException("db down"));

            assertThat(orchestrator.getAllPlatformStats(requests, "u1")).singleElement()
                    .extracting(PlatformSnapshot::growth).isEqualTo(5.0);
        }
    }
}
