package quest.gekko.creatorstats.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.creatorstats.domain.MetricSample;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface MetricSampleRepository extends JpaRepository<MetricSample, Long> {

    @Query("""
        select s from MetricSample s
        where s.userId = :userId
          and s.platformName = :platform
          and s.platformIdentifier = :identifier
          and s.metricName = :metric
          and s.recordedAt >= :since
        order by s.recordedAt asc
        """)
    List<MetricSample> findSeries(@Param("userId") final String userId,
                                  @Param("platform") final String platform,
                                  @Param("identifier") final String identifier,
                                  @Param("metric") final String metric,
                                  @Param("since") final Instant since);

    Optional<MetricSample> findFirstByUserIdAndPlatformNameAndPlatformIdentifierAndMetricNameAndRecordedAt(
            final String userId, final String platformName, final String platformIdentifier,
            final String metricName, final Instant recordedAt);

    @Modifying
    @Query("delete from MetricSample s where s.recordedAt < :cutoff")
    int deleteRecordedBefore(@Param("cutoff") final Instant cutoff);
}
