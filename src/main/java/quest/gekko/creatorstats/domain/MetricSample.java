package quest.gekko.creatorstats.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "platform_history", indexes = {
        @Index(name = "idx_platform_history_user_platform", columnList = "user_id, platform_name"),
        @Index(name = "idx_platform_history_metric", columnList = "platform_name, metric_name"),
        @Index(name = "idx_platform_history_recorded_at", columnList = "recorded_at")
})
@Getter @Setter
public class MetricSample {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "user_id", nullable = false)
    String userId;

    @Column(name = "platform_name", nullable = false, length = 50)
    String platformName;

    @Column(name = "platform_identifier", nullable = false)
    String platformIdentifier;

    @Column(name = "metric_name", nullable = false, length = 50)
    String metricName; // "subscribers", "followers", "views", "revenue", ...

    @Column(name = "metric_value", nullable = false)
    Long metricValue;

    @Column(name = "recorded_at", nullable = false)
    Instant recordedAt;

    @Column(name = "created_at", nullable = false)
    Instant createdAt;
}
