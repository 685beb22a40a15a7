package quest.gekko.creatorstats.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration properties for credential storage, the stats cache, metric history and provider integrations
 */
@Configuration
@EnableConfigurationProperties({
        CreatorStatsProperties.Credentials.class,
        CreatorStatsProperties.Cache.class,
        CreatorStatsProperties.History.class,
        CreatorStatsProperties.Http.class,
        CreatorStatsProperties.YouTube.class,
        CreatorStatsProperties.Twitch.class
})
public class CreatorStatsProperties {

    /** {@code encryptionKey} is a Base64 encoded 256-bit AES key. */
    @ConfigurationProperties("creator-stats.credentials")
    public record Credentials(String encryptionKey, String cleanupCron) {}

    @ConfigurationProperties("creator-stats.cache")
    public record Cache(Duration statsTtl, Long maximumSize, Integer fetchPoolSize) {
        public Cache {
            if (statsTtl == null) statsTtl = Duration.ofMinutes(5);
            if (maximumSize == null) maximumSize = 10_000L;
            if (fetchPoolSize == null) fetchPoolSize = 8;
        }
    }

    @ConfigurationProperties("creator-stats.history")
    public record History(Duration retention, String retentionCron) {
        public History {
            if (retention == null) retention = Duration.ofDays(90);
        }
    }

    @ConfigurationProperties("creator-stats.http")
    public record Http(Duration connectTimeout, Duration responseTimeout) {
        public Http {
            if (connectTimeout == null) connectTimeout = Duration.ofSeconds(10);
            if (responseTimeout == null) responseTimeout = Duration.ofSeconds(15);
        }
    }

    @ConfigurationProperties("creator-stats.youtube")
    public record YouTube(String clientId, String clientSecret, String apiKey) {}

    @ConfigurationProperties("creator-stats.twitch")
    public record Twitch(String clientId, String clientSecret) {}
}
