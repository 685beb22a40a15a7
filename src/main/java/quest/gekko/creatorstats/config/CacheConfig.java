package quest.gekko.creatorstats.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import quest.gekko.creatorstats.domain.PlatformSnapshot;
import quest.gekko.creatorstats.service.stats.StatsCacheKey;

@Configuration
public class CacheConfig {

    @Bean
    public Cache<StatsCacheKey, PlatformSnapshot> statsSnapshotCache(final CreatorStatsProperties.Cache properties) {
        return Caffeine.newBuilder()
                .maximumSize(properties.maximumSize())
                .expireAfterWrite(properties.statsTtl())
                .build();
    }
}
