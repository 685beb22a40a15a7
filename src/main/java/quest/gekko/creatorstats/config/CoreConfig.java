package quest.gekko.creatorstats.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.Random;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.random.RandomGenerator;

@Configuration
public class CoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Jitter source for synthesized revenue trends; replace with a seeded generator for reproducible output. */
    @Bean
    public RandomGenerator trendJitter() {
        return new Random();
    }

    @Bean
    public ThreadPoolTaskExecutor statsFetchExecutor(final CreatorStatsProperties.Cache properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.fetchPoolSize());
        executor.setMaxPoolSize(properties.fetchPoolSize());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("stats-fetch-");
        // caller runs when saturated
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        return executor;
    }
}
