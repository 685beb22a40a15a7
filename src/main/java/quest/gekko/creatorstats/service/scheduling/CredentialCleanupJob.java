package quest.gekko.creatorstats.service.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import quest.gekko.creatorstats.domain.CredentialKey;
import quest.gekko.creatorstats.service.credential.CredentialLifecycleManager;
import quest.gekko.creatorstats.service.credential.CredentialStore;

import java.util.List;

/**
 * Periodic refresh-or-evict pass over every stored credential. Runs independently of request-triggered refreshes;
 * a failing record is logged and the sweep moves on.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CredentialCleanupJob {
    private final CredentialStore credentialStore;
    private final CredentialLifecycleManager lifecycleManager;

    @Scheduled(cron = "${creator-stats.credentials.cleanup-cron:0 15 * * * *}", zone = "UTC")
    public void runScheduledCleanup() {
        cleanupExpiredTokens();
    }

    public CleanupReport cleanupExpiredTokens() {
        log.info("Starting expired credential cleanup");
        List<CredentialKey> keys = credentialStore.listKeys();

        int refreshed = 0;
        int evicted = 0;
        int failed = 0;
        for (CredentialKey key : keys) {
            try {
                switch (lifecycleManager.sweep(key)) {
                    case REFRESHED -> refreshed++;
                    case EVICTED -> evicted++;
                    default -> { }
                }
            } catch (RuntimeException e) {
                failed++;
                log.warn("Cleanup failed for {} credential of user {}: {}", key.platform(), key.userId(), e.getMessage(), e);
            }
        }

        CleanupReport report = new CleanupReport(keys.size(), refreshed, evicted, failed);
        log.info("Credential cleanup completed: scanned={} refreshed={} evicted={} failed={}",
                report.scanned(), report.refreshed(), report.evicted(), report.failed());
        return report;
    }
}
