package quest.gekko.creatorstats.service.scheduling;

/** Outcome counts of one credential sweep. {@code evicted} is the number of removed records. */
public record CleanupReport(int scanned, int refreshed, int evicted, int failed) {}
