package quest.gekko.creatorstats.service.stats;

import java.util.List;

public record CacheSummary(long size, List<String> entries) {}
