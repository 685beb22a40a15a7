package quest.gekko.creatorstats.service.stats;

/**
 * Cache key. {@code userScope} separates authenticated lookups per user from public ones.
 */
public record StatsCacheKey(String platform, String identifier, String userScope) {
    public static final String PUBLIC_SCOPE = "public";

    public static StatsCacheKey of(String platform, String identifier, String userId) {
        return new StatsCacheKey(platform, identifier, userId == null ? PUBLIC_SCOPE : "user:" + userId);
    }

    @Override
    public String toString() {
        return platform + "_" + identifier + "@" + userScope;
    }
}
