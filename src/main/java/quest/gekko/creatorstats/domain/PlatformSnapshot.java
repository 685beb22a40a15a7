package quest.gekko.creatorstats.domain;

import java.time.Instant;

/**
 * Metrics for one platform at one point in time. Revenue is an estimate derived from views and followers.
 * A non-null {@code error} marks a fallback snapshot whose numeric fields are all zero.
 */
public record PlatformSnapshot(
        String platform,
        String identifier,
        String channelName,
        String thumbnail,
        long subscribers,
        long followers,
        long views,
        long viewers,
        long revenue,
        double growth,
        boolean live,
        Instant fetchedAt,
        String error
) {

    public static PlatformSnapshot fallback(String platform, String identifier, String error) {
        return new PlatformSnapshot(platform, identifier, "Unknown", null,
                0L, 0L, 0L, 0L, 0L, 0.0, false, Instant.now(), error);
    }

    public boolean failed() {
        return error != null;
    }

    /** Audience size used when revenue cannot rank platforms. */
    public long audience() {
        return followers + subscribers;
    }

    public PlatformSnapshot withGrowth(double newGrowth) {
        return new PlatformSnapshot(platform, identifier, channelName, thumbnail,
                subscribers, followers, views, viewers, revenue, newGrowth, live, fetchedAt, error);
    }
}
