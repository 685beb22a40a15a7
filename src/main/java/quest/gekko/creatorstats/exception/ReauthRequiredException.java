package quest.gekko.creatorstats.exception;

import lombok.Getter;

/**
 * No usable credential exists for the user and platform; the authorization flow has to run again.
 */
@Getter
public class ReauthRequiredException extends CreatorStatsException {
    private final String userId;
    private final String platform;

    public ReauthRequiredException(String userId, String platform, String reason, Throwable cause) {
        super("Re-authentication required for " + platform + " (user " + userId + "): " + reason, cause);
        this.userId = userId;
        this.platform = platform;
    }

    public ReauthRequiredException(String userId, String platform, String reason) {
        this(userId, platform, reason, null);
    }
}
