package quest.gekko.creatorstats.exception;

import lombok.Getter;

/**
 * The provider rejected a refresh token, or answered a refresh with something unusable.
 */
@Getter
public class ProviderAuthException extends CreatorStatsException {
    private final String platform;

    public ProviderAuthException(String platform, String message) {
        super("[" + platform + "] " + message);
        this.platform = platform;
    }

    public ProviderAuthException(String platform, String message, Throwable cause) {
        super("[" + platform + "] " + message, cause);
        this.platform = platform;
    }
}
