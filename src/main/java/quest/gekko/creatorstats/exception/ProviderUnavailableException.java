package quest.gekko.creatorstats.exception;

import lombok.Getter;

/**
 * Network failure, 5xx or rate limiting from a provider. Never a reason to drop a stored credential.
 */
@Getter
public class ProviderUnavailableException extends CreatorStatsException {
    private final String platform;

    public ProviderUnavailableException(String platform, String message) {
        super("[" + platform + "] " + message);
        this.platform = platform;
    }

    public ProviderUnavailableException(String platform, String message, Throwable cause) {
        super("[" + platform + "] " + message, cause);
        this.platform = platform;
    }
}
