package quest.gekko.creatorstats.exception;

/**
 * A stored credential payload could not be decrypted or parsed.
 */
public class CorruptCredentialException extends CreatorStatsException {

    public CorruptCredentialException(String message, Throwable cause) {
        super(message, cause);
    }
}
