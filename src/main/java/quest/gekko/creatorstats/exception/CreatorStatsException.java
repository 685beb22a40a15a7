package quest.gekko.creatorstats.exception;

public class CreatorStatsException extends RuntimeException {

    public CreatorStatsException(String message) {
        super(message);
    }

    public CreatorStatsException(String message, Throwable cause) {
        super(message, cause);
    }
}
