package quest.gekko.creatorstats.exception;

public class UnsupportedPlatformException extends CreatorStatsException {

    public UnsupportedPlatformException(String platform) {
        super("Unsupported platform: " + platform);
    }
}
