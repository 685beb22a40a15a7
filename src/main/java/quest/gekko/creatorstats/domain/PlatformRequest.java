package quest.gekko.creatorstats.domain;

/** A platform name plus the provider-side identifier (channel id, login, handle) to look up. */
public record PlatformRequest(String platform, String identifier) {

    /** Parses {@code platform:identifier}. */
    public static PlatformRequest parse(String value) {
        if (value == null) throw new IllegalArgumentException("Platform request must not be null");
        int i = value.indexOf(':');
        if (i <= 0 || i == value.length() - 1) {
            throw new IllegalArgumentException("Expected platform:identifier but got '" + value + "'");
        }
        return new PlatformRequest(value.substring(0, i).trim().toLowerCase(), value.substring(i + 1).trim());
    }
}
