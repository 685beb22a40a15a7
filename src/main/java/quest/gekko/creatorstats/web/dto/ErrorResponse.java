package quest.gekko.creatorstats.web.dto;

import java.time.Instant;

public record ErrorResponse(int status, String error, String platform, Instant timestamp) {

    public static ErrorResponse of(int status, String error) {
        return new ErrorResponse(status, error, null, Instant.now());
    }
}
