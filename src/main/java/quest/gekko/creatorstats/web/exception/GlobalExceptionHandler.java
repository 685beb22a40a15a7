package quest.gekko.creatorstats.web.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import quest.gekko.creatorstats.exception.ReauthRequiredException;
import quest.gekko.creatorstats.exception.UnsupportedPlatformException;
import quest.gekko.creatorstats.web.dto.ErrorResponse;

import java.time.Instant;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ReauthRequiredException.class)
    public ResponseEntity<ErrorResponse> handleReauthRequired(ReauthRequiredException ex, HttpServletRequest request) {
        log.info("Re-authentication required: {} for URL: {}", ex.getMessage(), request.getRequestURL());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(new ErrorResponse(401, "Re-authentication required", ex.getPlatform(), Instant.now()));
    }

    @ExceptionHandler({UnsupportedPlatformException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(RuntimeException ex, HttpServletRequest request) {
        log.warn("Bad request: {} for URL: {}", ex.getMessage(), request.getRequestURL());
        return ResponseEntity.badRequest().body(ErrorResponse.of(400, "Invalid request: " + ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralException(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error for URL: {}", request.getRequestURL(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(500, "An unexpected error occurred"));
    }
}
