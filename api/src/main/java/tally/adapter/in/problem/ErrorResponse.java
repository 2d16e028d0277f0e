package tally.adapter.in.problem;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * JSON error body returned by every endpoint and by the rate limit filter.
 *
 * <pre>{@code
 * {
 *   "success": false,
 *   "error": "Too many requests",
 *   "message": "Rate limit exceeded for this endpoint. Please try again in 42 seconds.",
 *   "timestamp": "2024-05-01T12:00:00Z",
 *   "requestId": "9f1c..."
 * }
 * }</pre>
 *
 * @param success always {@code false}
 * @param error short error title
 * @param message human readable detail
 * @param timestamp ISO-8601 instant the error was produced
 * @param requestId correlation id of the request, when known
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(boolean success, String error, String message, String timestamp, String requestId) {

    public static ErrorResponse of(String error, String message, String requestId) {
        return new ErrorResponse(false, error, message, Instant.now().toString(), requestId);
    }

    public static ErrorResponse of(String error, String message) {
        return of(error, message, null);
    }
}
