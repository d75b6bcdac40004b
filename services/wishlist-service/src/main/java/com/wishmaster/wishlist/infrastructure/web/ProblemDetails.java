package com.wishmaster.wishlist.infrastructure.web;

import com.wishmaster.observability.CorrelationContextHolder;
import java.net.URI;
import java.time.Instant;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

/**
 * Builds RFC 7807 responses that carry a timestamp and the request's correlation ID.
 *
 * <pre>
 * {
 *   "type": "https://wishmaster.dev/errors/invalid-token",
 *   "title": "Bad Request",
 *   "status": 400,
 *   "detail": "Invalid JWT.",
 *   "timestamp": "2024-05-01T12:00:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 */
public final class ProblemDetails {

    static final String TYPE_BASE = "https://wishmaster.dev/errors/";

    private ProblemDetails() {
        // utility class
    }

    /**
     * @param status HTTP status
     * @param title short summary
     * @param type slug appended to the error type base URI
     * @param detail client-safe explanation
     */
    public static ProblemDetail of(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(TYPE_BASE + type));
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }
}
