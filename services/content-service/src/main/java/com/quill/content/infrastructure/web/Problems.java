package com.quill.content.infrastructure.web;

import com.quill.content.domain.ErrorKind;
import com.quill.observability.CorrelationContextHolder;
import java.net.URI;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

/**
 * Builds the RFC 7807 bodies shared by {@link GlobalExceptionHandler} and {@link AuthGateFilter}.
 *
 * <pre>
 * {
 *   "type": "https://quill.dev/errors/forbidden",
 *   "title": "Forbidden",
 *   "status": 403,
 *   "detail": "You can only update your own posts",
 *   "error": "Forbidden",
 *   "timestamp": "2026-03-01T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 */
final class Problems {

    static final String ERROR_PROPERTY = "error";

    private static final String TYPE_BASE = "https://quill.dev/errors/";

    private Problems() {
        // utility class
    }

    static ProblemDetail of(ErrorKind kind, String detail) {
        HttpStatus status = HttpStatus.valueOf(kind.httpStatus());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(status.getReasonPhrase());
        problem.setType(URI.create(TYPE_BASE + kind.name().toLowerCase(Locale.ROOT).replace('_', '-')));
        problem.setProperty(ERROR_PROPERTY, kind.label());
        return enrich(problem);
    }

    /** Adds the timestamp and, when a request is in flight, its correlation id. */
    static ProblemDetail enrich(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }

    /** Flat JSON shape of a problem, for writers that bypass Spring MVC. */
    static Map<String, Object> toBody(ProblemDetail problem) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", problem.getType().toString());
        body.put("title", problem.getTitle());
        body.put("status", problem.getStatus());
        body.put("detail", problem.getDetail());
        if (problem.getInstance() != null) {
            body.put("instance", problem.getInstance().toString());
        }
        if (problem.getProperties() != null) {
            body.putAll(problem.getProperties());
        }
        return body;
    }
}
