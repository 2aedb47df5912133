package com.quill.content.infrastructure.web;

import com.quill.content.domain.ContentException;
import com.quill.content.domain.ErrorKind;
import com.quill.security.OwnershipViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <p>Each {@link ErrorKind} has one status and one {@code error} label; see {@link Problems} for
 * the body shape. Anything unexpected becomes a 500 with a generic message, and the stack trace
 * goes to the log only.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String FORBIDDEN_MESSAGE = "You can only access your own posts";

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ContentException.class)
    public ResponseEntity<ProblemDetail> handleContent(ContentException ex) {
        log.info("Request failed: kind={}, detail={}", ex.kind(), ex.getMessage());
        ProblemDetail problem = Problems.of(ex.kind(), ex.getMessage());
        return ResponseEntity.status(problem.getStatus()).body(problem);
    }

    @ExceptionHandler(OwnershipViolationException.class)
    public ProblemDetail handleOwnership(OwnershipViolationException ex) {
        log.warn("{}", ex.getMessage());
        return Problems.of(ErrorKind.FORBIDDEN, FORBIDDEN_MESSAGE);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .sorted()
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        log.info("Validation failed: {}", detail);
        return Problems.of(ErrorKind.INVALID_INPUT, detail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.info("Unreadable request body: {}", ex.getMessage());
        return Problems.of(ErrorKind.INVALID_INPUT, "Request body is missing or malformed");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ProblemDetail handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.info("Bad path or query value: {}={}", ex.getName(), ex.getValue());
        return Problems.of(ErrorKind.INVALID_INPUT, "Invalid value for '" + ex.getName() + "'");
    }

    /** Framework errors that already know their status: unknown route, wrong method or media type. */
    @ExceptionHandler({
        NoResourceFoundException.class,
        HttpRequestMethodNotSupportedException.class,
        HttpMediaTypeNotSupportedException.class
    })
    public ResponseEntity<ProblemDetail> handleFramework(Exception ex) {
        ProblemDetail problem = Problems.enrich(((ErrorResponse) ex).getBody());
        if (problem.getStatus() == HttpStatus.NOT_FOUND.value()) {
            problem.setProperty(Problems.ERROR_PROPERTY, ErrorKind.NOT_FOUND.label());
        }
        return ResponseEntity.status(problem.getStatus()).body(problem);
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        ProblemDetail problem =
                ProblemDetail.forStatusAndDetail(
                        HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        return Problems.enrich(problem);
    }
}
