package com.quill.content.infrastructure.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quill.content.domain.ErrorKind;
import com.quill.observability.CorrelationContextHolder;
import com.quill.observability.MetricFactory;
import com.quill.security.BearerTokenExtractor;
import com.quill.security.CallerIdentity;
import com.quill.security.TokenService;
import com.quill.security.TokenValidation;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates requests to {@link ProtectedRoutes}.
 *
 * <p>The bearer token is validated by the {@link TokenService}; nothing is looked up. On success
 * the caller's {@link CallerIdentity} is stored as a request attribute, where
 * {@link CallerIdentityArgumentResolver} hands it to the controller as a method argument, and the
 * user id is added to the logging context.
 *
 * <p>Every rejection gets the same 401 body. Absent, malformed, expired and forged tokens can
 * only be told apart in the log and in the {@code reason} tag of
 * {@value #METRIC_GATE_REJECTIONS}.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class AuthGateFilter extends OncePerRequestFilter {

    public static final String REJECTION_MESSAGE = "Missing or invalid bearer token";

    static final String METRIC_GATE_REJECTIONS = "quill.auth.gate.rejections";

    private static final Logger log = LoggerFactory.getLogger(AuthGateFilter.class);

    private final TokenService tokens;
    private final MetricFactory metrics;
    private final ObjectMapper objectMapper;

    public AuthGateFilter(TokenService tokens, MetricFactory metrics, ObjectMapper objectMapper) {
        this.tokens = tokens;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !ProtectedRoutes.isProtected(request);
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String header = request.getHeader(BearerTokenExtractor.AUTHORIZATION_HEADER);
        Optional<String> token = BearerTokenExtractor.extract(header);
        if (token.isEmpty()) {
            reject(request, response, "missing");
            return;
        }

        TokenValidation validation = tokens.validate(token.get());
        Optional<CallerIdentity> identity = validation.identity();
        if (identity.isEmpty()) {
            reject(request, response, validation.failure().name().toLowerCase(Locale.ROOT));
            return;
        }

        request.setAttribute(CallerIdentityArgumentResolver.CALLER_ATTRIBUTE, identity.get());
        CorrelationContextHolder.bindUser(identity.get().userId().toString());
        filterChain.doFilter(request, response);
    }

    private void reject(HttpServletRequest request, HttpServletResponse response, String reason)
            throws IOException {
        log.info("Rejected {} {}: reason={}", request.getMethod(), request.getRequestURI(), reason);
        metrics.counter(
                        METRIC_GATE_REJECTIONS, "Requests rejected by the auth gate", "reason", reason)
                .increment();

        ProblemDetail problem = Problems.of(ErrorKind.UNAUTHENTICATED, REJECTION_MESSAGE);
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        objectMapper.writeValue(response.getOutputStream(), Problems.toBody(problem));
    }
}
