package com.wishmaster.wishlist.infrastructure.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wishmaster.observability.CorrelationContextHolder;
import com.wishmaster.observability.MetricFactory;
import com.wishmaster.security.AuthenticationFailedException;
import com.wishmaster.security.AuthenticationResult;
import com.wishmaster.security.BearerTokenAuthenticator;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates every request from its {@code Authorization} header.
 *
 * <p>Rejected credentials end the request with a 401 ProblemDetail and a generic message.
 * Anonymous and authenticated requests continue with the {@link AuthenticationResult} stored as
 * a request attribute; controllers receive it through {@link
 * AuthenticationResultArgumentResolver}. Outcomes are counted in {@code
 * wishmaster.authentication}.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class BearerAuthenticationFilter extends OncePerRequestFilter {

    /** Request attribute holding the {@link AuthenticationResult}. */
    public static final String RESULT_ATTRIBUTE = BearerAuthenticationFilter.class.getName() + ".RESULT";

    static final String METRIC_NAME = "wishmaster.authentication";

    private final BearerTokenAuthenticator authenticator;
    private final MetricFactory metrics;
    private final ObjectMapper objectMapper;

    public BearerAuthenticationFilter(
            BearerTokenAuthenticator authenticator, MetricFactory metrics, ObjectMapper objectMapper) {
        this.authenticator = authenticator;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    /** The result stored for this request, anonymous if the filter did not run. */
    public static AuthenticationResult resultOf(HttpServletRequest request) {
        Object result = request.getAttribute(RESULT_ATTRIBUTE);
        return result instanceof AuthenticationResult authenticationResult
                ? authenticationResult
                : AuthenticationResult.anonymous();
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        AuthenticationResult result = authenticator.authenticate(request.getHeader(HttpHeaders.AUTHORIZATION));

        if (result instanceof AuthenticationResult.Rejected rejected) {
            count("rejected", rejected.reason().name());
            writeUnauthorized(response);
            return;
        }
        if (result instanceof AuthenticationResult.Authenticated authenticated) {
            count("authenticated", "none");
            CorrelationContextHolder.bindPrincipal(authenticated.principal().id().toString());
        } else {
            count("anonymous", "none");
        }
        request.setAttribute(RESULT_ATTRIBUTE, result);
        filterChain.doFilter(request, response);
    }

    private void count(String outcome, String reason) {
        metrics.counter(METRIC_NAME, "Bearer authentication outcomes", "outcome", outcome, "reason", reason)
                .increment();
    }

    private void writeUnauthorized(HttpServletResponse response) throws IOException {
        ProblemDetail problem = ProblemDetails.of(
                HttpStatus.UNAUTHORIZED, "Unauthorized", "unauthorized", AuthenticationFailedException.MESSAGE);
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, authenticator.schemePrefix());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), problem);
    }
}
