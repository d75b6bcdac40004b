package com.wishmaster.wishlist.infrastructure.web;

import com.wishmaster.security.AuthenticationFailedException;
import com.wishmaster.security.BearerTokenAuthenticator;
import com.wishmaster.security.InactivePrincipalException;
import com.wishmaster.security.PermissionDeniedException;
import com.wishmaster.security.TokenException;
import com.wishmaster.wishlist.domain.InvalidCredentialsException;
import com.wishmaster.wishlist.domain.PrincipalNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps exceptions to RFC 7807 ProblemDetail responses.
 *
 * <p>Token and login failures keep the client-facing messages terse ("Invalid JWT.", "Invalid
 * credentials.", "Inactive user."); the precise cause only goes to the log. Request input is
 * validated before it reaches the core, so an {@link IllegalArgumentException} escaping a
 * controller is a server fault and maps to 500 without echoing its message.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    public static final String INVALID_TOKEN_DETAIL = "Invalid JWT.";
    public static final String INACTIVE_USER_DETAIL = "Inactive user.";

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidCredentialsException.class)
    public ProblemDetail handleInvalidCredentials(InvalidCredentialsException ex) {
        log.info("Login rejected");
        return ProblemDetails.of(
                HttpStatus.BAD_REQUEST, "Bad Request", "invalid-credentials", InvalidCredentialsException.MESSAGE);
    }

    @ExceptionHandler(TokenException.class)
    public ProblemDetail handleToken(TokenException ex) {
        log.warn("Token rejected ({}): {}", ex.getClass().getSimpleName(), ex.getMessage());
        return ProblemDetails.of(HttpStatus.BAD_REQUEST, "Bad Request", "invalid-token", INVALID_TOKEN_DETAIL);
    }

    @ExceptionHandler(InactivePrincipalException.class)
    public ProblemDetail handleInactivePrincipal(InactivePrincipalException ex) {
        log.warn("Inactive principal: {}", ex.getMessage());
        return ProblemDetails.of(HttpStatus.BAD_REQUEST, "Bad Request", "inactive-user", INACTIVE_USER_DETAIL);
    }

    @ExceptionHandler(AuthenticationFailedException.class)
    public ResponseEntity<ProblemDetail> handleAuthenticationFailed(AuthenticationFailedException ex) {
        log.info("Authentication required: {}", ex.reason());
        ProblemDetail problem = ProblemDetails.of(
                HttpStatus.UNAUTHORIZED, "Unauthorized", "unauthorized", AuthenticationFailedException.MESSAGE);
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .header(HttpHeaders.WWW_AUTHENTICATE, BearerTokenAuthenticator.DEFAULT_SCHEME)
                .body(problem);
    }

    @ExceptionHandler(PermissionDeniedException.class)
    public ProblemDetail handlePermissionDenied(PermissionDeniedException ex) {
        log.warn("Permission '{}' denied to principal {}", ex.permission(), ex.principalId().orElse(null));
        return ProblemDetails.of(HttpStatus.FORBIDDEN, "Forbidden", "forbidden", ex.getMessage());
    }

    @ExceptionHandler(PrincipalNotFoundException.class)
    public ProblemDetail handlePrincipalNotFound(PrincipalNotFoundException ex) {
        log.info(ex.getMessage());
        return ProblemDetails.of(HttpStatus.NOT_FOUND, "Not Found", "not-found", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .sorted()
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        return ProblemDetails.of(HttpStatus.BAD_REQUEST, "Validation Error", "validation", detail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return ProblemDetails.of(
                HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", "Request body is missing or malformed");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ProblemDetail handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Bad request parameter '{}': {}", ex.getName(), ex.getValue());
        return ProblemDetails.of(
                HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", "Invalid value for '" + ex.getName() + "'");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            // Spring MVC exceptions (unknown path, unsupported method) carry their own status
            HttpStatus status = HttpStatus.valueOf(errorResponse.getStatusCode().value());
            log.warn("Request failed with {}: {}", status.value(), ex.getMessage());
            return ProblemDetails.of(status, status.getReasonPhrase(), "http", errorResponse.getBody().getDetail());
        }
        log.error("Internal server error", ex);
        return ProblemDetails.of(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "internal",
                "An unexpected error occurred");
    }
}
