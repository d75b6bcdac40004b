package com.wishmaster.wishlist.api;

import com.wishmaster.observability.MetricFactory;
import com.wishmaster.security.TokenPair;
import com.wishmaster.security.TokenPairIssuer;
import com.wishmaster.wishlist.domain.LoginService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Token lifecycle endpoints.
 *
 * <ul>
 *   <li>{@code POST /api/v1/tokens}: login with email and password
 *   <li>{@code PUT /api/v1/tokens}: exchange a refresh token for a new pair
 *   <li>{@code DELETE /api/v1/tokens}: revoke a refresh token (logout)
 * </ul>
 */
@RestController
@RequestMapping("/api/v1/tokens")
public class TokensController {

    static final String ISSUED_METRIC = "wishmaster.tokens.issued";

    private final LoginService loginService;
    private final TokenPairIssuer issuer;
    private final MetricFactory metrics;

    public TokensController(LoginService loginService, TokenPairIssuer issuer, MetricFactory metrics) {
        this.loginService = loginService;
        this.issuer = issuer;
        this.metrics = metrics;
    }

    @PostMapping
    public TokenPair login(@Valid @RequestBody LoginRequest request) {
        TokenPair pair = loginService.login(request.email(), request.password());
        countIssued("login");
        return pair;
    }

    @PutMapping
    public TokenPair refresh(@Valid @RequestBody RefreshRequest request) {
        TokenPair pair = issuer.refresh(request.refreshToken());
        countIssued("refresh");
        return pair;
    }

    @DeleteMapping
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void logout(@Valid @RequestBody RefreshRequest request) {
        issuer.revoke(request.refreshToken());
    }

    private void countIssued(String operation) {
        metrics.counter(ISSUED_METRIC, "Token pairs issued", "operation", operation).increment();
    }
}
