package com.wishmaster.wishlist.domain;

import com.wishmaster.security.Principal;
import com.wishmaster.security.PrincipalDirectory;
import com.wishmaster.security.TokenPair;
import com.wishmaster.security.TokenPairIssuer;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

/**
 * Exchanges email and password for a token pair.
 *
 * <p>Only CONFIRMED principals may log in. Every failure surfaces as {@link
 * InvalidCredentialsException}; the precise cause is logged at debug level.
 */
@Service
public class LoginService {

    private static final Logger log = LoggerFactory.getLogger(LoginService.class);

    private final UserAccountRepository accounts;
    private final PrincipalDirectory directory;
    private final PasswordEncoder passwordEncoder;
    private final TokenPairIssuer issuer;

    public LoginService(
            UserAccountRepository accounts,
            PrincipalDirectory directory,
            PasswordEncoder passwordEncoder,
            TokenPairIssuer issuer) {
        this.accounts = accounts;
        this.directory = directory;
        this.passwordEncoder = passwordEncoder;
        this.issuer = issuer;
    }

    /**
     * Authenticates the credentials and issues a new pair.
     *
     * @throws InvalidCredentialsException if the credentials do not identify an active principal
     */
    public TokenPair login(String email, String password) {
        Optional<UserAccount> account = accounts.findByEmail(email);
        if (account.isEmpty()) {
            log.debug("Login failed: no account for {}", email);
            throw new InvalidCredentialsException();
        }
        if (!passwordEncoder.matches(password, account.get().passwordHash())) {
            log.debug("Login failed: wrong password for {}", email);
            throw new InvalidCredentialsException();
        }
        Principal principal = directory.findPrincipalById(account.get().principalId())
                .filter(Principal::isActive)
                .orElseThrow(() -> {
                    log.debug("Login failed: principal of {} is missing or inactive", email);
                    return new InvalidCredentialsException();
                });
        return issuer.issue(principal);
    }
}
