package com.wishmaster.wishlist.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.wishmaster.security.Principal;
import com.wishmaster.security.PrincipalDirectory;
import com.wishmaster.security.PrincipalStatus;
import com.wishmaster.security.TokenPair;
import com.wishmaster.security.TokenPairIssuer;
import com.wishmaster.security.testing.TestTokens;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;

@ExtendWith(MockitoExtension.class)
@DisplayName("LoginService")
class LoginServiceTest {

    private static final String EMAIL = "alice@wishmaster.test";

    @Mock private UserAccountRepository accounts;
    @Mock private PrincipalDirectory directory;
    @Mock private PasswordEncoder passwordEncoder;
    @Mock private TokenPairIssuer issuer;

    private LoginService loginService;
    private Principal principal;
    private UserAccount account;

    @BeforeEach
    void setUp() {
        loginService = new LoginService(accounts, directory, passwordEncoder, issuer);
        principal = TestTokens.confirmedPrincipal();
        account = new UserAccount(EMAIL, "$2a$10$hash", principal.id());
    }

    @Test
    @DisplayName("issues a pair for valid credentials of a confirmed principal")
    void issuesPair() {
        TokenPair pair = new TokenPair("access", "refresh");
        when(accounts.findByEmail(EMAIL)).thenReturn(Optional.of(account));
        when(passwordEncoder.matches("secret", account.passwordHash())).thenReturn(true);
        when(directory.findPrincipalById(principal.id())).thenReturn(Optional.of(principal));
        when(issuer.issue(principal)).thenReturn(pair);

        assertThat(loginService.login(EMAIL, "secret")).isEqualTo(pair);
    }

    @Test
    @DisplayName("unknown email fails without checking a password")
    void unknownEmail() {
        when(accounts.findByEmail(EMAIL)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> loginService.login(EMAIL, "secret"))
                .isInstanceOf(InvalidCredentialsException.class)
                .hasMessage("Invalid credentials.");
        verify(issuer, never()).issue(any());
    }

    @Test
    @DisplayName("wrong password fails")
    void wrongPassword() {
        when(accounts.findByEmail(EMAIL)).thenReturn(Optional.of(account));
        when(passwordEncoder.matches("wrong", account.passwordHash())).thenReturn(false);

        assertThatThrownBy(() -> loginService.login(EMAIL, "wrong"))
                .isInstanceOf(InvalidCredentialsException.class);
        verify(issuer, never()).issue(any());
    }

    @Test
    @DisplayName("unconfirmed principal fails with the same error")
    void unconfirmedPrincipal() {
        Principal unconfirmed = new Principal(principal.id(), PrincipalStatus.UNCONFIRMED, Set.of());
        when(accounts.findByEmail(EMAIL)).thenReturn(Optional.of(account));
        when(passwordEncoder.matches("secret", account.passwordHash())).thenReturn(true);
        when(directory.findPrincipalById(principal.id())).thenReturn(Optional.of(unconfirmed));

        assertThatThrownBy(() -> loginService.login(EMAIL, "secret"))
                .isInstanceOf(InvalidCredentialsException.class);
        verify(issuer, never()).issue(any());
    }

    @Test
    @DisplayName("account without principal fails with the same error")
    void missingPrincipal() {
        when(accounts.findByEmail(EMAIL)).thenReturn(Optional.of(account));
        when(passwordEncoder.matches("secret", account.passwordHash())).thenReturn(true);
        when(directory.findPrincipalById(principal.id())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> loginService.login(EMAIL, "secret"))
                .isInstanceOf(InvalidCredentialsException.class);
    }
}
