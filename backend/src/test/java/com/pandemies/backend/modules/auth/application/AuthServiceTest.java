package com.pandemies.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.OffsetDateTime;

import com.pandemies.backend.global.security.SessionPrincipal;
import com.pandemies.backend.modules.auth.application.SessionValidation.Outcome;
import com.pandemies.backend.modules.auth.application.dto.LoginCommand;
import com.pandemies.backend.modules.auth.application.dto.LoginResult;
import com.pandemies.backend.modules.auth.domain.AppUser;
import com.pandemies.backend.modules.auth.domain.Country;
import com.pandemies.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    private static final Duration TTL = Duration.ofHours(24);
    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-01T00:00:00Z");

    @Mock
    private CredentialService credentialService;

    @Mock
    private SessionService sessionService;

    private AuthService authService;
    private AppUser researcher;

    @BeforeEach
    void setUp() {
        authService = new AuthService(credentialService, sessionService, Country.FRANCE, TTL, 3);
        researcher = TestEntities.user(11L, "chercheur_fr2", Country.FRANCE, "chercheur_france");
    }

    @Test
    void loginIssuesSessionWithConfiguredTtl() {
        when(credentialService.authenticate("chercheur_fr2", "pw", Country.FRANCE)).thenReturn(researcher);
        when(sessionService.issue(eq(11L), eq(TTL), any(ClientMetadata.class)))
                .thenReturn(new IssuedSession("token-1", 11L, NOW, NOW.plus(TTL)));

        LoginResult result = authService.login(new LoginCommand("chercheur_fr2", "pw", " 192.168.1.4 ", "firefox"));

        assertThat(result.token()).isEqualTo("token-1");
        assertThat(result.expiresAt()).isEqualTo(NOW.plusHours(24));
        assertThat(result.user().username()).isEqualTo("chercheur_fr2");
        assertThat(result.user().isAdmin()).isFalse();
        verify(sessionService).issue(11L, TTL, new ClientMetadata("192.168.1.4", "firefox"));
    }

    @Test
    @DisplayName("a token collision is retried with a fresh token")
    void collisionIsRetried() {
        when(credentialService.authenticate(anyString(), anyString(), eq(Country.FRANCE))).thenReturn(researcher);
        when(sessionService.issue(eq(11L), eq(TTL), any(ClientMetadata.class)))
                .thenThrow(collision())
                .thenThrow(collision())
                .thenReturn(new IssuedSession("token-3", 11L, NOW, NOW.plus(TTL)));

        LoginResult result = authService.login(new LoginCommand("chercheur_fr2", "pw", null, null));

        assertThat(result.token()).isEqualTo("token-3");
        verify(sessionService, times(3)).issue(eq(11L), eq(TTL), any(ClientMetadata.class));
    }

    @Test
    void collisionGivesUpAfterMaxAttempts() {
        when(credentialService.authenticate(anyString(), anyString(), eq(Country.FRANCE))).thenReturn(researcher);
        when(sessionService.issue(eq(11L), eq(TTL), any(ClientMetadata.class))).thenThrow(collision());

        assertThatThrownBy(() -> authService.login(new LoginCommand("chercheur_fr2", "pw", null, null)))
                .isInstanceOf(SessionTokenCollisionException.class);
        verify(sessionService, times(3)).issue(eq(11L), eq(TTL), any(ClientMetadata.class));
    }

    @Test
    void refusedCredentialsNeverIssue() {
        when(credentialService.authenticate("chercheur_fr2", "bad", Country.FRANCE))
                .thenThrow(AuthProblemException.invalidCredentials(AuthFailure.BAD_PASSWORD));

        assertThatThrownBy(() -> authService.login(new LoginCommand("chercheur_fr2", "bad", null, null)))
                .isInstanceOf(AuthProblemException.class)
                .hasMessage(AuthProblemException.INVALID_CREDENTIALS);
        verify(sessionService, never()).issue(any(), any(), any());
    }

    @Test
    void logoutRevokesAndIgnoresBlankTokens() {
        authService.logout("token-1");
        authService.logout("   ");
        authService.logout(null);

        verify(sessionService).revoke("token-1");
        verify(sessionService, times(1)).revoke(anyString());
    }

    @Test
    void currentUserResolvesPrincipal() {
        SessionPrincipal principal = new SessionPrincipal(11L, "chercheur_fr2", Country.FRANCE, "chercheur_france");
        when(sessionService.validate("token-1")).thenReturn(SessionValidation.valid(principal, NOW.plus(TTL)));

        assertThat(authService.currentUser("token-1")).isEqualTo(principal);
    }

    @Test
    @DisplayName("expired and unknown tokens both answer INVALID_SESSION")
    void invalidSessionsAreUniform() {
        when(sessionService.validate("expired")).thenReturn(SessionValidation.invalid(Outcome.EXPIRED, NOW));
        when(sessionService.validate("unknown")).thenReturn(SessionValidation.invalid(Outcome.NOT_FOUND, null));

        assertThatThrownBy(() -> authService.currentUser("expired"))
                .isInstanceOfSatisfying(AuthProblemException.class, ex -> {
                    assertThat(ex.getCode()).isEqualTo(AuthProblemException.INVALID_SESSION);
                    assertThat(ex.getStatus()).isEqualTo(HttpStatus.UNAUTHORIZED);
                    assertThat(ex.getFailure()).isEqualTo(AuthFailure.EXPIRED);
                });
        assertThatThrownBy(() -> authService.currentUser("unknown"))
                .isInstanceOfSatisfying(AuthProblemException.class, ex -> {
                    assertThat(ex.getCode()).isEqualTo(AuthProblemException.INVALID_SESSION);
                    assertThat(ex.getFailure()).isEqualTo(AuthFailure.NOT_FOUND);
                });
    }

    @Test
    void sessionFromAnotherCountryIsForbidden() {
        SessionPrincipal swiss = new SessionPrincipal(12L, "chercheur_ch1", Country.SUISSE, "chercheur_suisse");
        when(sessionService.validate("token-ch")).thenReturn(SessionValidation.valid(swiss, NOW.plus(TTL)));

        assertThatThrownBy(() -> authService.currentUser("token-ch"))
                .isInstanceOfSatisfying(AuthProblemException.class, ex -> {
                    assertThat(ex.getCode()).isEqualTo(AuthProblemException.COUNTRY_MISMATCH);
                    assertThat(ex.getStatus()).isEqualTo(HttpStatus.FORBIDDEN);
                });
    }

    @Test
    void rejectsNonPositiveAttemptCount() {
        assertThatThrownBy(() -> new AuthService(credentialService, sessionService, Country.FRANCE, TTL, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static SessionTokenCollisionException collision() {
        return new SessionTokenCollisionException(new DataIntegrityViolationException("duplicate token"));
    }
}
