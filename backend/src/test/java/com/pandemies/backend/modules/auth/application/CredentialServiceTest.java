package com.pandemies.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.Optional;

import com.pandemies.backend.modules.auth.domain.AppUser;
import com.pandemies.backend.modules.auth.domain.Country;
import com.pandemies.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.pandemies.backend.support.MutableClock;
import com.pandemies.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

@ExtendWith(MockitoExtension.class)
class CredentialServiceTest {

    private static final Instant NOW = Instant.parse("2025-02-10T08:30:00Z");

    @Mock
    private AppUserRepository appUserRepository;

    private BCryptPasswordEncoder encoder;
    private CredentialService credentialService;
    private AppUser researcher;

    @BeforeEach
    void setUp() {
        encoder = spy(new BCryptPasswordEncoder(4));
        credentialService = new CredentialService(appUserRepository, encoder, new MutableClock(NOW));
        researcher = TestEntities.user(3L, "chercheur_ch1", Country.SUISSE, "chercheur_suisse");
        researcher.setPasswordHash(encoder.encode("chercheur123"));
    }

    @Test
    void authenticatesAndStampsLastLogin() {
        when(appUserRepository.findByUsername("chercheur_ch1")).thenReturn(Optional.of(researcher));

        AppUser user = credentialService.authenticate("chercheur_ch1", "chercheur123", Country.SUISSE);

        assertThat(user).isSameAs(researcher);
        assertThat(user.getLastLogin().toInstant()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("every refusal carries the same public code")
    void refusalsAreUniform() {
        when(appUserRepository.findByUsername("nobody")).thenReturn(Optional.empty());
        when(appUserRepository.findByUsername("chercheur_ch1")).thenReturn(Optional.of(researcher));

        assertRefused(() -> credentialService.authenticate("nobody", "x", Country.SUISSE), AuthFailure.NOT_FOUND);
        assertRefused(() -> credentialService.authenticate("chercheur_ch1", "wrong", Country.SUISSE), AuthFailure.BAD_PASSWORD);
        assertRefused(() -> credentialService.authenticate("chercheur_ch1", "chercheur123", Country.FRANCE), AuthFailure.COUNTRY_MISMATCH);

        researcher.setActive(false);
        assertRefused(() -> credentialService.authenticate("chercheur_ch1", "chercheur123", Country.SUISSE), AuthFailure.INACTIVE);

        assertThat(researcher.getLastLogin()).isNull();
    }

    @Test
    @DisplayName("unknown users and foreign accounts still pay for one hash comparison")
    void everyRefusalRunsTheHashComparison() {
        when(appUserRepository.findByUsername("nobody")).thenReturn(Optional.empty());
        when(appUserRepository.findByUsername("chercheur_ch1")).thenReturn(Optional.of(researcher));

        assertRefused(() -> credentialService.authenticate("nobody", "guess", Country.SUISSE), AuthFailure.NOT_FOUND);
        verify(encoder).matches(eq("guess"), anyString());

        assertRefused(() -> credentialService.authenticate("chercheur_ch1", "guess-2", Country.USA), AuthFailure.COUNTRY_MISMATCH);
        verify(encoder).matches("guess-2", researcher.getPasswordHash());

        assertRefused(() -> credentialService.authenticate(" ", null, Country.SUISSE), AuthFailure.NOT_FOUND);
        verify(encoder).matches(eq(""), anyString());
    }

    @Test
    void usernameMatchIsExact() {
        when(appUserRepository.findByUsername("CHERCHEUR_CH1")).thenReturn(Optional.empty());

        assertRefused(() -> credentialService.authenticate("CHERCHEUR_CH1", "chercheur123", Country.SUISSE), AuthFailure.NOT_FOUND);
    }

    private static void assertRefused(Runnable call, AuthFailure expected) {
        assertThatThrownBy(call::run)
                .isInstanceOfSatisfying(AuthProblemException.class, ex -> {
                    assertThat(ex.getCode()).isEqualTo(AuthProblemException.INVALID_CREDENTIALS);
                    assertThat(ex.getDetailMessage()).isEqualTo("Invalid credentials");
                    assertThat(ex.getFailure()).isEqualTo(expected);
                });
    }
}
