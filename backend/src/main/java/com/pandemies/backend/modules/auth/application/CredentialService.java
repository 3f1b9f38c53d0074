package com.pandemies.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.pandemies.backend.modules.auth.domain.AppUser;
import com.pandemies.backend.modules.auth.domain.Country;
import com.pandemies.backend.modules.auth.infrastructure.persistence.AppUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Checks a username/password pair against the credential store for one deployment country.
 * Every refusal looks the same to the caller; the reason only reaches the log.
 */
@Service
@Transactional(noRollbackFor = AuthProblemException.class)
public class CredentialService {

    private static final Logger log = LoggerFactory.getLogger(CredentialService.class);

    private final AppUserRepository appUserRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;
    private final String dummyHash;

    public CredentialService(AppUserRepository appUserRepository, PasswordEncoder passwordEncoder, Clock clock) {
        this.appUserRepository = appUserRepository;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
        this.dummyHash = passwordEncoder.encode("unknown-account-placeholder");
    }

    /**
     * Returns the authenticated user and stamps {@code last_login}.
     *
     * @throws AuthProblemException with code {@code INVALID_CREDENTIALS} on any refusal
     */
    public AppUser authenticate(String username, String rawPassword, Country instanceCountry) {
        String candidate = rawPassword != null ? rawPassword : "";
        AppUser user = (username == null || username.isBlank())
                ? null
                : appUserRepository.findByUsername(username).orElse(null);

        // One hash comparison on every path keeps refusals indistinguishable by timing.
        boolean passwordMatches = passwordEncoder.matches(
                candidate,
                user != null ? user.getPasswordHash() : dummyHash
        );

        if (user == null || rawPassword == null) {
            throw refuse(username, AuthFailure.NOT_FOUND);
        }

        if (user.getCountry() != instanceCountry) {
            throw refuse(username, AuthFailure.COUNTRY_MISMATCH);
        }

        if (!user.isActive()) {
            throw refuse(username, AuthFailure.INACTIVE);
        }

        if (!passwordMatches) {
            throw refuse(username, AuthFailure.BAD_PASSWORD);
        }

        user.setLastLogin(OffsetDateTime.now(clock));
        return user;
    }

    private AuthProblemException refuse(String username, AuthFailure failure) {
        log.info("Authentication refused username={} reason={}", username, failure);
        return AuthProblemException.invalidCredentials(failure);
    }
}
