package com.pandemies.backend.modules.auth.application;

import java.time.Duration;

import com.pandemies.backend.global.security.SessionPrincipal;
import com.pandemies.backend.modules.auth.application.dto.LoginCommand;
import com.pandemies.backend.modules.auth.application.dto.LoginResult;
import com.pandemies.backend.modules.auth.application.dto.UserProfile;
import com.pandemies.backend.modules.auth.domain.AppUser;
import com.pandemies.backend.modules.auth.domain.Country;

import jakarta.validation.Valid;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

/**
 * Login, logout and principal resolution for this deployment instance.
 * Not transactional itself: each issuance attempt runs in its own transaction so a
 * token collision can be retried.
 */
@Service
@Validated
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final CredentialService credentialService;
    private final SessionService sessionService;
    private final Country instanceCountry;
    private final Duration sessionTtl;
    private final int issueMaxAttempts;

    public AuthService(
            CredentialService credentialService,
            SessionService sessionService,
            @Value("${app.instance.country:FRANCE}") Country instanceCountry,
            @Value("${app.session.ttl:PT24H}") Duration sessionTtl,
            @Value("${app.session.issue-max-attempts:3}") int issueMaxAttempts
    ) {
        if (issueMaxAttempts < 1) {
            throw new IllegalArgumentException("app.session.issue-max-attempts must be >= 1");
        }
        this.credentialService = credentialService;
        this.sessionService = sessionService;
        this.instanceCountry = instanceCountry;
        this.sessionTtl = sessionTtl;
        this.issueMaxAttempts = issueMaxAttempts;
    }

    public LoginResult login(@Valid LoginCommand command) {
        AppUser user = credentialService.authenticate(command.username(), command.password(), instanceCountry);
        ClientMetadata client = ClientMetadata.of(command.sourceAddress(), command.clientDescriptor());

        IssuedSession issued = issueWithRetry(user.getId(), client);
        log.info("Login succeeded username={} country={}", user.getUsername(), user.getCountry());
        return new LoginResult(issued.token(), issued.expiresAt(), UserProfile.from(user));
    }

    public void logout(String token) {
        if (token == null || token.isBlank()) {
            return;
        }
        // Unknown tokens get the same silent answer so logout cannot probe token validity.
        boolean removed = sessionService.revoke(token);
        log.debug("Logout processed removed={}", removed);
    }

    /**
     * Resolves the caller behind a token and checks it belongs to this instance's country.
     */
    public SessionPrincipal currentUser(String token) {
        SessionValidation validation = sessionService.validate(token);
        if (!validation.isValid()) {
            log.debug("Session rejected reason={}", validation.outcome());
            throw AuthProblemException.invalidSession(validation.outcome().toFailure());
        }

        SessionPrincipal principal = validation.principal();
        if (principal.country() != instanceCountry) {
            log.info("Session refused on {} instance for user={} of {}",
                    instanceCountry, principal.username(), principal.country());
            throw new AuthProblemException(
                    AuthFailure.COUNTRY_MISMATCH,
                    HttpStatus.FORBIDDEN,
                    AuthProblemException.COUNTRY_MISMATCH,
                    "Access denied: this is the " + instanceCountry + " instance"
            );
        }
        return principal;
    }

    private IssuedSession issueWithRetry(Long userId, ClientMetadata client) {
        SessionTokenCollisionException lastCollision = null;
        for (int attempt = 1; attempt <= issueMaxAttempts; attempt++) {
            try {
                return sessionService.issue(userId, sessionTtl, client);
            } catch (SessionTokenCollisionException ex) {
                lastCollision = ex;
                log.warn("Session token collision user={} attempt={}/{}", userId, attempt, issueMaxAttempts);
            }
        }
        throw lastCollision;
    }
}
