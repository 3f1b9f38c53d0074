package com.pandemies.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

import com.pandemies.backend.global.security.SessionPrincipal;
import com.pandemies.backend.modules.auth.application.SessionValidation.Outcome;
import com.pandemies.backend.modules.auth.domain.AppUser;
import com.pandemies.backend.modules.auth.domain.SessionState;
import com.pandemies.backend.modules.auth.domain.UserSession;
import com.pandemies.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.pandemies.backend.modules.auth.infrastructure.persistence.UserSessionRepository;

import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Issues, validates and revokes session tokens. Every operation is a single statement
 * against {@code sessions}, so no locking is needed between concurrent callers.
 */
@Service
@Transactional
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    static final String TOKEN_CONSTRAINT = "uq_sessions_token";
    static final String OWNER_CONSTRAINT = "fk_sessions_user";

    private final UserSessionRepository userSessionRepository;
    private final AppUserRepository appUserRepository;
    private final SessionTokenGenerator tokenGenerator;
    private final Clock clock;
    private final boolean enforceActiveUser;

    public SessionService(
            UserSessionRepository userSessionRepository,
            AppUserRepository appUserRepository,
            SessionTokenGenerator tokenGenerator,
            Clock clock,
            @Value("${app.session.enforce-active-user:false}") boolean enforceActiveUser
    ) {
        this.userSessionRepository = userSessionRepository;
        this.appUserRepository = appUserRepository;
        this.tokenGenerator = tokenGenerator;
        this.clock = clock;
        this.enforceActiveUser = enforceActiveUser;
    }

    /**
     * Persists a new session for an existing, active user.
     *
     * @throws AuthProblemException           when the user is missing or inactive
     * @throws SessionTokenCollisionException when the generated token is already taken
     */
    public IssuedSession issue(Long userId, Duration ttl, ClientMetadata clientMetadata) {
        Objects.requireNonNull(userId, "userId");
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("Session ttl must be positive: " + ttl);
        }

        AppUser user = appUserRepository.findById(userId)
                .orElseThrow(() -> ownerNotFound(userId, null));
        if (!user.isActive()) {
            throw new AuthProblemException(
                    AuthFailure.INACTIVE,
                    HttpStatus.FORBIDDEN,
                    AuthProblemException.USER_INACTIVE,
                    "User " + userId + " is inactive"
            );
        }

        ClientMetadata client = clientMetadata != null ? clientMetadata : ClientMetadata.empty();
        OffsetDateTime now = OffsetDateTime.now(clock);

        UserSession session = new UserSession();
        session.setToken(tokenGenerator.generate());
        session.setUser(user);
        session.setExpiresAt(now.plus(ttl));
        session.setSourceAddress(client.sourceAddress());
        session.setClientDescriptor(client.clientDescriptor());

        try {
            userSessionRepository.saveAndFlush(session);
        } catch (DataIntegrityViolationException ex) {
            throw translateInsertViolation(ex, userId);
        }

        log.debug("Issued session user={} expiresAt={}", userId, session.getExpiresAt());
        return new IssuedSession(session.getToken(), userId, now, session.getExpiresAt());
    }

    /**
     * Resolves a token to its owner. Never extends the expiry.
     */
    @Transactional(readOnly = true)
    public SessionValidation validate(String token) {
        if (token == null || token.isBlank()) {
            return SessionValidation.invalid(Outcome.NOT_FOUND, null);
        }

        Optional<UserSession> found = userSessionRepository.findByTokenWithUser(token);
        if (found.isEmpty()) {
            return SessionValidation.invalid(Outcome.NOT_FOUND, null);
        }

        UserSession session = found.get();
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (session.stateAt(now) != SessionState.ACTIVE) {
            // Expired rows stay until the reaper runs; they are already dead for auth.
            return SessionValidation.invalid(Outcome.EXPIRED, session.getExpiresAt());
        }

        AppUser user = session.getUser();
        if (enforceActiveUser && !user.isActive()) {
            return SessionValidation.invalid(Outcome.INACTIVE, session.getExpiresAt());
        }

        SessionPrincipal principal = new SessionPrincipal(
                user.getId(),
                user.getUsername(),
                user.getCountry(),
                user.getRole()
        );
        return SessionValidation.valid(principal, session.getExpiresAt());
    }

    /**
     * Deletes the session if present. Revoking an unknown token is a no-op.
     *
     * @return whether a row was removed
     */
    public boolean revoke(String token) {
        if (token == null || token.isBlank()) {
            return false;
        }
        return userSessionRepository.deleteByToken(token) > 0;
    }

    /**
     * Deletes every session whose expiry is at or before now.
     */
    public int sweep() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return userSessionRepository.deleteExpiredAsOf(now);
    }

    // The insert runs in an aborted transaction after the violation, so the constraint
    // name is the only safe way to tell a duplicate token from a vanished owner.
    private RuntimeException translateInsertViolation(DataIntegrityViolationException ex, Long userId) {
        String violated = violatedConstraint(ex);
        if (violated.contains(OWNER_CONSTRAINT)) {
            log.info("Session owner disappeared before insert user={}", userId);
            return ownerNotFound(userId, ex);
        }
        if (violated.contains(TOKEN_CONSTRAINT)) {
            return new SessionTokenCollisionException(ex);
        }
        return ex;
    }

    private static String violatedConstraint(DataIntegrityViolationException ex) {
        StringBuilder names = new StringBuilder();
        for (Throwable cause = ex; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException violation && violation.getConstraintName() != null) {
                names.append(violation.getConstraintName()).append(' ');
            }
            if (cause.getMessage() != null) {
                names.append(cause.getMessage()).append(' ');
            }
        }
        return names.toString().toLowerCase(Locale.ROOT);
    }

    private static AuthProblemException ownerNotFound(Long userId, Throwable cause) {
        return new AuthProblemException(
                AuthFailure.NOT_FOUND,
                HttpStatus.NOT_FOUND,
                AuthProblemException.SESSION_OWNER_NOT_FOUND,
                "No user with id " + userId,
                cause
        );
    }
}
