package com.pandemies.backend.modules.auth.application;

import java.time.OffsetDateTime;
import java.util.Optional;

import com.pandemies.backend.global.security.SessionPrincipal;

/**
 * Result of looking a token up. Only {@link Outcome#VALID} carries a principal.
 */
public record SessionValidation(Outcome outcome, SessionPrincipal principal, OffsetDateTime expiresAt) {

    public enum Outcome {
        VALID,
        NOT_FOUND,
        EXPIRED,
        INACTIVE;

        AuthFailure toFailure() {
            return switch (this) {
                case NOT_FOUND -> AuthFailure.NOT_FOUND;
                case EXPIRED -> AuthFailure.EXPIRED;
                case INACTIVE -> AuthFailure.INACTIVE;
                case VALID -> throw new IllegalStateException("VALID is not a failure");
            };
        }
    }

    static SessionValidation valid(SessionPrincipal principal, OffsetDateTime expiresAt) {
        return new SessionValidation(Outcome.VALID, principal, expiresAt);
    }

    static SessionValidation invalid(Outcome outcome, OffsetDateTime expiresAt) {
        return new SessionValidation(outcome, null, expiresAt);
    }

    public boolean isValid() {
        return outcome == Outcome.VALID;
    }

    public Optional<Long> userId() {
        return isValid() ? Optional.of(principal.userId()) : Optional.empty();
    }
}
