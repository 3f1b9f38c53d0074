package com.pandemies.backend.modules.auth.application;

import com.pandemies.backend.global.error.RetryableProblemException;

import org.springframework.http.HttpStatus;

/**
 * The store rejected a freshly generated token as a duplicate. Retry issuance with a new token.
 */
public class SessionTokenCollisionException extends RetryableProblemException {

    public static final String CODE = "SESSION_TOKEN_CONFLICT";

    public SessionTokenCollisionException(Throwable cause) {
        super(HttpStatus.CONFLICT, CODE, "Session token already exists", cause);
    }

    public AuthFailure getFailure() {
        return AuthFailure.CONSTRAINT_VIOLATION;
    }
}
