package com.pandemies.backend.modules.auth.application;

import com.pandemies.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public class AuthProblemException extends ProblemException {

    public static final String INVALID_CREDENTIALS = "INVALID_CREDENTIALS";
    public static final String INVALID_SESSION = "INVALID_SESSION";
    public static final String COUNTRY_MISMATCH = "COUNTRY_MISMATCH";
    public static final String SESSION_OWNER_NOT_FOUND = "SESSION_OWNER_NOT_FOUND";
    public static final String USER_INACTIVE = "USER_INACTIVE";

    private final AuthFailure failure;

    public AuthProblemException(AuthFailure failure, HttpStatus status, String code, String detail) {
        this(failure, status, code, detail, null);
    }

    public AuthProblemException(AuthFailure failure, HttpStatus status, String code, String detail, Throwable cause) {
        super(status, code, detail, cause);
        this.failure = failure;
    }

    public AuthFailure getFailure() {
        return failure;
    }

    static AuthProblemException invalidCredentials(AuthFailure failure) {
        return new AuthProblemException(failure, HttpStatus.UNAUTHORIZED, INVALID_CREDENTIALS, "Invalid credentials");
    }

    static AuthProblemException invalidSession(AuthFailure failure) {
        return new AuthProblemException(failure, HttpStatus.UNAUTHORIZED, INVALID_SESSION, "Invalid session");
    }
}
