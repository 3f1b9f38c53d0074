package com.pandemies.backend.modules.auth.application;

/**
 * Internal reason behind an authentication or session failure. Logged, never shown to clients.
 */
public enum AuthFailure {
    NOT_FOUND,
    INACTIVE,
    EXPIRED,
    BAD_PASSWORD,
    COUNTRY_MISMATCH,
    CONSTRAINT_VIOLATION
}
