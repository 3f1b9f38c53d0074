package com.pandemies.backend.modules.auth.domain;

/**
 * ACTIVE turns into EXPIRED with wall-clock time alone. PURGED means the row is gone
 * (swept or revoked) and is terminal; it is never computed from a stored row, since a
 * purged session only shows up as a token lookup that finds nothing.
 */
public enum SessionState {
    ACTIVE,
    EXPIRED,
    PURGED
}
