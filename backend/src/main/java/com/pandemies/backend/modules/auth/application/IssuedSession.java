package com.pandemies.backend.modules.auth.application;

import java.time.OffsetDateTime;

public record IssuedSession(String token, Long userId, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
}
