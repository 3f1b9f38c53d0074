package com.pandemies.backend.modules.auth.application.dto;

import java.time.OffsetDateTime;

public record LoginResult(String token, OffsetDateTime expiresAt, UserProfile user) {
}
