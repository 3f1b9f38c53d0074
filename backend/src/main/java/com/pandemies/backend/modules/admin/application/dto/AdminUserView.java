package com.pandemies.backend.modules.admin.application.dto;

import java.time.OffsetDateTime;

import com.pandemies.backend.modules.auth.domain.AppUser;
import com.pandemies.backend.modules.auth.domain.Country;

public record AdminUserView(
        Long userId,
        String username,
        String fullName,
        String email,
        Country country,
        String role,
        boolean active,
        OffsetDateTime createdAt,
        OffsetDateTime lastLogin
) {

    public static AdminUserView from(AppUser user) {
        return new AdminUserView(
                user.getId(),
                user.getUsername(),
                user.getFullName(),
                user.getEmail(),
                user.getCountry(),
                user.getRole(),
                user.isActive(),
                user.getCreatedAt(),
                user.getLastLogin()
        );
    }
}
