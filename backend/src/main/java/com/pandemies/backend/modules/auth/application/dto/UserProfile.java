package com.pandemies.backend.modules.auth.application.dto;

import java.time.OffsetDateTime;

import com.pandemies.backend.modules.auth.domain.AppUser;
import com.pandemies.backend.modules.auth.domain.Country;

public record UserProfile(
        Long userId,
        String username,
        String fullName,
        String email,
        Country country,
        String role,
        boolean isAdmin,
        OffsetDateTime createdAt,
        OffsetDateTime lastLogin
) {

    public static UserProfile from(AppUser user) {
        return new UserProfile(
                user.getId(),
                user.getUsername(),
                user.getFullName(),
                user.getEmail(),
                user.getCountry(),
                user.getRole(),
                user.isAdmin(),
                user.getCreatedAt(),
                user.getLastLogin()
        );
    }
}
