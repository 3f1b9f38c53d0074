package com.pandemies.backend.global.security;

import com.pandemies.backend.modules.auth.domain.Country;
import com.pandemies.backend.modules.auth.domain.UserRoles;

/**
 * Identity resolved from a valid session token.
 */
public record SessionPrincipal(Long userId, String username, Country country, String role) {

    public boolean isAdmin() {
        return UserRoles.isAdmin(role);
    }
}
