package com.pandemies.backend.modules.auth.domain;

import java.util.List;

/**
 * Role vocabulary. Storage keeps roles as free text; provisioning only accepts
 * {@code admin_<country>} and {@code chercheur_<country>}.
 */
public final class UserRoles {

    public static final String ADMIN_PREFIX = "admin_";
    public static final String RESEARCHER_PREFIX = "chercheur_";

    private UserRoles() {
    }

    public static String admin(Country country) {
        return ADMIN_PREFIX + country.roleSuffix();
    }

    public static String researcher(Country country) {
        return RESEARCHER_PREFIX + country.roleSuffix();
    }

    public static List<String> allowedFor(Country country) {
        return List.of(researcher(country), admin(country));
    }

    public static boolean isAllowedFor(String role, Country country) {
        return role != null && allowedFor(country).contains(role);
    }

    public static boolean isAdmin(String role) {
        return role != null && role.startsWith(ADMIN_PREFIX);
    }
}
