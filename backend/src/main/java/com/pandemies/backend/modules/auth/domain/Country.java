package com.pandemies.backend.modules.auth.domain;

import java.util.Locale;

/**
 * Countries served by the platform. Each deployment instance belongs to exactly one.
 * The {@code users.country} CHECK constraint mirrors this list.
 */
public enum Country {
    FRANCE,
    SUISSE,
    USA;

    public static Country from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("country must not be blank");
        }
        try {
            return Country.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown country: " + raw, ex);
        }
    }

    /**
     * Lowercase form used as the suffix of role codes, e.g. {@code chercheur_suisse}.
     */
    public String roleSuffix() {
        return name().toLowerCase(Locale.ROOT);
    }
}
