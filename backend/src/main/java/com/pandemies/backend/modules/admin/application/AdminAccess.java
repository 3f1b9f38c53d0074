package com.pandemies.backend.modules.admin.application;

import com.pandemies.backend.global.error.ProblemException;
import com.pandemies.backend.global.security.SessionPrincipal;
import com.pandemies.backend.modules.auth.domain.AppUser;

import org.springframework.http.HttpStatus;

final class AdminAccess {

    private AdminAccess() {
    }

    static SessionPrincipal requireAdmin(SessionPrincipal actor) {
        if (actor == null || !actor.isAdmin()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "admin.access_required", "Administrator role required");
        }
        return actor;
    }

    static void requireSameCountry(SessionPrincipal actor, AppUser target) {
        if (target.getCountry() != actor.country()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "admin.cross_country",
                    "Users of another country cannot be managed from this account");
        }
    }
}
