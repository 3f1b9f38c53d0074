package com.pandemies.backend.modules.admin.application;

import com.pandemies.backend.global.error.ProblemException;
import com.pandemies.backend.global.security.SessionPrincipal;
import com.pandemies.backend.modules.admin.application.dto.AdminUserView;
import com.pandemies.backend.modules.admin.application.dto.CreateUserCommand;
import com.pandemies.backend.modules.auth.application.SessionReaper;
import com.pandemies.backend.modules.auth.domain.AppUser;
import com.pandemies.backend.modules.auth.domain.UserRoles;
import com.pandemies.backend.modules.auth.infrastructure.persistence.AppUserRepository;

import jakarta.validation.Valid;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

@Service
@Transactional
@Validated
public class AdminMutationService {

    private static final Logger log = LoggerFactory.getLogger(AdminMutationService.class);

    private final AppUserRepository appUserRepository;
    private final PasswordEncoder passwordEncoder;
    private final SessionReaper sessionReaper;

    public AdminMutationService(
            AppUserRepository appUserRepository,
            PasswordEncoder passwordEncoder,
            SessionReaper sessionReaper
    ) {
        this.appUserRepository = appUserRepository;
        this.passwordEncoder = passwordEncoder;
        this.sessionReaper = sessionReaper;
    }

    public AdminUserView createUser(SessionPrincipal actor, @Valid CreateUserCommand command) {
        AdminAccess.requireAdmin(actor);

        String role = command.role().trim();
        if (!UserRoles.isAllowedFor(role, actor.country())) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "admin.invalid_role",
                    "Role must be one of " + UserRoles.allowedFor(actor.country()));
        }
        if (appUserRepository.existsByUsername(command.username())) {
            throw usernameTaken(command.username(), null);
        }

        AppUser user = new AppUser();
        user.setUsername(command.username());
        user.setPasswordHash(passwordEncoder.encode(command.password()));
        user.setCountry(actor.country());
        user.setRole(role);
        user.setEmail(blankToNull(command.email()));
        user.setFullName(blankToNull(command.fullName()));
        user.setActive(true);

        try {
            appUserRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            // Lost a race with a concurrent insert of the same username.
            throw usernameTaken(command.username(), ex);
        }

        log.info("User created username={} role={} by={}", user.getUsername(), role, actor.username());
        return AdminUserView.from(user);
    }

    public void deactivateUser(SessionPrincipal actor, @NonNull Long targetUserId) {
        AdminAccess.requireAdmin(actor);
        if (targetUserId.equals(actor.userId())) {
            throw new ProblemException(HttpStatus.CONFLICT, "admin.cannot_deactivate_self",
                    "Administrators cannot deactivate their own account");
        }

        AppUser target = findUser(targetUserId);
        AdminAccess.requireSameCountry(actor, target);
        if (!target.isActive()) {
            return;
        }

        // Existing sessions are left alone; they expire or get revoked on their own.
        target.setActive(false);
        log.info("User deactivated username={} by={}", target.getUsername(), actor.username());
    }

    public void deleteUser(SessionPrincipal actor, @NonNull Long targetUserId) {
        AdminAccess.requireAdmin(actor);

        AppUser target = findUser(targetUserId);
        AdminAccess.requireSameCountry(actor, target);
        if (target.isAdmin()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "admin.cannot_delete_admin",
                    "Administrator accounts cannot be deleted");
        }

        // sessions.user_id is ON DELETE CASCADE.
        appUserRepository.delete(target);
        appUserRepository.flush();
        log.info("User deleted username={} by={}", target.getUsername(), actor.username());
    }

    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public int purgeExpiredSessions(SessionPrincipal actor) {
        AdminAccess.requireAdmin(actor);
        int removed = sessionReaper.sweep();
        log.info("Manual session purge removed={} by={}", removed, actor.username());
        return removed;
    }

    private AppUser findUser(@NonNull Long userId) {
        return appUserRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "admin.user_not_found",
                        "No user with id " + userId));
    }

    private ProblemException usernameTaken(String username, Throwable cause) {
        return new ProblemException(HttpStatus.CONFLICT, "admin.username_taken",
                "Username already exists: " + username, cause);
    }

    private static String blankToNull(String value) {
        return (value == null || value.isBlank()) ? null : value.trim();
    }
}
