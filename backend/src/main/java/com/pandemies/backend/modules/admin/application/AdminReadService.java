package com.pandemies.backend.modules.admin.application;

import java.util.List;

import com.pandemies.backend.global.security.SessionPrincipal;
import com.pandemies.backend.modules.admin.application.dto.AdminUserView;
import com.pandemies.backend.modules.auth.domain.AppUser;
import com.pandemies.backend.modules.auth.infrastructure.persistence.AppUserRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class AdminReadService {

    private final AppUserRepository appUserRepository;

    public AdminReadService(AppUserRepository appUserRepository) {
        this.appUserRepository = appUserRepository;
    }

    /**
     * Users of the actor's country, ordered by role then newest first.
     *
     * @param role optional exact role filter; blank means all roles
     */
    public List<AdminUserView> listUsers(SessionPrincipal actor, String role) {
        AdminAccess.requireAdmin(actor);

        List<AppUser> users = (role == null || role.isBlank())
                ? appUserRepository.findByCountryOrderByRoleAscCreatedAtDesc(actor.country())
                : appUserRepository.findByCountryAndRoleOrderByCreatedAtDesc(actor.country(), role.trim());

        return users.stream()
                .map(AdminUserView::from)
                .toList();
    }
}
