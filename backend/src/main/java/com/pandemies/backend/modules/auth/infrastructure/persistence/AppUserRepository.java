package com.pandemies.backend.modules.auth.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.pandemies.backend.modules.auth.domain.AppUser;
import com.pandemies.backend.modules.auth.domain.Country;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AppUserRepository extends JpaRepository<AppUser, Long> {

    // Exact match: usernames are case-sensitive.
    Optional<AppUser> findByUsername(String username);

    boolean existsByUsername(String username);

    List<AppUser> findByCountryOrderByRoleAscCreatedAtDesc(Country country);

    List<AppUser> findByCountryAndRoleOrderByCreatedAtDesc(Country country, String role);
}
