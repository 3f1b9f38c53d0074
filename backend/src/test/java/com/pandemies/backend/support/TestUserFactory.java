package com.pandemies.backend.support;

import com.pandemies.backend.modules.auth.domain.AppUser;
import com.pandemies.backend.modules.auth.domain.Country;
import com.pandemies.backend.modules.auth.domain.UserRoles;
import com.pandemies.backend.modules.auth.infrastructure.persistence.AppUserRepository;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates accounts with a known password. Usernames carry the {@code it_} prefix so
 * {@link AbstractPostgresIntegrationTest} can remove them after each test.
 */
@Component
@Transactional
public class TestUserFactory {

    public static final String PREFIX = "it_";

    private final AppUserRepository appUserRepository;
    private final PasswordEncoder passwordEncoder;

    public TestUserFactory(AppUserRepository appUserRepository, PasswordEncoder passwordEncoder) {
        this.appUserRepository = appUserRepository;
        this.passwordEncoder = passwordEncoder;
    }

    public AppUser ensureResearcher(String name, String rawPassword, Country country) {
        return ensureUser(name, rawPassword, country, UserRoles.researcher(country));
    }

    public AppUser ensureAdmin(String name, String rawPassword, Country country) {
        return ensureUser(name, rawPassword, country, UserRoles.admin(country));
    }

    public AppUser ensureUser(String name, String rawPassword, Country country, String role) {
        String username = name.startsWith(PREFIX) ? name : PREFIX + name;
        AppUser user = appUserRepository.findByUsername(username)
                .orElseGet(AppUser::new);
        user.setUsername(username);
        user.setPasswordHash(passwordEncoder.encode(rawPassword));
        user.setCountry(country);
        user.setRole(role);
        user.setEmail(username + "@example.org");
        user.setFullName("Test " + username);
        user.setActive(true);
        return appUserRepository.save(user);
    }
}
