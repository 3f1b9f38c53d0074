package com.pandemies.backend.global.config;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.pandemies.backend.modules.auth.application.SessionTokenGenerator;
import com.pandemies.backend.modules.auth.domain.Country;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Checks the settings the session layer depends on once the context is up.
 * A bad value aborts startup instead of surfacing later as a failed login.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private static final Duration MIN_SESSION_TTL = Duration.ofMinutes(5);
    private static final Duration MAX_SESSION_TTL = Duration.ofDays(7);

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> missingVars = new ArrayList<>();
        List<String> invalidVars = new ArrayList<>();

        String[] requiredVars = {
            "spring.datasource.url",
            "app.instance.country",
            "app.session.ttl"
        };

        for (String var : requiredVars) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(var));
            if (value.map(String::trim).orElse("").isEmpty()) {
                missingVars.add(var);
            }
        }

        Optional.ofNullable(environment.getProperty("app.instance.country"))
                .filter(value -> !value.isBlank())
                .ifPresent(value -> {
                    try {
                        Country.from(value);
                    } catch (IllegalArgumentException ex) {
                        invalidVars.add("app.instance.country: one of FRANCE, SUISSE, USA expected");
                    }
                });

        Optional.ofNullable(environment.getProperty("app.session.ttl"))
                .filter(value -> !value.isBlank())
                .ifPresent(value -> {
                    try {
                        Duration ttl = Duration.parse(value.trim());
                        if (ttl.compareTo(MIN_SESSION_TTL) < 0 || ttl.compareTo(MAX_SESSION_TTL) > 0) {
                            invalidVars.add("app.session.ttl: must be between PT5M and P7D");
                        }
                    } catch (DateTimeParseException ex) {
                        invalidVars.add("app.session.ttl: ISO-8601 duration expected (e.g. PT24H)");
                    }
                });

        Optional.ofNullable(environment.getProperty("app.session.token-bytes"))
                .filter(value -> !value.isBlank())
                .ifPresent(value -> {
                    try {
                        int bytes = Integer.parseInt(value.trim());
                        if (bytes < SessionTokenGenerator.MIN_TOKEN_BYTES || bytes > SessionTokenGenerator.MAX_TOKEN_BYTES) {
                            invalidVars.add("app.session.token-bytes: must be between "
                                    + SessionTokenGenerator.MIN_TOKEN_BYTES + " and " + SessionTokenGenerator.MAX_TOKEN_BYTES);
                        }
                    } catch (NumberFormatException ex) {
                        invalidVars.add("app.session.token-bytes: integer expected");
                    }
                });

        if (!missingVars.isEmpty() || !invalidVars.isEmpty()) {
            if (!missingVars.isEmpty()) {
                log.error("Missing required settings: {}", String.join(", ", missingVars));
            }
            invalidVars.forEach(invalid -> log.error("Invalid setting: {}", invalid));
            throw new IllegalStateException("Environment validation failed; see previous log lines");
        }

        log.info("Environment validated (country={}, sessionTtl={})",
                environment.getProperty("app.instance.country"),
                environment.getProperty("app.session.ttl"));
    }
}
