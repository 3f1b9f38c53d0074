package com.pandemies.backend.global.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on background maintenance jobs such as the session reaper.
 * Integration tests switch it off with {@code app.scheduling.enabled=false}
 * so sweeps only happen when a test asks for one.
 */
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(value = "app.scheduling.enabled", havingValue = "true", matchIfMissing = true)
@EnableScheduling
public class SchedulingConfig {
}
