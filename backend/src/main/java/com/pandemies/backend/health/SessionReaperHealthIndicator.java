package com.pandemies.backend.health;

import java.util.LinkedHashMap;
import java.util.Map;

import com.pandemies.backend.modules.auth.application.SessionReaper;
import com.pandemies.backend.modules.auth.application.SweepStatus;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Exposes the last session sweep outcome as the {@code sessionReaper} health contributor.
 * Reports DOWN once consecutive failures reach the configured threshold.
 */
@Component
public class SessionReaperHealthIndicator implements HealthIndicator {

    private final SessionReaper sessionReaper;
    private final int failureThreshold;

    public SessionReaperHealthIndicator(
            SessionReaper sessionReaper,
            @Value("${app.session.reaper.failure-threshold:3}") int failureThreshold
    ) {
        this.sessionReaper = sessionReaper;
        this.failureThreshold = Math.max(1, failureThreshold);
    }

    @Override
    public Health health() {
        SweepStatus status = sessionReaper.status();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("consecutiveFailures", status.consecutiveFailures());
        details.put("failureThreshold", failureThreshold);
        details.put("lastRemoved", status.lastRemoved());
        details.put("totalRemoved", status.totalRemoved());
        // Health.Builder rejects null detail values.
        if (status.lastSuccessAt() != null) {
            details.put("lastSuccessAt", status.lastSuccessAt().toString());
        }
        if (status.lastFailureAt() != null) {
            details.put("lastFailureAt", status.lastFailureAt().toString());
        }
        if (status.lastError() != null) {
            details.put("lastError", status.lastError());
        }

        Health.Builder builder = status.consecutiveFailures() >= failureThreshold
                ? Health.down()
                : Health.up();
        return builder.withDetails(details).build();
    }
}
