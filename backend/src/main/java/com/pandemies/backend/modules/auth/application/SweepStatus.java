package com.pandemies.backend.modules.auth.application;

import java.time.OffsetDateTime;

/**
 * Last known outcome of the session reaper.
 */
public record SweepStatus(
        OffsetDateTime lastSuccessAt,
        int lastRemoved,
        long totalRemoved,
        int consecutiveFailures,
        OffsetDateTime lastFailureAt,
        String lastError
) {

    static SweepStatus initial() {
        return new SweepStatus(null, 0, 0L, 0, null, null);
    }

    SweepStatus succeeded(OffsetDateTime at, int removed) {
        return new SweepStatus(at, removed, totalRemoved + removed, 0, lastFailureAt, lastError);
    }

    SweepStatus failed(OffsetDateTime at, String error) {
        return new SweepStatus(lastSuccessAt, lastRemoved, totalRemoved, consecutiveFailures + 1, at, error);
    }
}
