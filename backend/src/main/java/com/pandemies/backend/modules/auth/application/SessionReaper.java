package com.pandemies.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Reclaims storage held by expired sessions. Purely maintenance: validation already
 * rejects expired rows, so a skipped or failed sweep only delays cleanup.
 */
@Component
public class SessionReaper {

    private static final Logger log = LoggerFactory.getLogger(SessionReaper.class);

    private final SessionService sessionService;
    private final Clock clock;
    private final AtomicReference<SweepStatus> status = new AtomicReference<>(SweepStatus.initial());

    public SessionReaper(SessionService sessionService, Clock clock) {
        this.sessionService = sessionService;
        this.clock = clock;
    }

    /**
     * Runs one sweep and returns the number of sessions removed. Failures propagate.
     */
    public int sweep() {
        try {
            int removed = sessionService.sweep();
            status.updateAndGet(current -> current.succeeded(OffsetDateTime.now(clock), removed));
            return removed;
        } catch (RuntimeException ex) {
            // Only the exception type is kept; messages can carry connection details.
            status.updateAndGet(current -> current.failed(OffsetDateTime.now(clock), ex.getClass().getSimpleName()));
            throw ex;
        }
    }

    @Scheduled(
            fixedDelayString = "${app.session.sweep-interval:PT5M}",
            initialDelayString = "${app.session.sweep-initial-delay:PT30S}"
    )
    public void scheduledSweep() {
        try {
            int removed = sweep();
            if (removed > 0) {
                log.info("Swept {} expired sessions", removed);
            }
        } catch (RuntimeException ex) {
            // Retried on the next tick; never let it escape the scheduler thread.
            log.warn("[ALERT][SessionReaper] sweep failed consecutiveFailures={} detail={}",
                    status.get().consecutiveFailures(),
                    ex.getMessage(),
                    ex);
        }
    }

    public SweepStatus status() {
        return status.get();
    }
}
