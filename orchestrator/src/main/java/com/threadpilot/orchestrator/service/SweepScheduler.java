package com.threadpilot.orchestrator.service;

import com.threadpilot.orchestrator.scheduler.DeadlockDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background timers for the orchestrator core.
 *
 * Three independent ticks, each isolated from the others' failures:
 * <ul>
 *   <li>deadlock sweep over the execution queue (default every 30 s)</li>
 *   <li>stalled-session recovery (first run at startup, then every 10 min)</li>
 *   <li>session store flush (default every 5 min)</li>
 * </ul>
 *
 * Each tick takes the monitor of the component it touches, so it never
 * interleaves with an admission or a session update in progress.
 */
@Component
@EnableScheduling
public class SweepScheduler {

    private static final Logger log = LoggerFactory.getLogger(SweepScheduler.class);

    private final DeadlockDetector       deadlockDetector;
    private final StalledSessionRecovery recovery;
    private final SessionService         sessionService;

    public SweepScheduler(DeadlockDetector deadlockDetector,
                          StalledSessionRecovery recovery,
                          SessionService sessionService) {
        this.deadlockDetector = deadlockDetector;
        this.recovery         = recovery;
        this.sessionService   = sessionService;
    }

    @Scheduled(fixedDelayString   = "${orchestrator.scheduler.deadlock-sweep-ms:30000}",
               initialDelayString = "${orchestrator.scheduler.deadlock-sweep-ms:30000}")
    public void deadlockTick() {
        try {
            int found = deadlockDetector.sweep();
            if (found > 0) {
                log.warn("Deadlock sweep resolved {} blocked session(s)", found);
            }
        } catch (Exception e) {
            log.error("Deadlock sweep failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedDelayString = "${orchestrator.sessions.recovery-interval-ms:600000}")
    public void recoveryTick() {
        try {
            recovery.recoverStalledSessions();
        } catch (Exception e) {
            log.error("Auto-recovery failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedRateString    = "${orchestrator.sessions.flush-interval-ms:300000}",
               initialDelayString = "${orchestrator.sessions.flush-interval-ms:300000}")
    public void flushTick() {
        // flush() already logs and swallows write failures.
        sessionService.flush();
    }
}
