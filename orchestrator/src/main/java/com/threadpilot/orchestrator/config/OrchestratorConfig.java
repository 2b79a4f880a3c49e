package com.threadpilot.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.threadpilot.orchestrator.event.EventBus;
import com.threadpilot.orchestrator.event.SchedulerEvent;
import com.threadpilot.orchestrator.event.SchedulerEventType;
import com.threadpilot.orchestrator.event.SessionEvent;
import com.threadpilot.orchestrator.event.SessionEventType;
import com.threadpilot.orchestrator.repository.SessionFileRepository;
import com.threadpilot.orchestrator.scheduler.DeadlockDetector;
import com.threadpilot.orchestrator.scheduler.DeadlockResolutionPolicy;
import com.threadpilot.orchestrator.scheduler.ExecutionScheduler;
import com.threadpilot.orchestrator.scheduler.OldestDependencyPolicy;
import com.threadpilot.orchestrator.scheduler.SchedulerSettings;
import com.threadpilot.orchestrator.service.SessionService;
import com.threadpilot.orchestrator.service.StalledSessionRecovery;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Wires the orchestrator core.
 *
 * Every collaborator is an explicit bean passed by constructor, so tests can
 * assemble the same graph by hand without a Spring context.
 */
@Configuration
public class OrchestratorConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    SchedulerSettings schedulerSettings(
            @Value("${orchestrator.scheduler.max-sessions:3}") int maxSessions,
            @Value("${orchestrator.scheduler.queue-timeout-seconds:300}") long queueTimeoutSeconds) {
        return SchedulerSettings.of(maxSessions, queueTimeoutSeconds);
    }

    // ------------------------------------------------------------------
    // Event buses
    // ------------------------------------------------------------------

    @Bean
    EventBus<SchedulerEventType, SchedulerEvent> schedulerEvents() {
        return new EventBus<>("scheduler", SchedulerEvent::type);
    }

    @Bean
    EventBus<SessionEventType, SessionEvent> sessionEvents() {
        return new EventBus<>("session", SessionEvent::type);
    }

    // ------------------------------------------------------------------
    // Scheduler
    // ------------------------------------------------------------------

    @Bean(destroyMethod = "shutdownNow")
    ScheduledExecutorService queueTimeoutTimer() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "queue-timeout");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean(destroyMethod = "shutdown")
    ExecutionScheduler executionScheduler(SchedulerSettings settings,
                                          EventBus<SchedulerEventType, SchedulerEvent> schedulerEvents,
                                          ScheduledExecutorService queueTimeoutTimer,
                                          Clock clock,
                                          MeterRegistry meterRegistry) {
        return new ExecutionScheduler(settings, schedulerEvents, queueTimeoutTimer, clock, meterRegistry);
    }

    @Bean
    DeadlockResolutionPolicy deadlockResolutionPolicy() {
        return new OldestDependencyPolicy();
    }

    @Bean
    DeadlockDetector deadlockDetector(ExecutionScheduler scheduler,
                                      DeadlockResolutionPolicy policy,
                                      MeterRegistry meterRegistry) {
        return new DeadlockDetector(scheduler, policy, meterRegistry);
    }

    // ------------------------------------------------------------------
    // Session store
    // ------------------------------------------------------------------

    @Bean
    SessionFileRepository sessionFileRepository(
            @Value("${orchestrator.sessions.store-path}") String storePath,
            ObjectMapper objectMapper) {
        return new SessionFileRepository(Path.of(storePath), objectMapper);
    }

    // Saves after mutations run here, off the request threads.
    @Bean(destroyMethod = "shutdown")
    ExecutorService sessionPersistenceExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "session-persistence");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Loads the store eagerly: an unreadable file aborts startup. The final
     * synchronous flush runs when the context closes, which Spring's shutdown
     * hook triggers on SIGINT/SIGTERM.
     */
    @Bean(destroyMethod = "flush")
    SessionService sessionService(SessionFileRepository repository,
                                  EventBus<SessionEventType, SessionEvent> sessionEvents,
                                  ExecutorService sessionPersistenceExecutor,
                                  Clock clock) {
        SessionService service = new SessionService(repository, sessionEvents, sessionPersistenceExecutor, clock);
        service.load();
        return service;
    }

    @Bean
    StalledSessionRecovery stalledSessionRecovery(SessionService sessionService,
                                                  Clock clock,
                                                  MeterRegistry meterRegistry) {
        return new StalledSessionRecovery(sessionService, clock, meterRegistry);
    }

    @Bean
    SessionSchedulingBridge sessionSchedulingBridge(EventBus<SessionEventType, SessionEvent> sessionEvents,
                                                    ExecutionScheduler scheduler) {
        SessionSchedulingBridge bridge = new SessionSchedulingBridge(scheduler);
        bridge.register(sessionEvents);
        return bridge;
    }
}
