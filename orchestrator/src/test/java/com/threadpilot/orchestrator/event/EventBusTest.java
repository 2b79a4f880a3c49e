package com.threadpilot.orchestrator.event;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class EventBusTest {

    EventBus<SchedulerEventType, SchedulerEvent> bus;
    List<String> calls;

    @BeforeEach
    void setUp() {
        bus   = new EventBus<>("test", SchedulerEvent::type);
        calls = new ArrayList<>();
    }

    @Test
    void emit_invokesHandlersInRegistrationOrder() {
        bus.on(SchedulerEventType.SESSION_STARTED, e -> calls.add("first:" + e.sessionId()));
        bus.on(SchedulerEventType.SESSION_STARTED, e -> calls.add("second:" + e.sessionId()));

        bus.emit(started("s1"));

        assertThat(calls).containsExactly("first:s1", "second:s1");
    }

    @Test
    void emit_onlyReachesHandlersOfThatType() {
        bus.on(SchedulerEventType.SESSION_COMPLETED, e -> calls.add("completed"));

        bus.emit(started("s1"));

        assertThat(calls).isEmpty();
    }

    @Test
    void failingHandler_isIsolatedFromEmitterAndOtherHandlers() {
        bus.on(SchedulerEventType.SESSION_STARTED, e -> { throw new IllegalStateException("boom"); });
        bus.on(SchedulerEventType.SESSION_STARTED, e -> calls.add("survivor"));

        assertThatCode(() -> bus.emit(started("s1"))).doesNotThrowAnyException();
        assertThat(calls).containsExactly("survivor");
    }

    @Test
    void off_removesHandler() {
        EventHandler<SchedulerEvent> handler = e -> calls.add("x");
        bus.on(SchedulerEventType.SESSION_STARTED, handler);
        bus.off(SchedulerEventType.SESSION_STARTED, handler);

        bus.emit(started("s1"));

        assertThat(calls).isEmpty();
        assertThat(bus.handlerCount(SchedulerEventType.SESSION_STARTED)).isZero();
    }

    @Test
    void off_unknownHandler_isIgnored() {
        assertThatCode(() -> bus.off(SchedulerEventType.SESSION_QUEUED, e -> {}))
                .doesNotThrowAnyException();
    }

    private static SchedulerEvent started(String sessionId) {
        return new SchedulerEvent(SchedulerEventType.SESSION_STARTED, sessionId, Map.of());
    }
}
