package com.threadpilot.orchestrator.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Synchronous, typed publish/subscribe.
 *
 * Handlers for an event type run on the emitting thread in registration
 * order. A handler that throws is logged and skipped: neither the emitter
 * nor the remaining handlers ever see the failure.
 *
 * @param <T> event type key (an enum)
 * @param <E> event payload
 */
public class EventBus<T extends Enum<T>, E> {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final String name;
    private final Function<E, T> typeOf;
    private final Map<T, List<EventHandler<E>>> handlers = new ConcurrentHashMap<>();

    public EventBus(String name, Function<E, T> typeOf) {
        this.name   = name;
        this.typeOf = typeOf;
    }

    public void on(T type, EventHandler<E> handler) {
        handlers.computeIfAbsent(type, t -> new CopyOnWriteArrayList<>()).add(handler);
    }

    /** Removes one registration of {@code handler}; unknown handlers are ignored. */
    public void off(T type, EventHandler<E> handler) {
        List<EventHandler<E>> list = handlers.get(type);
        if (list != null) {
            list.remove(handler);
        }
    }

    public void emit(E event) {
        T type = typeOf.apply(event);
        List<EventHandler<E>> list = handlers.get(type);
        if (list == null) return;
        for (EventHandler<E> handler : list) {
            try {
                handler.handle(event);
            } catch (Exception e) {
                log.error("{} event handler failed for {}: {}", name, type, e.getMessage(), e);
            }
        }
    }

    public int handlerCount(T type) {
        List<EventHandler<E>> list = handlers.get(type);
        return list == null ? 0 : list.size();
    }

    public void clear() {
        handlers.clear();
    }
}
