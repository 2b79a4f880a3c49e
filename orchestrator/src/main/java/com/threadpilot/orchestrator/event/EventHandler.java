package com.threadpilot.orchestrator.event;

@FunctionalInterface
public interface EventHandler<E> {
    void handle(E event);
}
