package com.portbuilder.orchestrator.event;

/**
 * Listener connected to a named event on the {@link EventLoop}.
 * Always invoked on the loop thread.
 */
@FunctionalInterface
public interface EventHandler {

    void onEvent(Event event);
}
