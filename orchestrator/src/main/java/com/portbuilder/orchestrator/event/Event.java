package com.portbuilder.orchestrator.event;

/**
 * A unit of work delivered by the {@link EventLoop}.
 *
 * @param name    key that listeners connect to (e.g. {@code "stage.completed"})
 * @param payload event data, may be null for signal-style events
 */
public record Event(String name, Object payload) {

    public static Event of(String name) {
        return new Event(name, null);
    }

    /** Returns the payload cast to the expected type. */
    public <T> T payload(Class<T> type) {
        return type.cast(payload);
    }
}
