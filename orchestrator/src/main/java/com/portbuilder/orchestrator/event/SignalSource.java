package com.portbuilder.orchestrator.event;

/**
 * Delivers operating system signals into the {@link EventLoop}.
 *
 * Implementations must do nothing in their handlers beyond
 * {@link EventLoop#enqueue}; the scheduler reacts to the resulting events
 * on the loop thread.
 */
public interface SignalSource {

    String SIGINT  = "signal.SIGINT";
    String SIGTERM = "signal.SIGTERM";

    void install(EventLoop loop);
}
