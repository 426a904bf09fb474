package com.portbuilder.orchestrator.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sun.misc.Signal;

/**
 * Hooks SIGINT and SIGTERM through {@code sun.misc.Signal}.
 *
 * Installing a handler replaces the JVM default (immediate shutdown), so the
 * orchestrator decides between the graceful and forced stop paths itself.
 */
public class JvmSignalSource implements SignalSource {

    private static final Logger log = LoggerFactory.getLogger(JvmSignalSource.class);

    @Override
    public void install(EventLoop loop) {
        handle("INT",  SIGINT,  loop);
        handle("TERM", SIGTERM, loop);
    }

    private static void handle(String signal, String eventName, EventLoop loop) {
        try {
            Signal.handle(new Signal(signal), sig -> loop.enqueue(Event.of(eventName)));
            log.debug("Installed SIG{} handler", signal);
        } catch (IllegalArgumentException e) {
            // Signal already used by the VM (e.g. -Xrs) or not supported on this OS
            log.warn("Cannot handle SIG{}: {}", signal, e.getMessage());
        }
    }
}
