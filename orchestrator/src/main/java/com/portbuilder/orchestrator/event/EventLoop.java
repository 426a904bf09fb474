package com.portbuilder.orchestrator.event;

import com.portbuilder.orchestrator.PortbuilderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Single-threaded cooperative event loop.
 *
 * Every mutation of ports, stages and queues happens inside a listener run by
 * {@link #run()}. Listeners never call each other directly; they post events
 * which are appended to the back of the deque (a trampoline), so long
 * dependency chains do not grow the call stack.
 *
 * <p>Other threads (process watchers, signal handlers) may only call
 * {@link #enqueue} and {@link #completeExternal}. Those land in a blocking
 * inbox which the loop drains between events, preserving arrival order.
 *
 * <p>{@code run()} returns once no event is pending and no external job
 * started through {@link #beginExternal()} is outstanding. It can be called
 * again later, e.g. after raising queue loads for a second pass.
 */
@Component
public class EventLoop {

    private static final Logger log = LoggerFactory.getLogger(EventLoop.class);

    /** Event name used for plain deferred tasks posted via {@link #post(Runnable)}. */
    public static final String TASK = "loop.task";

    private final Deque<Event> events = new ArrayDeque<>();
    private final BlockingQueue<Delivery> inbox = new LinkedBlockingQueue<>();
    private final Map<String, List<EventHandler>> listeners = new HashMap<>();

    // Loop thread only
    private int outstanding;
    private boolean exitRequested;
    private volatile boolean running;

    // ------------------------------------------------------------------
    // Posting (loop thread)
    // ------------------------------------------------------------------

    public void post(Event event) {
        events.addLast(event);
    }

    public void post(String name, Object payload) {
        post(new Event(name, payload));
    }

    /** Defers a piece of work until the current listener has returned. */
    public void post(Runnable task) {
        post(new Event(TASK, task));
    }

    // ------------------------------------------------------------------
    // Cross-thread delivery
    // ------------------------------------------------------------------

    /** Thread-safe; used by signal handlers. */
    public void enqueue(Event event) {
        inbox.add(new Delivery(event, false));
    }

    /**
     * Registers an external job whose completion will arrive later through
     * {@link #completeExternal}. While any is outstanding {@code run()} blocks
     * instead of returning.
     */
    public void beginExternal() {
        outstanding++;
    }

    /** Thread-safe; delivers the completion of a job started with {@link #beginExternal()}. */
    public void completeExternal(Event event) {
        inbox.add(new Delivery(event, true));
    }

    // ------------------------------------------------------------------
    // Listeners
    // ------------------------------------------------------------------

    public void connect(String name, EventHandler handler) {
        listeners.computeIfAbsent(name, k -> new ArrayList<>()).add(handler);
    }

    public void disconnect(String name, EventHandler handler) {
        List<EventHandler> handlers = listeners.get(name);
        if (handlers != null) {
            handlers.remove(handler);
        }
    }

    // ------------------------------------------------------------------
    // Running
    // ------------------------------------------------------------------

    /**
     * Drains events until quiescent or until {@link #exit()} is called.
     * A listener exception aborts the run and propagates to the caller.
     */
    public void run() {
        exitRequested = false;
        running = true;
        try {
            while (!exitRequested) {
                drainInbox();
                Event next = events.pollFirst();
                if (next != null) {
                    dispatch(next);
                    continue;
                }
                if (outstanding == 0) {
                    return;
                }
                accept(awaitDelivery());
            }
            log.debug("Event loop exited with {} outstanding job(s) and {} pending event(s)",
                    outstanding, events.size());
        } finally {
            running = false;
        }
    }

    /** Makes the current {@link #run()} return at the next event boundary. */
    public void exit() {
        exitRequested = true;
    }

    public boolean isRunning()      { return running; }
    public int     outstandingJobs() { return outstanding; }
    public int     pendingEvents()  { return events.size() + inbox.size(); }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void dispatch(Event event) {
        if (TASK.equals(event.name())) {
            event.payload(Runnable.class).run();
            return;
        }
        List<EventHandler> handlers = listeners.get(event.name());
        if (handlers == null || handlers.isEmpty()) {
            log.trace("No listener for event '{}'", event.name());
            return;
        }
        log.trace("Dispatching '{}' to {} listener(s)", event.name(), handlers.size());
        // Copy: a listener may disconnect itself while being notified
        for (EventHandler handler : List.copyOf(handlers)) {
            handler.onEvent(event);
        }
    }

    private void drainInbox() {
        Delivery delivery;
        while ((delivery = inbox.poll()) != null) {
            accept(delivery);
        }
    }

    private void accept(Delivery delivery) {
        if (delivery.external()) {
            outstanding--;
        }
        events.addLast(delivery.event());
    }

    private Delivery awaitDelivery() {
        try {
            return inbox.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PortbuilderException(PortbuilderException.Kind.ILLEGAL_STATE,
                    "Event loop interrupted while waiting for " + outstanding + " job(s)", e);
        }
    }

    private record Delivery(Event event, boolean external) {}
}
