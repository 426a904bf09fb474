package com.portbuilder.orchestrator.queue;

import io.micrometer.core.instrument.Timer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** State of one named queue. Only touched by {@link QueueManager} on the loop thread. */
class StageQueue {

    final QueueName name;
    final int       configuredLoad;
    int             load;
    int             peakRunning;

    final Deque<QueuedJob>     pending = new ArrayDeque<>();
    final List<QueuedJob>      stalled = new ArrayList<>();
    final Map<String, Running> running = new LinkedHashMap<>();

    StageQueue(QueueName name, int load) {
        this.name           = name;
        this.configuredLoad = load;
        this.load           = load;
    }

    boolean hasCapacity() {
        return running.size() < load;
    }

    void recordPeak() {
        peakRunning = Math.max(peakRunning, running.size());
    }

    static final class Running {
        final QueuedJob   job;
        final Timer.Sample sample;
        JobHandle          handle;   // null until spawn returns

        Running(QueuedJob job, Timer.Sample sample) {
            this.job    = job;
            this.sample = sample;
        }
    }
}
