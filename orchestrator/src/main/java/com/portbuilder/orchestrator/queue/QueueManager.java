package com.portbuilder.orchestrator.queue;

import com.portbuilder.orchestrator.PortbuilderException;
import com.portbuilder.orchestrator.config.BuildPolicy;
import com.portbuilder.orchestrator.event.Event;
import com.portbuilder.orchestrator.event.EventLoop;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Load-limited admission queues, one per {@link QueueName}.
 *
 * <p>Each queue runs at most {@code load} jobs at once and starts waiting
 * jobs in submission order. A load of 0 pauses the queue without dropping
 * anything; raising it again dispatches immediately.
 *
 * <p>Job completions come back through the {@link EventLoop} as
 * {@value #JOB_COMPLETED} events, so every state change here happens on the
 * loop thread. A job that fails to spawn is reported through the same path
 * with exit code {@link JobResult#SPAWN_FAILED}.
 *
 * <pre>
 *   portbuilder.job.completed{queue, status="success|failure"}
 *   portbuilder.job.duration{queue}
 * </pre>
 */
@Component
public class QueueManager {

    private static final Logger log = LoggerFactory.getLogger(QueueManager.class);

    public static final String JOB_COMPLETED = "job.completed";

    private final EventLoop     eventLoop;
    private final JobExecutor   executor;
    private final MeterRegistry meterRegistry;

    private final Map<QueueName, StageQueue> queues = new EnumMap<>(QueueName.class);
    private final Map<String, StageQueue>    owners = new HashMap<>();

    public QueueManager(EventLoop eventLoop,
                        JobExecutor executor,
                        BuildPolicy policy,
                        MeterRegistry meterRegistry) {
        this.eventLoop     = eventLoop;
        this.executor      = executor;
        this.meterRegistry = meterRegistry;
        for (QueueName name : QueueName.values()) {
            int load = policy.load(name);
            requireValidLoad(name, load);
            queues.put(name, new StageQueue(name, load));
        }
        eventLoop.connect(JOB_COMPLETED, this::onJobCompleted);
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /** Appends a job to the queue and starts it if a slot is free. */
    public void submit(QueueName name, QueuedJob job) {
        if (owners.containsKey(job.id())) {
            throw new PortbuilderException(PortbuilderException.Kind.ILLEGAL_STATE,
                    "Job " + job.id() + " is already running");
        }
        StageQueue queue = queues.get(name);
        queue.pending.addLast(job);
        log.debug("Queued {} on {} (running={}, load={}, waiting={})",
                job.id(), name.key(), queue.running.size(), queue.load, queue.pending.size());
        dispatch(queue);
    }

    /**
     * Withdraws a job that has not started yet.
     *
     * @return false if the job is unknown or already running
     */
    public boolean cancel(QueuedJob job) {
        for (StageQueue queue : queues.values()) {
            if (queue.pending.remove(job) || queue.stalled.remove(job)) {
                log.debug("Withdrew {} from {}", job.id(), queue.name.key());
                return true;
            }
        }
        return false;
    }

    // ------------------------------------------------------------------
    // Loads
    // ------------------------------------------------------------------

    public int load(QueueName name) {
        return queues.get(name).load;
    }

    public void setLoad(QueueName name, int load) {
        requireValidLoad(name, load);
        StageQueue queue = queues.get(name);
        int previous = queue.load;
        queue.load = load;
        if (load != previous) {
            log.debug("Load of {} changed {} -> {}", name.key(), previous, load);
        }
        if (load > previous) {
            dispatch(queue);
        }
    }

    /** Sets every queue not listed in {@code keep} to load 0. */
    public void pauseAllExcept(Set<QueueName> keep) {
        for (QueueName name : QueueName.values()) {
            if (!keep.contains(name)) {
                setLoad(name, 0);
            }
        }
    }

    public void pauseAll() {
        pauseAllExcept(Set.of());
    }

    /** Puts every queue back to its configured load. */
    public void restoreLoads() {
        for (StageQueue queue : queues.values()) {
            setLoad(queue.name, queue.configuredLoad);
        }
    }

    // ------------------------------------------------------------------
    // Inspection
    // ------------------------------------------------------------------

    public int running(QueueName name)     { return queues.get(name).running.size(); }
    public int waiting(QueueName name)     { return queues.get(name).pending.size() + queues.get(name).stalled.size(); }
    public int peakRunning(QueueName name) { return queues.get(name).peakRunning; }

    public boolean isIdle() {
        return queues.values().stream()
                .allMatch(q -> q.running.isEmpty() && q.pending.isEmpty() && q.stalled.isEmpty());
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    /**
     * Kills every running job. Completions still arrive through the event
     * loop if it keeps running.
     */
    public void killAll(boolean force) {
        for (StageQueue queue : queues.values()) {
            for (StageQueue.Running running : List.copyOf(queue.running.values())) {
                if (running.handle == null) {
                    continue;
                }
                log.warn("Killing {} ({})", running.job.id(), force ? "SIGKILL" : "SIGTERM");
                try {
                    running.handle.kill(force);
                } catch (JobException e) {
                    log.error("Could not kill {}: {}", running.job.id(), e.getMessage(), e);
                }
            }
        }
    }

    // ------------------------------------------------------------------
    // Dispatch
    // ------------------------------------------------------------------

    private void dispatch(StageQueue queue) {
        while (queue.hasCapacity() && !queue.pending.isEmpty()) {
            QueuedJob job = queue.pending.pollFirst();
            switch (job.admit()) {
                case START -> launch(queue, job);
                case STALL -> {
                    log.debug("{} stalled on {}", job.id(), queue.name.key());
                    queue.stalled.add(job);
                }
                case ALREADY_COMPLETE -> eventLoop.post(() -> job.finished(JobResult.success(job.id())));
                case REJECT -> eventLoop.post(() -> job.finished(JobResult.rejected(job.id(), "rejected on admission")));
            }
        }
    }

    private void launch(StageQueue queue, QueuedJob job) {
        JobSpec spec = job.spec();
        StageQueue.Running running = new StageQueue.Running(job, Timer.start(meterRegistry));
        queue.running.put(job.id(), running);
        queue.recordPeak();
        owners.put(job.id(), queue);
        eventLoop.beginExternal();

        log.info("Starting {} on {} ({}/{})", job.id(), queue.name.key(), queue.running.size(), queue.load);
        try {
            running.handle = executor.spawn(spec,
                    result -> eventLoop.completeExternal(new Event(JOB_COMPLETED, result)));
        } catch (JobException e) {
            log.error("Could not spawn {}: {}", job.id(), e.getMessage());
            eventLoop.completeExternal(new Event(JOB_COMPLETED, JobResult.spawnFailed(job.id(), e.getMessage())));
        }
    }

    private void onJobCompleted(Event event) {
        JobResult result = event.payload(JobResult.class);
        StageQueue queue = owners.remove(result.jobId());
        if (queue == null) {
            log.warn("Completion for unknown job {}", result.jobId());
            return;
        }
        StageQueue.Running running = queue.running.remove(result.jobId());
        String status = result.success() ? "success" : "failure";
        running.sample.stop(meterRegistry.timer("portbuilder.job.duration", "queue", queue.name.key()));
        meterRegistry.counter("portbuilder.job.completed", "queue", queue.name.key(), "status", status).increment();
        log.debug("{} finished with exit code {}", result.jobId(), result.exitCode());

        running.job.finished(result);

        // Stalled jobs go back to the front, ahead of later submissions
        if (!queue.stalled.isEmpty()) {
            List<QueuedJob> retry = new ArrayList<>(queue.stalled);
            queue.stalled.clear();
            for (int i = retry.size() - 1; i >= 0; i--) {
                queue.pending.addFirst(retry.get(i));
            }
        }
        dispatch(queue);
    }

    private static void requireValidLoad(QueueName name, int load) {
        if (load < 0) {
            throw new PortbuilderException(PortbuilderException.Kind.INVALID_CONFIG,
                    "Load of queue '" + name.key() + "' must be >= 0, got " + load);
        }
    }
}
