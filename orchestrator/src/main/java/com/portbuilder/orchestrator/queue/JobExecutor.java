package com.portbuilder.orchestrator.queue;

import java.util.function.Consumer;

/**
 * Launches external jobs.
 *
 * {@code spawn} returns as soon as the job is started. {@code onExit} is
 * called exactly once, possibly from another thread, when the job ends.
 */
public interface JobExecutor {

    /**
     * @throws JobException if the job cannot be started at all
     */
    JobHandle spawn(JobSpec spec, Consumer<JobResult> onExit);

    /** Releases threads owned by the executor. Running jobs are left alone. */
    default void shutdown() {
    }
}
