package com.portbuilder.orchestrator.queue;

/** Live handle on a spawned job, owned by the {@link QueueManager} while the job runs. */
public interface JobHandle {

    String jobId();

    /**
     * Stops the job and anything it spawned.
     *
     * @param force SIGKILL instead of SIGTERM
     */
    void kill(boolean force);
}
