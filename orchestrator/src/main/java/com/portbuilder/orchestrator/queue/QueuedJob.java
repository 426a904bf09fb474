package com.portbuilder.orchestrator.queue;

/**
 * Work item accepted by {@link QueueManager#submit}.
 *
 * All three callbacks are invoked on the event loop thread.
 */
public interface QueuedJob {

    enum Admission {
        START,              // spawn the job now
        STALL,              // a shared resource is held; retry when another job in the queue finishes
        ALREADY_COMPLETE,   // nothing to run, report success
        REJECT              // cannot succeed, report failure
    }

    String id();

    /** Called when a slot is free, before {@link #spec()}. */
    default Admission admit() {
        return Admission.START;
    }

    JobSpec spec();

    void finished(JobResult result);
}
