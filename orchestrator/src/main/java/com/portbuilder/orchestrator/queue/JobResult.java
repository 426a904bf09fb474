package com.portbuilder.orchestrator.queue;

/**
 * Outcome of an external job, delivered to the event loop as the payload of
 * a {@code job.completed} event.
 */
public record JobResult(
        String jobId,
        int    exitCode,
        String output) {

    public static final int SUCCESS      = 0;
    public static final int SPAWN_FAILED = 127;

    public static JobResult success(String jobId) {
        return new JobResult(jobId, SUCCESS, "");
    }

    /** A job that could not be started; treated exactly like a non-zero exit. */
    public static JobResult spawnFailed(String jobId, String reason) {
        return new JobResult(jobId, SPAWN_FAILED, reason);
    }

    public static JobResult rejected(String jobId, String reason) {
        return new JobResult(jobId, 1, reason);
    }

    public boolean success() {
        return exitCode == SUCCESS;
    }
}
