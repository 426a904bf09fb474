package com.portbuilder.orchestrator.queue;

/**
 * Thrown when an external job cannot be spawned (missing executable,
 * permission denied, unwritable log file).
 */
public class JobException extends RuntimeException {

    public JobException(String message) {
        super(message);
    }

    public JobException(String message, Throwable cause) {
        super(message, cause);
    }
}
