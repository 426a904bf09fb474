package com.portbuilder.orchestrator.model;

/**
 * Execution state of a single pipeline Stage.
 *
 * Transitions:
 *   PENDING → QUEUED  (dependencies satisfied, submitted to its queue)
 *   PENDING → SKIPPED (not needed: already installed, other method, port halted)
 *   QUEUED  → RUNNING (admitted, job spawned)
 *   QUEUED  → DONE    (admitted, nothing left to do)
 *   QUEUED  → FAILED  (rejected on admission)
 *   QUEUED  → SKIPPED (withdrawn because the port was halted)
 *   RUNNING → DONE    (job exited 0)
 *   RUNNING → FAILED  (job exited non-zero or could not be spawned)
 */
public enum StageState {
    PENDING,
    QUEUED,
    RUNNING,
    DONE,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == SKIPPED;
    }

    public boolean canTransitionTo(StageState next) {
        return switch (this) {
            case PENDING -> next == QUEUED || next == SKIPPED;
            case QUEUED  -> next == RUNNING || next == DONE || next == FAILED || next == SKIPPED;
            case RUNNING -> next == DONE || next == FAILED;
            case DONE, FAILED, SKIPPED -> false;
        };
    }
}
