package com.portbuilder.orchestrator.scheduler;

/**
 * How the run was cut short, if at all.
 *
 * NONE     → ran until no work was left
 * GRACEFUL → first SIGINT: running jobs finished, nothing new started
 * FORCED   → second SIGINT or SIGTERM: running jobs killed
 */
public enum Interruption {
    NONE,
    GRACEFUL,
    FORCED
}
