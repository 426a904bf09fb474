package com.portbuilder.orchestrator.model;

/** Whether a port satisfies the ports that depend on it. */
public enum DependentStatus {
    FAILED,         // the port or one of its dependencies failed; dependants cannot proceed
    UNSATISFIED,    // not installed at the required level yet
    SATISFIED       // installed, or built and installed during this run
}
