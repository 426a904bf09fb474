package com.portbuilder.orchestrator.model;

/** Terminal classification of a port, as reported at the end of a run. */
public enum Outcome {
    SUCCESS,
    FAILED_DIRECTLY,        // one of its own stages failed
    FAILED_BY_DEPENDENCY,   // a dependency failed or could not be resolved
    FAILED_NO_METHOD,       // no depend method could provide it
    UNRESOLVED_NAME,        // no such port in the tree
    FAILED_CYCLE,           // part of a dependency cycle
    INCOMPLETE;             // the run stopped before the port finished

    public boolean isFailure() {
        return this != SUCCESS && this != INCOMPLETE;
    }
}
