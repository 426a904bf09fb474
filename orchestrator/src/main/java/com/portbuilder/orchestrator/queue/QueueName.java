package com.portbuilder.orchestrator.queue;

/** The admission channels, one per class of stage work. */
public enum QueueName {
    ATTR,       // metadata queries (DEPEND stage)
    CHECKSUM,
    FETCH,
    BUILD,
    INSTALL,
    PACKAGE,
    CLEAN;

    /** Lower-case key used in configuration ({@code portbuilder.loads.<key>}). */
    public String key() {
        return name().toLowerCase();
    }
}
