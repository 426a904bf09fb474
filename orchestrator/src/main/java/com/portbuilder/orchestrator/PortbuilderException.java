package com.portbuilder.orchestrator;

/**
 * Thrown for failures the orchestrator cannot turn into a port outcome:
 * bad configuration, a broken internal invariant, or a report that cannot
 * be written.
 *
 * Unchecked so only the application runner needs to care. Job and port
 * failures are never reported through this type; they become outcomes.
 */
public class PortbuilderException extends RuntimeException {

    public enum Kind { INVALID_CONFIG, ILLEGAL_STATE, REPORT }

    private final Kind kind;

    public PortbuilderException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public PortbuilderException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
