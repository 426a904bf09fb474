package com.portbuilder.orchestrator.model;

/**
 * Progress of a port's {@link Dependency} relation.
 *
 * Transitions:
 *   UNRESOLVED → RESOLVING (declared dependencies are being looked up)
 *   RESOLVING  → RESOLVED  (every declared dependency is a port or an unresolved name)
 */
public enum ResolutionStatus {
    UNRESOLVED,
    RESOLVING,
    RESOLVED
}
