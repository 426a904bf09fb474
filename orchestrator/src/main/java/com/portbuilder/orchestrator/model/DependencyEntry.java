package com.portbuilder.orchestrator.model;

/**
 * One declared dependency of a port: either a known port or the origin of a
 * port that could not be found.
 */
public sealed interface DependencyEntry {

    String origin();

    record ResolvedPort(Port port) implements DependencyEntry {
        @Override
        public String origin() {
            return port.getOrigin();
        }
    }

    record UnresolvedName(String origin) implements DependencyEntry {}
}
