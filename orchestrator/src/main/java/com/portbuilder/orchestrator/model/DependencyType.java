package com.portbuilder.orchestrator.model;

/** The kind of a declared dependency, after the port's *_DEPENDS variable. */
public enum DependencyType {
    BUILD,
    EXTRACT,
    FETCH,
    LIB,
    RUN,
    PATCH,
    PKG
}
