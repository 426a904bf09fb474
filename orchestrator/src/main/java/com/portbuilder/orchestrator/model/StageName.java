package com.portbuilder.orchestrator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * The fixed, ordered set of pipeline stages.
 *
 * Each stage belongs to a stack (stages sharing one pass/fail verdict) and
 * waits for the dependency types its work needs.
 */
public enum StageName {
    DEPEND  (Stack.COMMON),
    CHECKSUM(Stack.BUILD),
    FETCH   (Stack.BUILD, DependencyType.FETCH),
    BUILD   (Stack.BUILD, DependencyType.EXTRACT, DependencyType.PATCH, DependencyType.LIB,
                          DependencyType.BUILD, DependencyType.PKG),
    INSTALL (Stack.BUILD, DependencyType.LIB, DependencyType.RUN, DependencyType.PKG),
    PACKAGE (Stack.BUILD, DependencyType.LIB, DependencyType.RUN, DependencyType.PKG),
    CLEAN   (Stack.CLEAN);

    private final String              stack;
    private final Set<DependencyType> dependencyTypes;

    StageName(String stack, DependencyType... dependencyTypes) {
        this.stack           = stack;
        this.dependencyTypes = dependencyTypes.length == 0
                ? Set.of()
                : Set.copyOf(EnumSet.of(dependencyTypes[0], dependencyTypes));
    }

    public String stack() {
        return stack;
    }

    public Set<DependencyType> dependencyTypes() {
        return dependencyTypes;
    }
}
