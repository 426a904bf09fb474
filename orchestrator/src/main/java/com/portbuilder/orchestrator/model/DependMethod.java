package com.portbuilder.orchestrator.model;

import java.util.Locale;

/** Ways a dependency can be brought up to date. */
public enum DependMethod {
    BUILD,      // build and install from the ports tree
    PACKAGE,    // install a package file that is already on disk
    REPO;       // install from the configured package repository

    public static DependMethod fromConfig(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown depend method '" + value + "' (expected build, package or repo)", e);
        }
    }
}
