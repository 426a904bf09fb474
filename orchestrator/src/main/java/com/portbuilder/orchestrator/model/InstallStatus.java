package com.portbuilder.orchestrator.model;

/**
 * How the installed package (if any) compares to the port's current version.
 * Declaration order matters: later constants are "more installed".
 */
public enum InstallStatus {
    ABSENT,     // no package from this origin installed
    OLDER,      // installed version is older than the port
    CURRENT,    // installed version matches the port
    NEWER;      // installed version is newer than the port

    /** Maps a comparison result (installed vs. port, like {@code compareTo}) to a status. */
    public static InstallStatus relative(int comparison) {
        if (comparison < 0) return OLDER;
        if (comparison > 0) return NEWER;
        return CURRENT;
    }

    public boolean isAbove(InstallStatus other) {
        return compareTo(other) > 0;
    }
}
