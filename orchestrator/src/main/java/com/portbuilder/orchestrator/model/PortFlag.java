package com.portbuilder.orchestrator.model;

/** Per-port policy flags. */
public enum PortFlag {
    EXPLICIT,   // requested by the user, not pulled in as a dependency
    UPGRADE,    // rebuild when an older version is installed
    PACKAGE,    // create a package after installing
    FORCE       // rebuild regardless of the installed version
}
