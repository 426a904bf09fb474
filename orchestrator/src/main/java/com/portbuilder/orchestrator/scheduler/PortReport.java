package com.portbuilder.orchestrator.scheduler;

import com.portbuilder.orchestrator.model.DependMethod;
import com.portbuilder.orchestrator.model.InstallStatus;
import com.portbuilder.orchestrator.model.Outcome;
import com.portbuilder.orchestrator.model.StageState;

import java.util.List;
import java.util.Map;

/**
 * Final state of one port.
 *
 * @param failedDependencies direct dependencies that failed or could not be found
 * @param rootCauses         ports (or unknown origins) whose own failure caused this one
 * @param failedStacks       names of the stacks that recorded a failed stage
 * @param stages             state of every stage in pipeline order
 */
public record PortReport(
        String                  origin,
        String                  pkgname,
        boolean                 explicit,
        Outcome                 outcome,
        InstallStatus           installStatus,
        DependMethod            method,
        List<String>            failedDependencies,
        List<String>            rootCauses,
        List<String>            failedStacks,
        Map<String, StageState> stages) {}
