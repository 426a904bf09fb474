package com.portbuilder.orchestrator.scheduler;

import com.portbuilder.orchestrator.model.DependencyEntry;
import com.portbuilder.orchestrator.model.DependencyEntry.ResolvedPort;
import com.portbuilder.orchestrator.model.DependentStatus;
import com.portbuilder.orchestrator.model.Outcome;
import com.portbuilder.orchestrator.model.Port;
import com.portbuilder.orchestrator.model.PortFlag;
import com.portbuilder.orchestrator.model.Stack;
import com.portbuilder.orchestrator.model.Stage;
import com.portbuilder.orchestrator.model.StageState;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Turns the final port graph into per-port outcomes and failure explanations. */
@Component
public class FailureAnalyzer {

    public Outcome outcome(Port port) {
        if (port.isFailed()) {
            return port.getFailure();
        }
        return port.getPipeline().isTerminal() ? Outcome.SUCCESS : Outcome.INCOMPLETE;
    }

    /** Direct dependencies that failed, plus origins that could not be loaded. */
    public List<String> failedDependencies(Port port) {
        List<String> failed = new ArrayList<>();
        for (DependencyEntry entry : port.getDependency().entries()) {
            boolean bad = !(entry instanceof ResolvedPort resolved)
                    || resolved.port().getDependent().getStatus() == DependentStatus.FAILED;
            if (bad && !failed.contains(entry.origin())) {
                failed.add(entry.origin());
            }
        }
        return failed;
    }

    /**
     * Follows failed dependencies down to the ports that failed on their own:
     * a failed stage, a missing method, a cycle or an unknown origin.
     */
    public List<String> rootCauses(Port port) {
        if (!port.isFailed()) {
            return List.of();
        }
        List<String> roots = new ArrayList<>();
        Set<Port>    seen  = new HashSet<>();
        Deque<Port>  work  = new ArrayDeque<>();
        work.add(port);
        seen.add(port);

        while (!work.isEmpty()) {
            Port current = work.poll();
            if (current.getFailure() != Outcome.FAILED_BY_DEPENDENCY) {
                addOnce(roots, current.getOrigin());
                continue;
            }
            for (DependencyEntry entry : current.getDependency().entries()) {
                if (entry instanceof ResolvedPort resolved) {
                    Port dependency = resolved.port();
                    if (dependency.isFailed() && seen.add(dependency)) {
                        work.add(dependency);
                    }
                } else {
                    addOnce(roots, entry.origin());
                }
            }
        }
        return roots;
    }

    public PortReport report(Port port) {
        Map<String, StageState> stages = new LinkedHashMap<>();
        for (Stage stage : port.getPipeline().stages()) {
            stages.put(stage.getName().name(), stage.getState());
        }
        return new PortReport(
                port.getOrigin(),
                port.isLoaded() ? port.getAttributes().pkgname() : null,
                port.hasFlag(PortFlag.EXPLICIT),
                outcome(port),
                port.getInstallStatus(),
                port.getMethod(),
                failedDependencies(port),
                rootCauses(port),
                port.getPipeline().failedStacks().stream().map(Stack::getName).toList(),
                stages);
    }

    public RunReport report(List<Port> ports, Interruption interruption, List<List<String>> cycles) {
        return new RunReport(ports.stream().map(this::report).toList(), interruption, cycles);
    }

    private static void addOnce(List<String> list, String value) {
        if (!list.contains(value)) {
            list.add(value);
        }
    }
}
