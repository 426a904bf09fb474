package com.portbuilder.orchestrator.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Reverse edges: the ports that require this one. */
public class Dependent {

    public record Edge(Port dependant, DependencyType type) {}

    private final List<Edge> edges = new ArrayList<>();
    private DependentStatus  status = DependentStatus.UNSATISFIED;

    public void add(Port dependant, DependencyType type) {
        Edge edge = new Edge(dependant, type);
        if (!edges.contains(edge)) {
            edges.add(edge);
        }
    }

    public List<Edge> edges() {
        return List.copyOf(edges);
    }

    /** Distinct dependants in the order they were added. */
    public Set<Port> ports() {
        Set<Port> ports = new LinkedHashSet<>();
        edges.forEach(e -> ports.add(e.dependant()));
        return ports;
    }

    public DependentStatus getStatus()                       { return status; }
    public void            setStatus(DependentStatus status) { this.status = status; }
}
