package com.portbuilder.orchestrator.graph;

import com.portbuilder.orchestrator.model.Port;
import com.portbuilder.orchestrator.model.PortPipeline;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Owns every port of the run, one per origin, numbered in creation order. */
public class PortRegistry {

    private final Map<String, Port> byOrigin = new LinkedHashMap<>();

    public Port create(String origin, PortPipeline pipeline) {
        if (byOrigin.containsKey(origin)) {
            throw new IllegalStateException("Port " + origin + " already exists");
        }
        Port port = new Port(byOrigin.size(), origin, pipeline);
        byOrigin.put(origin, port);
        return port;
    }

    public Optional<Port> find(String origin) {
        return Optional.ofNullable(byOrigin.get(origin));
    }

    public List<Port> all() {
        return List.copyOf(byOrigin.values());
    }

    public int size() {
        return byOrigin.size();
    }
}
