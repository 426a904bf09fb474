package com.portbuilder.orchestrator.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.portbuilder.orchestrator.model.Outcome;

import java.util.List;

/** Everything known about a finished run, in port creation order. */
public record RunReport(List<PortReport> ports, Interruption interruption, List<List<String>> cycles) {

    public static final int EXIT_SUCCESS  = 0;
    public static final int EXIT_FAILURE  = 1;
    public static final int EXIT_GRACEFUL = 130;
    public static final int EXIT_FORCED   = 254;

    /** Process exit status for this run. */
    @JsonProperty("exitStatus")
    public int exitStatus() {
        return switch (interruption) {
            case FORCED   -> EXIT_FORCED;
            case GRACEFUL -> EXIT_GRACEFUL;
            case NONE     -> ports.stream()
                    .filter(PortReport::explicit)
                    .allMatch(p -> p.outcome() == Outcome.SUCCESS) ? EXIT_SUCCESS : EXIT_FAILURE;
        };
    }

    public long count(Outcome outcome) {
        return ports.stream().filter(p -> p.outcome() == outcome).count();
    }
}
