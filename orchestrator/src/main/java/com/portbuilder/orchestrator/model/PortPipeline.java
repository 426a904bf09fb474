package com.portbuilder.orchestrator.model;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The ordered stages selected for one port in this run, with their stacks.
 *
 * The pipeline only holds state; {@code StageMachine} decides when stages
 * move. Stages appear in {@link StageName} order and the first one is
 * always DEPEND.
 */
public class PortPipeline {

    private final Map<StageName, Stage> stages = new EnumMap<>(StageName.class);
    private final Map<String, Stack>    stacks = new LinkedHashMap<>();

    public PortPipeline(List<StageName> names) {
        if (names.isEmpty() || names.get(0) != StageName.DEPEND) {
            throw new IllegalArgumentException("Pipeline must start with DEPEND: " + names);
        }
        Stage prev = null;
        for (StageName name : names) {
            if (prev != null && name.compareTo(prev.getName()) <= 0) {
                throw new IllegalArgumentException("Pipeline stages out of order: " + names);
            }
            Stack stack = stacks.computeIfAbsent(name.stack(), Stack::new);
            Stage stage = new Stage(name, prev, stack);
            stages.put(name, stage);
            prev = stage;
        }
    }

    // ------------------------------------------------------------------
    // Navigation
    // ------------------------------------------------------------------

    public boolean contains(StageName name) {
        return stages.containsKey(name);
    }

    /** @return the stage, or null if it is not part of this pipeline */
    public Stage stage(StageName name) {
        return stages.get(name);
    }

    public List<Stage> stages() {
        return List.copyOf(stages.values());
    }

    /** @return the stage after {@code stage}, or null if it is the last one */
    public Stage next(Stage stage) {
        boolean found = false;
        for (Stage candidate : stages.values()) {
            if (found) {
                return candidate;
            }
            found = candidate == stage;
        }
        return null;
    }

    /**
     * The stage whose success makes the port usable by its dependants:
     * INSTALL when the pipeline installs, otherwise the last stage before CLEAN.
     */
    public Stage resolvingStage() {
        if (stages.containsKey(StageName.INSTALL)) {
            return stages.get(StageName.INSTALL);
        }
        Stage last = null;
        for (Stage stage : stages.values()) {
            if (stage.getName() != StageName.CLEAN) {
                last = stage;
            }
        }
        return last;
    }

    /** Dependency types some stage of this pipeline has to wait for. */
    public Set<DependencyType> requiredDependencyTypes() {
        Set<DependencyType> types = EnumSet.noneOf(DependencyType.class);
        for (StageName name : stages.keySet()) {
            types.addAll(name.dependencyTypes());
        }
        return types;
    }

    // ------------------------------------------------------------------
    // Verdicts
    // ------------------------------------------------------------------

    /** Marks the stage's stack failed; a failure in the common stack fails every stack. */
    public void recordFailure(Stage stage) {
        if (Stack.COMMON.equals(stage.getStack().getName())) {
            stacks.values().forEach(s -> s.markFailed(stage.getName()));
        } else {
            stage.getStack().markFailed(stage.getName());
        }
    }

    public List<Stack> failedStacks() {
        return stacks.values().stream().filter(Stack::isFailed).toList();
    }

    public Stack stack(String name) {
        return stacks.get(name);
    }

    public boolean isTerminal() {
        return stages.values().stream().allMatch(s -> s.getState().isTerminal());
    }

    public boolean hasFailedStage() {
        return stages.values().stream().anyMatch(s -> s.getState() == StageState.FAILED);
    }

    /** True if any build-stack stage actually spawned a job. */
    public boolean ranBuildJob() {
        return stages.values().stream()
                .anyMatch(s -> Stack.BUILD.equals(s.getStack().getName()) && s.ranJob());
    }

    /**
     * Skips every PENDING stage, plus QUEUED ones unless {@code keepQueued}.
     *
     * @return the QUEUED stages that were skipped; their jobs must be withdrawn
     */
    public List<Stage> skipRemaining(Set<StageName> except, boolean keepQueued) {
        List<Stage> withdrawn = new ArrayList<>();
        for (Stage stage : stages.values()) {
            if (except.contains(stage.getName())) {
                continue;
            }
            if (stage.getState() == StageState.PENDING) {
                stage.transitionTo(StageState.SKIPPED);
            } else if (stage.getState() == StageState.QUEUED && !keepQueued) {
                stage.transitionTo(StageState.SKIPPED);
                withdrawn.add(stage);
            }
        }
        return withdrawn;
    }
}
