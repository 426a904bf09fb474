package com.portbuilder.orchestrator.model;

/**
 * A run of consecutive stages sharing one pass/fail verdict.
 *
 * The verdict is only used for reporting: once a member stage fails the
 * stack stays failed, and remembers which stage did it first.
 */
public class Stack {

    public static final String COMMON = "common";
    public static final String BUILD  = "build";
    public static final String CLEAN  = "clean";

    private final String name;
    private StageName    failedStage;

    public Stack(String name) {
        this.name = name;
    }

    /** Records the failure unless the stack already failed. */
    public void markFailed(StageName stage) {
        if (failedStage == null) {
            failedStage = stage;
        }
    }

    public String    getName()        { return name; }
    public boolean   isFailed()       { return failedStage != null; }
    public StageName getFailedStage() { return failedStage; }

    @Override
    public String toString() {
        return isFailed() ? name + "(failed at " + failedStage + ")" : name;
    }
}
