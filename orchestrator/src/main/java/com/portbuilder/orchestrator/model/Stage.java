package com.portbuilder.orchestrator.model;

/** One pipeline step of one port. */
public class Stage {

    private final StageName name;
    private final Stage     prev;
    private final Stack     stack;

    private StageState state = StageState.PENDING;
    private boolean    ranJob;

    public Stage(StageName name, Stage prev, Stack stack) {
        this.name  = name;
        this.prev  = prev;
        this.stack = stack;
    }

    /**
     * @throws IllegalStateException if the transition is not allowed (see {@link StageState})
     */
    public void transitionTo(StageState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Stage " + name + ": illegal transition " + state + " -> " + next);
        }
        if (next == StageState.RUNNING) {
            ranJob = true;
        }
        state = next;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public StageName  getName()   { return name; }
    public Stage      getPrev()   { return prev; }
    public Stack      getStack()  { return stack; }
    public StageState getState()  { return state; }
    public boolean    ranJob()    { return ranJob; }

    @Override
    public String toString() {
        return name + "[" + state + "]";
    }
}
