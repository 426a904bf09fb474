package com.portbuilder.orchestrator.stage;

import com.portbuilder.orchestrator.model.Port;
import com.portbuilder.orchestrator.model.Stage;
import com.portbuilder.orchestrator.queue.JobResult;
import com.portbuilder.orchestrator.queue.JobSpec;
import com.portbuilder.orchestrator.queue.QueuedJob;

/** One stage of one port waiting in, or running from, a queue. */
final class StageJob implements QueuedJob {

    private final StageMachine machine;
    private final Port         port;
    private final Stage        stage;

    StageJob(StageMachine machine, Port port, Stage stage) {
        this.machine = machine;
        this.port    = port;
        this.stage   = stage;
    }

    Port  port()  { return port; }
    Stage stage() { return stage; }

    @Override
    public String id() {
        return port.getOrigin() + "@" + stage.getName();
    }

    @Override
    public Admission admit() {
        return machine.admit(this);
    }

    @Override
    public JobSpec spec() {
        return machine.spec(this);
    }

    @Override
    public void finished(JobResult result) {
        machine.jobFinished(this, result);
    }

    @Override
    public String toString() {
        return id();
    }
}
