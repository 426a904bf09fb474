package com.portbuilder.orchestrator.stage;

import com.portbuilder.orchestrator.attr.BuildVariableCache;
import com.portbuilder.orchestrator.config.BuildPolicy;
import com.portbuilder.orchestrator.event.Event;
import com.portbuilder.orchestrator.event.EventLoop;
import com.portbuilder.orchestrator.model.DependMethod;
import com.portbuilder.orchestrator.model.InstallStatus;
import com.portbuilder.orchestrator.model.Outcome;
import com.portbuilder.orchestrator.model.Port;
import com.portbuilder.orchestrator.model.PortAttributes;
import com.portbuilder.orchestrator.model.PortFlag;
import com.portbuilder.orchestrator.model.PortPipeline;
import com.portbuilder.orchestrator.model.Stage;
import com.portbuilder.orchestrator.model.StageName;
import com.portbuilder.orchestrator.model.StageState;
import com.portbuilder.orchestrator.pkg.PackageDatabase;
import com.portbuilder.orchestrator.queue.JobResult;
import com.portbuilder.orchestrator.queue.JobSpec;
import com.portbuilder.orchestrator.queue.QueueManager;
import com.portbuilder.orchestrator.queue.QueueName;
import com.portbuilder.orchestrator.queue.QueuedJob.Admission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Drives each port through its pipeline of stages.
 *
 * The machine decides which stages need a job, submits those jobs to the
 * matching queue and records their outcome. It knows nothing about other
 * ports: the dependency graph tells it when a port may load, build, be
 * skipped or be halted, and listens for the events it posts:
 * <ul>
 *   <li>{@link #PORT_LOADED}: DEPEND finished, successfully or not</li>
 *   <li>{@link #PORT_RESOLVED}: the resolving stage (normally INSTALL) is DONE</li>
 *   <li>{@link #PORT_STAGE_FAILED}: a stage after DEPEND failed for the first time</li>
 *   <li>{@link #PORT_FINISHED}: every stage is terminal</li>
 * </ul>
 * All methods run on the event loop thread.
 */
@Component
public class StageMachine {

    private static final Logger log = LoggerFactory.getLogger(StageMachine.class);

    public static final String STAGE_COMPLETED   = "stage.completed";
    public static final String PORT_LOADED       = "port.loaded";
    public static final String PORT_RESOLVED     = "port.resolved";
    public static final String PORT_STAGE_FAILED = "port.stage-failed";
    public static final String PORT_FINISHED     = "port.finished";

    private final EventLoop          eventLoop;
    private final QueueManager       queues;
    private final BuildVariableCache variables;
    private final PackageDatabase    packages;
    private final MakeCommands       commands;
    private final DistfileTracker    distfiles;
    private final BuildPolicy        policy;

    /** Jobs submitted but not yet finished, so halted stages can be withdrawn. */
    private final Map<Stage, StageJob> submitted = new HashMap<>();

    private boolean stopped;

    public StageMachine(EventLoop eventLoop,
                        QueueManager queues,
                        BuildVariableCache variables,
                        PackageDatabase packages,
                        MakeCommands commands,
                        DistfileTracker distfiles,
                        BuildPolicy policy) {
        this.eventLoop = eventLoop;
        this.queues    = queues;
        this.variables = variables;
        this.packages  = packages;
        this.commands  = commands;
        this.distfiles = distfiles;
        this.policy    = policy;
        eventLoop.connect(STAGE_COMPLETED, this::onStageCompleted);
    }

    // ------------------------------------------------------------------
    // Commands from the dependency graph
    // ------------------------------------------------------------------

    /** Queues the DEPEND stage, which loads the port's metadata. */
    public void load(Port port) {
        Stage depend = port.getPipeline().stage(StageName.DEPEND);
        if (depend.getState() != StageState.PENDING) {
            throw new IllegalStateException("Port " + port + " is already loading");
        }
        submit(port, depend);
    }

    /** Runs the stages after DEPEND. Called once all dependencies are satisfied. */
    public void startBuild(Port port) {
        PortPipeline pipeline = port.getPipeline();
        log.info("Port '{}': dependencies satisfied, building with method {}", port, port.getMethod());
        advance(port, pipeline.next(pipeline.stage(StageName.DEPEND)));
        finishIfTerminal(port);
    }

    /** Skips every remaining stage; the port needs no work. */
    public void skipBuild(Port port) {
        port.getPipeline().skipRemaining(Set.of(), false).forEach(this::withdraw);
        finishIfTerminal(port);
    }

    /**
     * Stops a port that can no longer succeed. Running jobs are left to
     * finish; CLEAN still runs once they have if a build job was started.
     */
    public void halt(Port port) {
        List<Stage> withdrawn = port.getPipeline().skipRemaining(Set.of(StageName.CLEAN), false);
        withdrawn.forEach(this::withdraw);
        if (!withdrawn.isEmpty()) {
            log.debug("Port '{}': withdrew {} queued stage(s)", port, withdrawn.size());
        }
        cleanUp(port);
        finishIfTerminal(port);
    }

    /** No new stage is submitted after this; used on graceful interruption. */
    public void stop() {
        stopped = true;
    }

    public boolean isStopped() {
        return stopped;
    }

    // ------------------------------------------------------------------
    // Callbacks from StageJob
    // ------------------------------------------------------------------

    Admission admit(StageJob job) {
        Port           port  = job.port();
        Stage          stage = job.stage();
        PortAttributes attrs = port.getAttributes();

        Admission admission = switch (stage.getName()) {
            case DEPEND   -> variables.cached(port.getOrigin()).isPresent()
                    ? Admission.ALREADY_COMPLETE : Admission.START;
            case CHECKSUM -> admitChecksum(attrs);
            case FETCH    -> admitFetch(attrs);
            default       -> Admission.START;
        };

        switch (admission) {
            case START -> {
                stage.transitionTo(StageState.RUNNING);
                log.debug("Port '{}': starting stage {}", port, stage.getName());
            }
            case STALL -> log.debug("Port '{}': stage {} waits for distfiles held by another job",
                    port, stage.getName());
            case REJECT -> log.warn("Port '{}': distfiles previously failed to fetch", port);
            case ALREADY_COMPLETE -> log.debug("Port '{}': stage {} has nothing to do", port, stage.getName());
        }
        return admission;
    }

    JobSpec spec(StageJob job) {
        Port  port  = job.port();
        Stage stage = job.stage();
        if (stage.getName() == StageName.DEPEND) {
            return variables.query(job.id(), port.getOrigin());
        }
        return JobSpec.logged(job.id(), commands.forStage(port, stage.getName()), logFile(port));
    }

    void jobFinished(StageJob job, JobResult result) {
        Port  port  = job.port();
        Stage stage = job.stage();
        submitted.remove(stage);

        List<String> files = port.isLoaded() ? port.getAttributes().distfiles() : List.of();
        boolean success = switch (stage.getName()) {
            case DEPEND -> loadAttributes(port, result);
            case CHECKSUM -> {
                if (stage.ranJob()) {
                    distfiles.releaseChecksum(files);
                    distfiles.checksumFinished(files, result.success());
                }
                // a bad checksum is repaired by FETCH
                yield true;
            }
            case FETCH -> {
                if (stage.ranJob()) {
                    distfiles.releaseFetch(files);
                    distfiles.fetchFinished(files, result.success());
                }
                yield result.success();
            }
            case INSTALL -> recordInstall(port, result);
            default -> result.success();
        };
        eventLoop.post(STAGE_COMPLETED, new StageCompletion(port, stage.getName(), success, result.exitCode()));
    }

    // ------------------------------------------------------------------
    // Stage completion
    // ------------------------------------------------------------------

    private void onStageCompleted(Event event) {
        StageCompletion completion = event.payload(StageCompletion.class);
        Port  port  = completion.port();
        Stage stage = port.getPipeline().stage(completion.stage());

        MDC.put("port",  port.getOrigin());
        MDC.put("stage", stage.getName().name());
        try {
            if (stage.getState().isTerminal()) {
                // withdrawn after its result was already on its way
                log.debug("Port '{}': ignoring late result of stage {}", port, stage.getName());
                return;
            }
            if (completion.success()) {
                completed(port, stage);
            } else {
                failed(port, stage, completion.exitCode());
            }
            finishIfTerminal(port);
        } finally {
            MDC.clear();
        }
    }

    private void completed(Port port, Stage stage) {
        PortPipeline pipeline = port.getPipeline();
        stage.transitionTo(StageState.DONE);

        if (stage.getName() == StageName.DEPEND) {
            eventLoop.post(PORT_LOADED, port);
            return;
        }
        log.info("Port '{}': stage {} done", port, stage.getName());
        if (stage == pipeline.resolvingStage() && !port.isFailed()) {
            eventLoop.post(PORT_RESOLVED, port);
        }
        advance(port, pipeline.next(stage));
    }

    private void failed(Port port, Stage stage, int exitCode) {
        PortPipeline pipeline = port.getPipeline();
        stage.transitionTo(StageState.FAILED);
        pipeline.recordFailure(stage);

        if (stage.getName() == StageName.DEPEND) {
            log.error("Port '{}': cannot load port metadata", port);
            pipeline.skipRemaining(Set.of(), false).forEach(this::withdraw);
            eventLoop.post(PORT_LOADED, port);
            return;
        }
        if (stage.getName() == StageName.CLEAN) {
            log.warn("Port '{}': cleaning failed (exit code {})", port, exitCode);
            return;
        }

        log.error("Port '{}': stage {} failed (exit code {}), see {}",
                port, stage.getName(), exitCode, logFile(port));
        boolean first = port.fail(Outcome.FAILED_DIRECTLY);
        pipeline.skipRemaining(Set.of(StageName.CLEAN), false).forEach(this::withdraw);
        cleanUp(port);
        if (first) {
            eventLoop.post(PORT_STAGE_FAILED, port);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Skips stages with nothing to do and submits the first one that has. */
    private void advance(Port port, Stage stage) {
        PortPipeline pipeline = port.getPipeline();
        Stage current = stage;
        while (current != null) {
            if (port.isFailed()) {
                cleanUp(port);
                return;
            }
            if (stopped) {
                return;
            }
            if (needsJob(port, current)) {
                submit(port, current);
                return;
            }
            current.transitionTo(StageState.SKIPPED);
            log.debug("Port '{}': skipped stage {}", port, current.getName());
            current = pipeline.next(current);
        }
    }

    private boolean needsJob(Port port, Stage stage) {
        boolean fromSource = port.getMethod() == null || port.getMethod() == DependMethod.BUILD;
        return switch (stage.getName()) {
            case CHECKSUM, FETCH, BUILD -> fromSource;
            case PACKAGE -> {
                boolean wanted = fromSource && port.hasFlag(PortFlag.PACKAGE);
                if (wanted && port.getAttributes().noPackage()) {
                    log.info("Port '{}': packaging is restricted, not creating a package", port);
                }
                yield wanted && !port.getAttributes().noPackage();
            }
            case CLEAN -> port.getPipeline().ranBuildJob();
            case DEPEND, INSTALL -> true;
        };
    }

    /**
     * Settles a failed port's CLEAN stage: submitted once no stage is running
     * if a build job was started, skipped otherwise.
     */
    private void cleanUp(Port port) {
        PortPipeline pipeline = port.getPipeline();
        Stage clean = pipeline.stage(StageName.CLEAN);
        if (clean == null || clean.getState() != StageState.PENDING) {
            return;
        }
        boolean running = pipeline.stages().stream().anyMatch(s -> s.getState() == StageState.RUNNING);
        if (running) {
            return;
        }
        if (pipeline.ranBuildJob() && !stopped) {
            submit(port, clean);
        } else {
            clean.transitionTo(StageState.SKIPPED);
        }
    }

    /** Queues a stage, unless the run is stopping, in which case it stays PENDING. */
    private void submit(Port port, Stage stage) {
        if (stopped) {
            log.debug("Port '{}': stopping, not submitting stage {}", port, stage.getName());
            return;
        }
        stage.transitionTo(StageState.QUEUED);
        StageJob job = new StageJob(this, port, stage);
        submitted.put(stage, job);
        queues.submit(queueFor(stage.getName()), job);
    }

    private void withdraw(Stage stage) {
        StageJob job = submitted.remove(stage);
        if (job != null) {
            queues.cancel(job);
        }
    }

    private void finishIfTerminal(Port port) {
        if (port.isFinished() || !port.getPipeline().isTerminal()) {
            return;
        }
        port.markFinished();
        eventLoop.post(PORT_FINISHED, port);
    }

    private Admission admitChecksum(PortAttributes attrs) {
        if (distfiles.checksumComplete(attrs)) {
            return Admission.ALREADY_COMPLETE;
        }
        return distfiles.lockChecksum(attrs.distfiles()) ? Admission.START : Admission.STALL;
    }

    private Admission admitFetch(PortAttributes attrs) {
        if (distfiles.fetchImpossible(attrs)) {
            return Admission.REJECT;
        }
        if (distfiles.fetchComplete(attrs)) {
            return Admission.ALREADY_COMPLETE;
        }
        return distfiles.lockFetch(attrs.distfiles()) ? Admission.START : Admission.STALL;
    }

    private boolean loadAttributes(Port port, JobResult result) {
        Optional<PortAttributes> attrs = variables.cached(port.getOrigin());
        if (attrs.isEmpty()) {
            attrs = variables.parse(port.getOrigin(), result);
        }
        attrs.ifPresent(a -> {
            port.setAttributes(a);
            port.setInstallStatus(packages.status(port.getOrigin(), a.pkgname()));
        });
        return attrs.isPresent();
    }

    private boolean recordInstall(Port port, JobResult result) {
        if (!result.success()) {
            return false;
        }
        packages.recordInstalled(port.getOrigin(), port.getAttributes().pkgname());
        port.setInstallStatus(InstallStatus.CURRENT);
        return true;
    }

    private Path logFile(Port port) {
        return policy.logDir().resolve(port.logName() + ".log");
    }

    static QueueName queueFor(StageName stage) {
        return switch (stage) {
            case DEPEND   -> QueueName.ATTR;
            case CHECKSUM -> QueueName.CHECKSUM;
            case FETCH    -> QueueName.FETCH;
            case BUILD    -> QueueName.BUILD;
            case INSTALL  -> QueueName.INSTALL;
            case PACKAGE  -> QueueName.PACKAGE;
            case CLEAN    -> QueueName.CLEAN;
        };
    }
}
