package com.portbuilder.orchestrator.scheduler;

import com.portbuilder.orchestrator.config.BuildPolicy;
import com.portbuilder.orchestrator.event.Event;
import com.portbuilder.orchestrator.event.EventLoop;
import com.portbuilder.orchestrator.event.SignalSource;
import com.portbuilder.orchestrator.graph.DependencyGraph;
import com.portbuilder.orchestrator.model.Port;
import com.portbuilder.orchestrator.model.PortFlag;
import com.portbuilder.orchestrator.queue.QueueManager;
import com.portbuilder.orchestrator.queue.QueueName;
import com.portbuilder.orchestrator.stage.StageMachine;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Entry point for building ports.
 *
 * Callers name the ports they want with {@link #request}, then call
 * {@link #run}, which drives the event loop until no work is left (or the
 * run is interrupted) and returns the report. Interruption is signal
 * driven:
 * <ul>
 *   <li>first SIGINT: stop starting jobs, let running ones finish</li>
 *   <li>second SIGINT, or SIGTERM: kill running jobs and stop at once</li>
 * </ul>
 */
@Service
public class PortScheduler {

    private static final Logger log = LoggerFactory.getLogger(PortScheduler.class);

    private final EventLoop       eventLoop;
    private final QueueManager    queues;
    private final StageMachine    machine;
    private final DependencyGraph graph;
    private final BuildPolicy     policy;
    private final SignalSource    signals;
    private final FailureAnalyzer analyzer;
    private final MeterRegistry   meterRegistry;

    private final List<Consumer<Port>> finishedListeners = new ArrayList<>();

    private Interruption interruption = Interruption.NONE;
    private boolean      signalsInstalled;

    public PortScheduler(EventLoop eventLoop,
                         QueueManager queues,
                         StageMachine machine,
                         DependencyGraph graph,
                         BuildPolicy policy,
                         SignalSource signals,
                         FailureAnalyzer analyzer,
                         MeterRegistry meterRegistry) {
        this.eventLoop     = eventLoop;
        this.queues        = queues;
        this.machine       = machine;
        this.graph         = graph;
        this.policy        = policy;
        this.signals       = signals;
        this.analyzer      = analyzer;
        this.meterRegistry = meterRegistry;
        eventLoop.connect(SignalSource.SIGINT,         e -> onInterrupt());
        eventLoop.connect(SignalSource.SIGTERM,        e -> onTerminate());
        eventLoop.connect(StageMachine.PORT_FINISHED,  this::onPortFinished);
    }

    // ------------------------------------------------------------------
    // Public API
    // ------------------------------------------------------------------

    /** The port for an origin. Looking a port up does not schedule it for building. */
    public Port getPort(String origin) {
        return graph.port(origin);
    }

    /** Schedules the given origins for building, with the run's explicit flags. */
    public List<Port> request(Collection<String> origins) {
        List<Port> requested = new ArrayList<>();
        for (String origin : origins) {
            Port port = graph.port(origin);
            port.addFlag(PortFlag.EXPLICIT);
            if (policy.force()) {
                port.addFlag(PortFlag.FORCE);
            }
            if (policy.upgrade()) {
                port.addFlag(PortFlag.UPGRADE);
            }
            if (policy.packageStage()) {
                port.addFlag(PortFlag.PACKAGE);
            }
            graph.require(port);
            requested.add(port);
        }
        log.info("Requested {} port(s): {}", requested.size(), origins);
        return requested;
    }

    /** Called on the loop thread whenever a port reaches a final state. */
    public void onPortFinished(Consumer<Port> listener) {
        finishedListeners.add(listener);
    }

    /**
     * Runs until every reachable port is finished or the run is interrupted.
     * With resolve-first, only metadata is loaded until the whole graph is
     * known; then building starts.
     */
    public RunReport run() {
        if (!signalsInstalled) {
            signals.install(eventLoop);
            signalsInstalled = true;
        }
        Timer.Sample sample = Timer.start(meterRegistry);

        if (policy.resolveFirst()) {
            queues.pauseAllExcept(Set.of(QueueName.ATTR));
            eventLoop.run();
            if (interruption == Interruption.NONE) {
                logPlan();
                queues.restoreLoads();
            }
        }
        if (interruption != Interruption.FORCED) {
            eventLoop.run();
        }

        RunReport report = analyzer.report(graph.ports(), interruption, graph.cycles());
        sample.stop(meterRegistry.timer("portbuilder.run.duration",
                "interruption", interruption.name()));
        return report;
    }

    public Interruption getInterruption() {
        return interruption;
    }

    // ------------------------------------------------------------------
    // Event handlers
    // ------------------------------------------------------------------

    private void onInterrupt() {
        if (interruption != Interruption.NONE) {
            onTerminate();
            return;
        }
        interruption = Interruption.GRACEFUL;
        log.warn("Interrupted: waiting for {} running job(s) to finish, interrupt again to kill them",
                eventLoop.outstandingJobs());
        machine.stop();
        queues.pauseAll();
    }

    private void onTerminate() {
        if (interruption == Interruption.FORCED) {
            return;
        }
        interruption = Interruption.FORCED;
        log.warn("Terminating: killing {} running job(s)", eventLoop.outstandingJobs());
        machine.stop();
        queues.pauseAll();
        queues.killAll(true);
        eventLoop.exit();
    }

    private void onPortFinished(Event event) {
        Port port = event.payload(Port.class);
        meterRegistry.counter("portbuilder.ports.finished",
                "outcome", analyzer.outcome(port).name()).increment();
        finishedListeners.forEach(listener -> listener.accept(port));
    }

    private void logPlan() {
        List<Port> ports = graph.ports();
        long planned = plannedBuilds(ports);
        long failed  = ports.stream().filter(Port::isFailed).count();
        log.info("Resolved {} port(s): {} to build, {} already failed", ports.size(), planned, failed);
    }

    /** Ports that were given a depend method and have not failed; skipped ports never get one. */
    static long plannedBuilds(List<Port> ports) {
        return ports.stream().filter(p -> p.getMethod() != null && !p.isFailed()).count();
    }
}
