package com.portbuilder.orchestrator.graph;

import com.portbuilder.orchestrator.config.BuildPolicy;
import com.portbuilder.orchestrator.event.Event;
import com.portbuilder.orchestrator.event.EventLoop;
import com.portbuilder.orchestrator.model.DependMethod;
import com.portbuilder.orchestrator.model.Dependency;
import com.portbuilder.orchestrator.model.DependencyEntry.ResolvedPort;
import com.portbuilder.orchestrator.model.DependencyEntry.UnresolvedName;
import com.portbuilder.orchestrator.model.DependencyType;
import com.portbuilder.orchestrator.model.DependentStatus;
import com.portbuilder.orchestrator.model.InstallStatus;
import com.portbuilder.orchestrator.model.Outcome;
import com.portbuilder.orchestrator.model.Port;
import com.portbuilder.orchestrator.model.PortAttributes.Declaration;
import com.portbuilder.orchestrator.model.PortFlag;
import com.portbuilder.orchestrator.model.PortPipeline;
import com.portbuilder.orchestrator.model.ResolutionStatus;
import com.portbuilder.orchestrator.model.StageState;
import com.portbuilder.orchestrator.stage.StageMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Connects ports to the ports they depend on and decides when each may build.
 *
 * Lifecycle of a required port:
 * <pre>
 *   loaded ──► decide ──► skip (already installed)        ─► SATISFIED
 *                    ├──► no method / unknown origin      ─► FAILED
 *                    └──► resolve dependencies ─► all SATISFIED ─► build
 *                                                  any FAILED    ─► FAILED
 * </pre>
 * A port's dependent status turns SATISFIED once its resolving stage is
 * DONE, which lets waiting dependants build. Failures travel the other way,
 * along the dependant edges, and reach every affected port exactly once.
 * All methods run on the event loop thread.
 */
@Component
public class DependencyGraph {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraph.class);

    public static final String PORT_FAILED = "port.failed";

    /** Flags a dependency picks up from the port that requires it. */
    private static final Set<PortFlag> INHERITED_FLAGS = Set.of(PortFlag.UPGRADE, PortFlag.PACKAGE);

    private final EventLoop            eventLoop;
    private final StageMachine         machine;
    private final DependMethodSelector selector;
    private final BuildPolicy          policy;

    private final PortRegistry registry = new PortRegistry();

    /** Edges waiting for their target to finish loading. */
    private final Map<Port, List<PendingEdge>> pendingEdges = new HashMap<>();
    private final Set<Port>                    decided      = new HashSet<>();
    private final List<List<String>>           cycles       = new ArrayList<>();

    private record PendingEdge(Port dependant, DependencyType type) {}

    public DependencyGraph(EventLoop eventLoop,
                           StageMachine machine,
                           DependMethodSelector selector,
                           BuildPolicy policy) {
        this.eventLoop = eventLoop;
        this.machine   = machine;
        this.selector  = selector;
        this.policy    = policy;
        eventLoop.connect(StageMachine.PORT_LOADED,       this::onPortLoaded);
        eventLoop.connect(StageMachine.PORT_RESOLVED,     this::onPortResolved);
        eventLoop.connect(StageMachine.PORT_STAGE_FAILED, this::onPortStageFailed);
    }

    // ------------------------------------------------------------------
    // Ports
    // ------------------------------------------------------------------

    /** The port for an origin, created and loading if it was not seen before. */
    public Port port(String origin) {
        Optional<Port> existing = registry.find(origin);
        if (existing.isPresent()) {
            return existing.get();
        }
        Port port = registry.create(origin, new PortPipeline(policy.pipelineStages()));
        log.debug("New port '{}' (#{})", origin, port.getId());
        machine.load(port);
        return port;
    }

    /** Marks the port as needed; it is built, skipped or failed once loaded. */
    public void require(Port port) {
        if (port.isRequired()) {
            return;
        }
        port.markRequired();
        if (port.isLoadSettled()) {
            decide(port);
        }
    }

    public Optional<Port> find(String origin) {
        return registry.find(origin);
    }

    public List<Port> ports() {
        return registry.all();
    }

    /** Every dependency cycle found so far, as origins in dependency order. */
    public List<List<String>> cycles() {
        return List.copyOf(cycles);
    }

    // ------------------------------------------------------------------
    // Event handlers
    // ------------------------------------------------------------------

    private void onPortLoaded(Event event) {
        Port port = event.payload(Port.class);
        if (port.isRequired()) {
            decide(port);
        }
        List<PendingEdge> waiting = pendingEdges.remove(port);
        if (waiting != null) {
            for (PendingEdge edge : waiting) {
                attach(edge.dependant(), port, edge.type());
            }
        }
    }

    private void onPortResolved(Event event) {
        Port port = event.payload(Port.class);
        port.getDependent().setStatus(DependentStatus.SATISFIED);
        log.info("Port '{}' is ready for its dependants", port);
        notifyDependants(port);
    }

    private void onPortStageFailed(Event event) {
        Port port = event.payload(Port.class);
        if (port.getPipeline().resolvingStage().getState() == StageState.DONE) {
            log.warn("Port '{}' failed after it was installed, dependants are not affected", port);
            return;
        }
        Deque<Port> work = new ArrayDeque<>();
        work.add(port);
        propagate(work);
    }

    // ------------------------------------------------------------------
    // Decisions
    // ------------------------------------------------------------------

    private void decide(Port port) {
        if (port.isFailed() || !decided.add(port)) {
            return;
        }
        if (!port.isLoaded()) {
            log.error("Port '{}' does not exist or cannot be loaded", port);
            fail(List.of(port), Outcome.UNRESOLVED_NAME);
            return;
        }
        if (!port.hasFlag(PortFlag.FORCE) && port.getInstallStatus().isAbove(threshold(port))) {
            log.info("Port '{}' is installed ({}), skipping", port, port.getInstallStatus());
            port.getDependent().setStatus(DependentStatus.SATISFIED);
            machine.skipBuild(port);
            notifyDependants(port);
            return;
        }

        Optional<DependMethod> method = port.hasFlag(PortFlag.EXPLICIT)
                ? Optional.of(DependMethod.BUILD)
                : selector.select(port);
        if (method.isEmpty()) {
            log.error("Port '{}': none of the methods {} can install it", port, policy.methods());
            fail(List.of(port), Outcome.FAILED_NO_METHOD);
            return;
        }
        port.setMethod(method.get());
        resolve(port);
    }

    private void resolve(Port port) {
        Dependency relation = port.getDependency();
        if (relation.getStatus() != ResolutionStatus.UNRESOLVED) {
            return;
        }
        List<Declaration> declared =
                port.getAttributes().declared(port.getPipeline().requiredDependencyTypes());
        relation.startResolving(declared.size());
        log.debug("Port '{}': resolving {} declared dependencies", port, declared.size());

        for (Declaration declaration : declared) {
            Port target = port(declaration.origin());
            for (PortFlag flag : INHERITED_FLAGS) {
                if (port.hasFlag(flag)) {
                    target.addFlag(flag);
                }
            }
            require(target);
            if (target.isLoadSettled()) {
                attach(port, target, declaration.type());
            } else {
                pendingEdges.computeIfAbsent(target, t -> new ArrayList<>())
                        .add(new PendingEdge(port, declaration.type()));
            }
        }
        evaluate(port);
    }

    /** Records that {@code from} depends on {@code to}, whose load has settled. */
    private void attach(Port from, Port to, DependencyType type) {
        Dependency relation = from.getDependency();
        if (!to.isLoaded()) {
            relation.add(type, new UnresolvedName(to.getOrigin()));
        } else {
            relation.add(type, new ResolvedPort(to));
            to.getDependent().add(from, type);
            List<Port> cycle = findPath(to, from);
            if (cycle != null) {
                failCycle(cycle);
            }
        }

        if (relation.failed() && !from.isFailed()) {
            log.warn("Port '{}' failed: dependency '{}' failed", from, to);
            fail(List.of(from), Outcome.FAILED_BY_DEPENDENCY);
        } else {
            evaluate(from);
        }
    }

    /** A port installed strictly above this level needs no build. */
    private InstallStatus threshold(Port port) {
        return port.hasFlag(PortFlag.UPGRADE) ? InstallStatus.OLDER : policy.threshold();
    }

    /** Starts the build once every dependency is resolved and satisfied. */
    private void evaluate(Port port) {
        if (port.isFailed() || port.isBuildStarted()
                || port.getDependency().getStatus() != ResolutionStatus.RESOLVED) {
            return;
        }
        for (Port dependency : port.getDependency().ports()) {
            if (dependency.getDependent().getStatus() != DependentStatus.SATISFIED) {
                return;
            }
        }
        port.markBuildStarted();
        machine.startBuild(port);
    }

    private void notifyDependants(Port port) {
        for (Port dependant : port.getDependent().ports()) {
            evaluate(dependant);
        }
    }

    // ------------------------------------------------------------------
    // Failure
    // ------------------------------------------------------------------

    private void fail(List<Port> ports, Outcome cause) {
        Deque<Port> work = new ArrayDeque<>();
        for (Port port : ports) {
            if (port.fail(cause)) {
                work.add(port);
            }
        }
        propagate(work);
    }

    /** Fails every port reachable through dependant edges, each exactly once. */
    private void propagate(Deque<Port> work) {
        while (!work.isEmpty()) {
            Port port = work.poll();
            port.getDependent().setStatus(DependentStatus.FAILED);
            if (!port.getPipeline().hasFailedStage()) {
                machine.halt(port);
            }
            eventLoop.post(PORT_FAILED, port);

            for (Port dependant : port.getDependent().ports()) {
                if (dependant.fail(Outcome.FAILED_BY_DEPENDENCY)) {
                    log.warn("Port '{}' failed: dependency '{}' failed", dependant, port);
                    work.add(dependant);
                }
            }
        }
    }

    private void failCycle(List<Port> cycle) {
        List<String> origins = cycle.stream().map(Port::getOrigin).toList();
        cycles.add(origins);
        log.error("Dependency cycle: {} -> {}", String.join(" -> ", origins), origins.get(0));
        fail(cycle, Outcome.FAILED_CYCLE);
    }

    /**
     * Depth-first search along dependency edges.
     *
     * @return the ports from {@code start} to {@code target} inclusive, or null
     */
    private static List<Port> findPath(Port start, Port target) {
        Map<Port, Port> parent = new HashMap<>();
        Deque<Port>     stack  = new ArrayDeque<>();
        Set<Port>       seen   = new HashSet<>();
        stack.push(start);
        seen.add(start);

        while (!stack.isEmpty()) {
            Port current = stack.pop();
            if (current == target) {
                List<Port> path = new ArrayList<>();
                for (Port p = current; p != null; p = parent.get(p)) {
                    path.add(0, p);
                }
                return path;
            }
            for (Port next : current.getDependency().ports()) {
                if (seen.add(next)) {
                    parent.put(next, current);
                    stack.push(next);
                }
            }
        }
        return null;
    }
}
