package com.portbuilder.orchestrator.config;

import com.portbuilder.orchestrator.PortbuilderException;
import com.portbuilder.orchestrator.model.DependMethod;
import com.portbuilder.orchestrator.model.InstallStatus;
import com.portbuilder.orchestrator.model.StageName;
import com.portbuilder.orchestrator.queue.QueueName;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * Run-wide policy, built once at startup and passed to every component
 * that needs it.
 *
 * @param portsDir     root of the ports tree (inside the chroot, if any)
 * @param chroot       chroot directory for every command, or "" for none
 * @param logDir       directory for per-port logs and the run report
 * @param methods      depend methods tried in order for dependencies
 * @param fetchOnly    stop after fetching distfiles
 * @param noOp         print state-changing commands instead of running them
 * @param force        rebuild requested ports even when installed
 * @param upgrade      rebuild ports whose installed version is older
 * @param packageStage create packages after installing
 * @param clean        clean work directories after building
 * @param resolveFirst resolve all metadata before the first build job starts
 * @param debug        verbose logging
 * @param loads        concurrency limit per queue, at least 1 (queues are only paused at runtime)
 */
public record BuildPolicy(
        Path                    portsDir,
        String                  chroot,
        Path                    logDir,
        List<DependMethod>      methods,
        boolean                 fetchOnly,
        boolean                 noOp,
        boolean                 force,
        boolean                 upgrade,
        boolean                 packageStage,
        boolean                 clean,
        boolean                 resolveFirst,
        boolean                 debug,
        Map<QueueName, Integer> loads) {

    public static final int CPUS = Runtime.getRuntime().availableProcessors();

    public BuildPolicy {
        if (methods.isEmpty()) {
            throw invalid("at least one depend method is required");
        }
        if (new HashSet<>(methods).size() != methods.size()) {
            throw invalid("depend methods may only be listed once: " + methods);
        }
        methods = List.copyOf(methods);
        chroot  = chroot == null ? "" : chroot;

        Map<QueueName, Integer> resolved = new EnumMap<>(QueueName.class);
        for (QueueName name : QueueName.values()) {
            Integer load = loads.get(name);
            if (load != null && load < 1) {
                throw invalid("load of queue '" + name.key() + "' must be >= 1, got " + load);
            }
            resolved.put(name, load != null ? load : defaultLoad(name));
        }
        loads = Map.copyOf(resolved);
    }

    // ------------------------------------------------------------------
    // Derived values
    // ------------------------------------------------------------------

    /** Default concurrency: metadata queries and builds scale with the CPUs, the rest is serial. */
    public static int defaultLoad(QueueName name) {
        return switch (name) {
            case ATTR, BUILD -> 2 * CPUS;
            default -> 1;
        };
    }

    public int load(QueueName name) {
        return loads.get(name);
    }

    /**
     * A port installed strictly above this level satisfies its dependants.
     * Upgrading requires at least CURRENT; otherwise any installed version will do.
     */
    public InstallStatus threshold() {
        return upgrade ? InstallStatus.OLDER : InstallStatus.ABSENT;
    }

    /** Stages every port goes through in this run. */
    public List<StageName> pipelineStages() {
        if (fetchOnly) {
            return List.of(StageName.DEPEND, StageName.CHECKSUM, StageName.FETCH);
        }
        List<StageName> stages = new ArrayList<>(List.of(
                StageName.DEPEND, StageName.CHECKSUM, StageName.FETCH, StageName.BUILD, StageName.INSTALL));
        if (packageStage) {
            stages.add(StageName.PACKAGE);
        }
        if (clean) {
            stages.add(StageName.CLEAN);
        }
        return List.copyOf(stages);
    }

    /** Where a path inside the build root lives on the host. */
    public Path hostPath(String path) {
        return chroot.isEmpty() ? Path.of(path) : Path.of(chroot, path);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static PortbuilderException invalid(String message) {
        return new PortbuilderException(PortbuilderException.Kind.INVALID_CONFIG, message);
    }

    // ------------------------------------------------------------------
    // Builder
    // ------------------------------------------------------------------

    public static final class Builder {

        private Path               portsDir     = Path.of("/usr/ports");
        private String             chroot       = "";
        private Path               logDir       = Path.of("/tmp/portbuilder");
        private List<DependMethod> methods      = List.of(DependMethod.BUILD);
        private boolean            fetchOnly;
        private boolean            noOp;
        private boolean            force;
        private boolean            upgrade;
        private boolean            packageStage;
        private boolean            clean        = true;
        private boolean            resolveFirst;
        private boolean            debug;
        private final Map<QueueName, Integer> loads = new EnumMap<>(QueueName.class);

        private Builder() {}

        public Builder portsDir(Path portsDir)             { this.portsDir = portsDir; return this; }
        public Builder chroot(String chroot)               { this.chroot = chroot; return this; }
        public Builder logDir(Path logDir)                 { this.logDir = logDir; return this; }
        public Builder methods(List<DependMethod> methods) { this.methods = methods; return this; }
        public Builder fetchOnly(boolean fetchOnly)        { this.fetchOnly = fetchOnly; return this; }
        public Builder noOp(boolean noOp)                  { this.noOp = noOp; return this; }
        public Builder force(boolean force)                { this.force = force; return this; }
        public Builder upgrade(boolean upgrade)            { this.upgrade = upgrade; return this; }
        public Builder packageStage(boolean packageStage)  { this.packageStage = packageStage; return this; }
        public Builder clean(boolean clean)                { this.clean = clean; return this; }
        public Builder resolveFirst(boolean resolveFirst)  { this.resolveFirst = resolveFirst; return this; }
        public Builder debug(boolean debug)                { this.debug = debug; return this; }
        public Builder load(QueueName name, int load)      { this.loads.put(name, load); return this; }

        public BuildPolicy build() {
            return new BuildPolicy(portsDir, chroot, logDir, methods, fetchOnly, noOp, force, upgrade,
                    packageStage, clean, resolveFirst, debug, loads);
        }
    }
}
