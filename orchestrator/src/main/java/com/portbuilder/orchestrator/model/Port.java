package com.portbuilder.orchestrator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * One buildable unit of the ports tree, identified by its origin
 * ({@code category/name}).
 *
 * Exactly one instance exists per origin; {@code PortRegistry} hands them
 * out. Ports are mutated only on the event loop thread.
 */
public class Port {

    private final int          id;
    private final String       origin;
    private final PortPipeline pipeline;
    private final Dependency   dependency = new Dependency();
    private final Dependent    dependent  = new Dependent();
    private final Set<PortFlag> flags     = EnumSet.noneOf(PortFlag.class);

    private PortAttributes attributes;
    private InstallStatus  installStatus = InstallStatus.ABSENT;
    private DependMethod   method;
    private Outcome        failure;

    // Scheduling bookkeeping
    private boolean required;
    private boolean buildStarted;
    private boolean finished;

    public Port(int id, String origin, PortPipeline pipeline) {
        this.id       = id;
        this.origin   = origin;
        this.pipeline = pipeline;
    }

    // ------------------------------------------------------------------
    // Failure
    // ------------------------------------------------------------------

    /**
     * Marks the port failed. The first cause sticks.
     *
     * @return true if the port was not failed before
     */
    public boolean fail(Outcome cause) {
        if (!cause.isFailure()) {
            throw new IllegalArgumentException("Not a failure outcome: " + cause);
        }
        if (failure != null) {
            return false;
        }
        failure = cause;
        return true;
    }

    public boolean isFailed()   { return failure != null; }
    public Outcome getFailure() { return failure; }

    // ------------------------------------------------------------------
    // Flags
    // ------------------------------------------------------------------

    public void    addFlag(PortFlag flag) { flags.add(flag); }
    public boolean hasFlag(PortFlag flag) { return flags.contains(flag); }
    public Set<PortFlag> getFlags()       { return Set.copyOf(flags); }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public int          getId()         { return id; }
    public String       getOrigin()     { return origin; }
    public PortPipeline getPipeline()   { return pipeline; }
    public Dependency   getDependency() { return dependency; }
    public Dependent    getDependent()  { return dependent; }

    public PortAttributes getAttributes()                     { return attributes; }
    public void           setAttributes(PortAttributes attrs) { this.attributes = attrs; }
    public boolean        isLoaded()                          { return attributes != null; }

    public InstallStatus getInstallStatus()                     { return installStatus; }
    public void          setInstallStatus(InstallStatus status) { this.installStatus = status; }

    public DependMethod getMethod()                    { return method; }
    public void         setMethod(DependMethod method) { this.method = method; }

    public boolean isRequired()         { return required; }
    public void    markRequired()       { this.required = true; }
    public boolean isBuildStarted()     { return buildStarted; }
    public void    markBuildStarted()   { this.buildStarted = true; }
    public boolean isFinished()         { return finished; }
    public void    markFinished()       { this.finished = true; }

    /** True once the DEPEND stage has finished, whether or not it found the port. */
    public boolean isLoadSettled() {
        return pipeline.stage(StageName.DEPEND).getState().isTerminal();
    }

    /** Name used for log files: the package name once known, else the origin. */
    public String logName() {
        return attributes != null ? attributes.pkgname() : origin.replace('/', '_');
    }

    @Override
    public String toString() {
        return origin;
    }
}
