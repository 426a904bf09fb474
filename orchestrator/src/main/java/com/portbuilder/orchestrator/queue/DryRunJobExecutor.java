package com.portbuilder.orchestrator.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Executor for no-op runs: state-changing jobs are printed instead of run
 * and report success straight away. Read-only queries still go to the real
 * executor because the run needs their answers.
 */
public class DryRunJobExecutor implements JobExecutor {

    private static final Logger log = LoggerFactory.getLogger(DryRunJobExecutor.class);

    private final JobExecutor delegate;
    private final PrintStream out;

    public DryRunJobExecutor(JobExecutor delegate, PrintStream out) {
        this.delegate = delegate;
        this.out      = out;
    }

    @Override
    public JobHandle spawn(JobSpec spec, Consumer<JobResult> onExit) {
        if (!spec.mutating()) {
            return delegate.spawn(spec, onExit);
        }
        for (List<String> command : spec.commands()) {
            String line = toShellLine(command);
            log.debug("Dry run {}: {}", spec.id(), line);
            out.println(line);
        }
        onExit.accept(JobResult.success(spec.id()));
        return new JobHandle() {
            @Override public String jobId()            { return spec.id(); }
            @Override public void   kill(boolean force) { /* nothing was started */ }
        };
    }

    @Override
    public void shutdown() {
        delegate.shutdown();
    }

    /** Joins an argv into a line that a POSIX shell would split back the same way. */
    static String toShellLine(List<String> command) {
        return command.stream().map(DryRunJobExecutor::quote).collect(Collectors.joining(" "));
    }

    private static String quote(String arg) {
        String escaped = arg.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("'", "\\'")
                .replace("\n", "\\\n");
        if (arg.isEmpty() || arg.contains(" ") || arg.contains("\t") || arg.contains("\n")) {
            return "\"" + escaped + "\"";
        }
        return escaped;
    }
}
