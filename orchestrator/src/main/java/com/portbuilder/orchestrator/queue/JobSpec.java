package com.portbuilder.orchestrator.queue;

import java.nio.file.Path;
import java.util.List;

/**
 * Description of an external job.
 *
 * @param id       unique while the job is queued or running
 * @param commands argv lists run one after another; the first non-zero exit stops the job
 * @param logFile  file the output is appended to, or null to capture it into {@link JobResult#output()}
 * @param mutating false for read-only queries that must run even in dry-run mode
 */
public record JobSpec(
        String             id,
        List<List<String>> commands,
        Path               logFile,
        boolean            mutating) {

    public JobSpec {
        if (commands.isEmpty()) {
            throw new IllegalArgumentException("Job " + id + " has no command");
        }
        commands = commands.stream().map(List::copyOf).toList();
    }

    /** A read-only command whose output is captured. */
    public static JobSpec query(String id, List<String> command) {
        return new JobSpec(id, List.of(command), null, false);
    }

    /** A state-changing job whose output goes to a log file. */
    public static JobSpec logged(String id, List<List<String>> commands, Path logFile) {
        return new JobSpec(id, commands, logFile, true);
    }

    public boolean capturesOutput() {
        return logFile == null;
    }
}
