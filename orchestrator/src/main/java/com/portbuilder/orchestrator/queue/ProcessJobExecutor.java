package com.portbuilder.orchestrator.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs jobs as operating system processes.
 *
 * The first command is started on the calling thread so that a missing
 * executable surfaces as a {@link JobException} from {@code spawn}. A
 * watcher thread then waits for it, runs the remaining commands in turn and
 * reports the result. Watcher threads never touch orchestrator state; they
 * only call {@code onExit}.
 */
public class ProcessJobExecutor implements JobExecutor {

    private static final Logger log = LoggerFactory.getLogger(ProcessJobExecutor.class);

    private final AtomicInteger   threadCount = new AtomicInteger();
    private final ExecutorService watchers    = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "job-watcher-" + threadCount.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    @Override
    public JobHandle spawn(JobSpec spec, Consumer<JobResult> onExit) {
        ProcessJob job = new ProcessJob(spec.id());
        job.current = start(spec, spec.commands().get(0));
        watchers.submit(() -> watch(spec, job, onExit));
        return job;
    }

    @Override
    public void shutdown() {
        watchers.shutdown();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void watch(JobSpec spec, ProcessJob job, Consumer<JobResult> onExit) {
        StringBuilder output = new StringBuilder();
        int exitCode = JobResult.SPAWN_FAILED;
        try {
            List<List<String>> commands = spec.commands();
            for (int i = 0; i < commands.size(); i++) {
                if (i > 0) {
                    if (job.killed) {
                        break;
                    }
                    job.current = start(spec, commands.get(i));
                }
                Process process = job.current;
                if (spec.capturesOutput()) {
                    output.append(new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8));
                }
                exitCode = process.waitFor();
                if (exitCode != JobResult.SUCCESS) {
                    break;
                }
            }
        } catch (JobException | IOException e) {
            log.error("Job {} failed while running: {}", spec.id(), e.getMessage());
            output.append(e.getMessage());
            exitCode = JobResult.SPAWN_FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            job.kill(true);
            exitCode = JobResult.SPAWN_FAILED;
        }
        onExit.accept(new JobResult(spec.id(), exitCode, output.toString()));
    }

    private static Process start(JobSpec spec, List<String> command) {
        ProcessBuilder builder = new ProcessBuilder(command).redirectErrorStream(true);
        try {
            if (!spec.capturesOutput()) {
                Files.createDirectories(spec.logFile().toAbsolutePath().getParent());
                Files.writeString(spec.logFile(), "# " + String.join(" ", command) + "\n",
                        StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
                builder.redirectOutput(ProcessBuilder.Redirect.appendTo(spec.logFile().toFile()));
            }
            Process process = builder.start();
            process.getOutputStream().close();
            return process;
        } catch (IOException e) {
            throw new JobException("Cannot start " + command.get(0) + " for " + spec.id() + ": " + e.getMessage(), e);
        }
    }

    private static final class ProcessJob implements JobHandle {

        private final String     jobId;
        private volatile Process current;
        private volatile boolean killed;

        ProcessJob(String jobId) {
            this.jobId = jobId;
        }

        @Override
        public String jobId() { return jobId; }

        @Override
        public void kill(boolean force) {
            killed = true;
            Process process = current;
            if (process == null || !process.isAlive()) {
                return;
            }
            process.descendants().forEach(force ? ProcessHandle::destroyForcibly : ProcessHandle::destroy);
            if (force) {
                process.destroyForcibly();
            } else {
                process.destroy();
            }
        }
    }
}
