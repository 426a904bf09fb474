package com.portbuilder.orchestrator;

import com.portbuilder.orchestrator.model.Outcome;
import com.portbuilder.orchestrator.scheduler.PortReport;
import com.portbuilder.orchestrator.scheduler.PortScheduler;
import com.portbuilder.orchestrator.scheduler.ReportWriter;
import com.portbuilder.orchestrator.scheduler.RunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs one build when the application starts.
 *
 * Non-option arguments (and {@code portbuilder.ports}) are the origins to
 * build. The process exit code is the run's exit status, or 2 when no
 * origin was given.
 */
@Component
public class BuildCommand implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(BuildCommand.class);

    static final int EXIT_USAGE = 2;

    private final PortScheduler scheduler;
    private final ReportWriter  reports;
    private final String[]      configuredPorts;

    private int exitCode;

    public BuildCommand(PortScheduler scheduler,
                        ReportWriter reports,
                        @Value("${portbuilder.ports:}") String[] configuredPorts) {
        this.scheduler       = scheduler;
        this.reports         = reports;
        this.configuredPorts = configuredPorts;
    }

    @Override
    public void run(String... args) {
        List<String> origins = origins(args);
        if (origins.isEmpty()) {
            log.error("No ports to build. Usage: portbuilder [--portbuilder.<option>=<value>...] <category/port>...");
            exitCode = EXIT_USAGE;
            return;
        }

        scheduler.onPortFinished(port -> {
            if (port.isFailed()) {
                log.warn("Port '{}' finished: {}", port, port.getFailure());
            } else {
                log.info("Port '{}' finished", port);
            }
        });
        scheduler.request(origins);
        RunReport report = scheduler.run();

        try {
            reports.write(report);
        } catch (PortbuilderException e) {
            log.error("{}", e.getMessage(), e);
        }
        summarize(report);
        exitCode = report.exitStatus();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    List<String> origins(String... args) {
        List<String> origins = new ArrayList<>();
        for (String port : configuredPorts) {
            if (!port.isBlank()) {
                origins.add(port.trim());
            }
        }
        for (String arg : args) {
            if (!arg.startsWith("--") && !origins.contains(arg)) {
                origins.add(arg);
            }
        }
        return origins;
    }

    private void summarize(RunReport report) {
        log.info("Run finished ({}): {} succeeded, {} failed, {} incomplete",
                report.interruption(),
                report.count(Outcome.SUCCESS),
                report.ports().stream().filter(p -> p.outcome().isFailure()).count(),
                report.count(Outcome.INCOMPLETE));
        for (PortReport port : report.ports()) {
            if (port.outcome().isFailure()) {
                log.error("  {} {} (root cause: {})", port.origin(), port.outcome(), port.rootCauses());
            }
        }
        for (List<String> cycle : report.cycles()) {
            log.error("  cycle: {}", String.join(" -> ", cycle));
        }
    }
}
