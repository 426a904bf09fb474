package com.portbuilder.orchestrator.scheduler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.portbuilder.orchestrator.PortbuilderException;
import com.portbuilder.orchestrator.config.BuildPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Writes the run report as JSON next to the build logs. */
@Component
public class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    static final String FILE_NAME = "report.json";

    private final ObjectMapper json;
    private final BuildPolicy  policy;

    public ReportWriter(ObjectMapper json, BuildPolicy policy) {
        this.json   = json;
        this.policy = policy;
    }

    public Path write(RunReport report) {
        Path file = policy.logDir().resolve(FILE_NAME);
        try {
            Files.createDirectories(policy.logDir());
            json.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), report);
        } catch (IOException e) {
            throw new PortbuilderException(PortbuilderException.Kind.REPORT,
                    "Cannot write report to " + file + ": " + e.getMessage(), e);
        }
        log.info("Wrote run report to {}", file);
        return file;
    }
}
