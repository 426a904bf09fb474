package com.portbuilder.orchestrator.scheduler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.portbuilder.orchestrator.PortbuilderException;
import com.portbuilder.orchestrator.config.BuildPolicy;
import com.portbuilder.orchestrator.model.DependMethod;
import com.portbuilder.orchestrator.model.InstallStatus;
import com.portbuilder.orchestrator.model.Outcome;
import com.portbuilder.orchestrator.model.StageState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportWriterTest {

    private final ObjectMapper json = new ObjectMapper();

    @TempDir
    Path tmp;

    @Test
    void write_createsLogDirAndWritesJson() throws Exception {
        Path logDir = tmp.resolve("logs");
        ReportWriter writer = new ReportWriter(json, BuildPolicy.builder().logDir(logDir).build());
        PortReport app = new PortReport("www/app", "app-1.0", true, Outcome.FAILED_BY_DEPENDENCY,
                InstallStatus.ABSENT, DependMethod.BUILD, List.of("devel/lib"), List.of("devel/lib"),
                List.of(), Map.of("BUILD", StageState.SKIPPED));

        Path file = writer.write(new RunReport(List.of(app), Interruption.NONE,
                List.of(List.of("devel/a", "devel/b"))));

        assertThat(file).isEqualTo(logDir.resolve(ReportWriter.FILE_NAME));
        JsonNode root = json.readTree(Files.readString(file));
        assertThat(root.get("exitStatus").asInt()).isEqualTo(RunReport.EXIT_FAILURE);
        assertThat(root.get("interruption").asText()).isEqualTo("NONE");
        assertThat(root.get("cycles").get(0).get(1).asText()).isEqualTo("devel/b");
        JsonNode port = root.get("ports").get(0);
        assertThat(port.get("origin").asText()).isEqualTo("www/app");
        assertThat(port.get("outcome").asText()).isEqualTo("FAILED_BY_DEPENDENCY");
        assertThat(port.get("rootCauses").get(0).asText()).isEqualTo("devel/lib");
        assertThat(port.get("stages").get("BUILD").asText()).isEqualTo("SKIPPED");
    }

    @Test
    void write_logDirIsAFile_throwsReportError() throws Exception {
        Path blocker = Files.writeString(tmp.resolve("blocker"), "x");
        ReportWriter writer = new ReportWriter(json, BuildPolicy.builder().logDir(blocker).build());

        assertThatThrownBy(() -> writer.write(new RunReport(List.of(), Interruption.NONE, List.of())))
                .isInstanceOf(PortbuilderException.class)
                .satisfies(e -> assertThat(((PortbuilderException) e).getKind())
                        .isEqualTo(PortbuilderException.Kind.REPORT));
    }
}
