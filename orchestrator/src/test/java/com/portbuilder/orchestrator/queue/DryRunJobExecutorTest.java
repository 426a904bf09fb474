package com.portbuilder.orchestrator.queue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DryRunJobExecutorTest {

    @Mock JobExecutor delegate;
    @Mock JobHandle   handle;

    ByteArrayOutputStream printed;
    DryRunJobExecutor     executor;
    List<JobResult>       results;

    @BeforeEach
    void setUp() {
        printed  = new ByteArrayOutputStream();
        executor = new DryRunJobExecutor(delegate, new PrintStream(printed, true, StandardCharsets.UTF_8));
        results  = new ArrayList<>();
    }

    @Test
    void spawn_mutatingJob_printsCommandsAndSucceedsWithoutRunning() {
        JobSpec spec = JobSpec.logged("www/curl@INSTALL", List.of(
                List.of("pkg", "delete", "-fy", "curl"),
                List.of("pkg", "add", "/packages/All/curl-8.4.0.pkg")), Path.of("/tmp/curl.log"));

        executor.spawn(spec, results::add);

        assertThat(printed.toString(StandardCharsets.UTF_8).lines())
                .containsExactly("pkg delete -fy curl", "pkg add /packages/All/curl-8.4.0.pkg");
        assertThat(results).containsExactly(JobResult.success("www/curl@INSTALL"));
        verifyNoInteractions(delegate);
    }

    @Test
    @SuppressWarnings("unchecked")
    void spawn_query_delegatedToRealExecutor() {
        JobSpec spec = JobSpec.query("www/curl@DEPEND", List.of("make", "-V", "PKGNAME"));
        Consumer<JobResult> onExit = results::add;
        when(delegate.spawn(eq(spec), any(Consumer.class))).thenReturn(handle);

        JobHandle returned = executor.spawn(spec, onExit);

        assertThat(returned).isSameAs(handle);
        assertThat(printed.size()).isZero();
    }

    @Test
    void shutdown_delegates() {
        executor.shutdown();

        verify(delegate).shutdown();
    }

    @Test
    void toShellLine_argumentsWithSpacesAndQuotes_areQuoted() {
        String line = DryRunJobExecutor.toShellLine(
                List.of("make", "-C", "/usr/ports/x11/my port", "MSG=it's", ""));

        assertThat(line).isEqualTo("make -C \"/usr/ports/x11/my port\" MSG=it\\'s \"\"");
    }
}
