package com.portbuilder.orchestrator.graph;

import com.portbuilder.orchestrator.config.BuildPolicy;
import com.portbuilder.orchestrator.model.DependMethod;
import com.portbuilder.orchestrator.model.DependentStatus;
import com.portbuilder.orchestrator.model.Outcome;
import com.portbuilder.orchestrator.model.Port;
import com.portbuilder.orchestrator.model.StageName;
import com.portbuilder.orchestrator.model.StageState;
import com.portbuilder.orchestrator.queue.JobSpec;
import com.portbuilder.orchestrator.queue.QueueName;
import com.portbuilder.orchestrator.scheduler.FailureAnalyzer;
import com.portbuilder.orchestrator.scheduler.RunReport;
import com.portbuilder.orchestrator.support.SchedulerFixture;
import com.portbuilder.orchestrator.support.ScriptedJobExecutor;
import com.portbuilder.orchestrator.support.StaticVariableCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Scenario tests for DependencyGraph.
 *
 * No Spring context: the engine is wired by {@link SchedulerFixture} around
 * an in-memory ports tree, and every job succeeds unless scripted to fail.
 */
class DependencyGraphTest {

    StaticVariableCache tree;
    ScriptedJobExecutor executor;
    List<String>        failedEvents;

    @BeforeEach
    void setUp() {
        tree         = new StaticVariableCache();
        executor     = new ScriptedJobExecutor();
        failedEvents = new ArrayList<>();
    }

    // ------------------------------------------------------------------
    // Identity and ordering
    // ------------------------------------------------------------------

    @Test
    void port_sameOrigin_returnsSameInstanceAndLoadsOnce() {
        tree.add("ftp/curl", "curl-8.5.0");
        SchedulerFixture f = fixture(SchedulerFixture.policy().build());

        Port first  = f.graph.port("ftp/curl");
        Port second = f.graph.port("ftp/curl");
        f.eventLoop.run();

        assertThat(first).isSameAs(second);
        assertThat(f.graph.ports()).hasSize(1);
        assertThat(executor.spawnedIds()).containsExactly("ftp/curl@DEPEND");
    }

    @Test
    void run_chainWithLoadOne_buildsDependenciesFirst() {
        tree.add("www/app", "app-1.0", "devel/lib")
            .add("devel/lib", "lib-1.0", "devel/base")
            .add("devel/base", "base-1.0");
        SchedulerFixture f = fixture(SchedulerFixture.policy()
                .load(QueueName.BUILD, 1)
                .load(QueueName.INSTALL, 1)
                .build());

        RunReport report = run(f, "www/app");

        assertThat(f.buildJobs()).containsExactly(
                "devel/base@BUILD", "devel/base@INSTALL",
                "devel/lib@BUILD",  "devel/lib@INSTALL",
                "www/app@BUILD",    "www/app@INSTALL");
        assertThat(report.exitStatus()).isZero();
        assertThat(f.queues.peakRunning(QueueName.BUILD)).isEqualTo(1);
    }

    @Test
    void run_sharedDependency_builtOnce() {
        tree.add("www/a", "a-1.0", "devel/base")
            .add("www/b", "b-1.0", "devel/base")
            .add("devel/base", "base-1.0");
        SchedulerFixture f = fixture(SchedulerFixture.policy().build());

        run(f, "www/a", "www/b");

        assertThat(f.buildJobs()).filteredOn(id -> id.startsWith("devel/base@BUILD")).hasSize(1);
        assertThat(f.graph.find("devel/base").orElseThrow().getDependent().ports())
                .extracting(Port::getOrigin).containsExactlyInAnyOrder("www/a", "www/b");
    }

    // ------------------------------------------------------------------
    // Install status
    // ------------------------------------------------------------------

    @Test
    void run_dependencyAlreadyInstalled_skipped() {
        tree.add("www/app", "app-1.0", "devel/lib").add("devel/lib", "lib-1.0");
        SchedulerFixture f = fixture(SchedulerFixture.policy().build());
        f.packages.load(List.of("lib-1.0:devel/lib"));

        RunReport report = run(f, "www/app");

        Port lib = f.graph.find("devel/lib").orElseThrow();
        assertThat(f.buildJobs()).containsExactly("www/app@BUILD", "www/app@INSTALL");
        assertThat(lib.getPipeline().stage(StageName.BUILD).getState()).isEqualTo(StageState.SKIPPED);
        assertThat(lib.getDependent().getStatus()).isEqualTo(DependentStatus.SATISFIED);
        assertThat(report.exitStatus()).isZero();
    }

    @Test
    void run_upgradeWithOlderDependencyInstalled_rebuildsIt() {
        tree.add("www/app", "app-1.0", "devel/lib").add("devel/lib", "lib-2.0");
        SchedulerFixture f = fixture(SchedulerFixture.policy().upgrade(true).build());
        f.packages.load(List.of("lib-1.0:devel/lib"));

        run(f, "www/app");

        assertThat(f.buildJobs()).contains("devel/lib@BUILD");
        JobSpec install = f.executor.spawned().stream()
                .filter(s -> s.id().equals("devel/lib@INSTALL")).findFirst().orElseThrow();
        assertThat(install.commands().get(0)).contains("deinstall", "reinstall");
    }

    @Test
    void run_explicitPortInstalled_skippedUnlessForced() {
        tree.add("www/app", "app-1.0");
        SchedulerFixture plain = fixture(SchedulerFixture.policy().build());
        plain.packages.load(List.of("app-1.0:www/app"));
        run(plain, "www/app");
        assertThat(plain.buildJobs()).isEmpty();

        tree     = new StaticVariableCache().add("www/app", "app-1.0");
        executor = new ScriptedJobExecutor();
        SchedulerFixture forced = fixture(SchedulerFixture.policy().force(true).build());
        forced.packages.load(List.of("app-1.0:www/app"));
        run(forced, "www/app");
        assertThat(forced.buildJobs()).containsExactly("www/app@BUILD", "www/app@INSTALL");
    }

    // ------------------------------------------------------------------
    // Methods
    // ------------------------------------------------------------------

    @Test
    void run_noApplicableMethod_failsDependencyAndDependant() {
        tree.add("www/app", "app-1.0", "devel/lib").add("devel/lib", "lib-1.0");
        SchedulerFixture f = fixture(SchedulerFixture.policy().methods(List.of(DependMethod.PACKAGE)).build());

        RunReport report = run(f, "www/app");

        assertThat(outcome(f, "devel/lib")).isEqualTo(Outcome.FAILED_NO_METHOD);
        assertThat(outcome(f, "www/app")).isEqualTo(Outcome.FAILED_BY_DEPENDENCY);
        assertThat(f.buildJobs()).isEmpty();
        assertThat(report.exitStatus()).isEqualTo(RunReport.EXIT_FAILURE);
    }

    @Test
    void run_firstMethodNotApplicable_fallsBackToRepository() {
        tree.add("www/app", "app-1.0", "devel/lib").add("devel/lib", "lib-1.0");
        SchedulerFixture f = fixture(SchedulerFixture.policy()
                .methods(List.of(DependMethod.PACKAGE, DependMethod.REPO)).build());

        run(f, "www/app");

        assertThat(f.graph.find("devel/lib").orElseThrow().getMethod()).isEqualTo(DependMethod.REPO);
        assertThat(f.graph.find("www/app").orElseThrow().getMethod()).isEqualTo(DependMethod.BUILD);
        assertThat(f.buildJobs()).containsExactly(
                "devel/lib@INSTALL", "www/app@BUILD", "www/app@INSTALL");
        assertThat(f.executor.spawned().stream()
                .filter(s -> s.id().equals("devel/lib@INSTALL")).findFirst().orElseThrow().commands())
                .containsExactly(List.of("pkg", "install", "-y", "lib-1.0"));
    }

    // ------------------------------------------------------------------
    // Failure propagation
    // ------------------------------------------------------------------

    @Test
    void run_diamondWithFailingBase_failsEveryDependantExactlyOnce() {
        tree.add("www/app", "app-1.0", "devel/left", "devel/right")
            .add("devel/left", "left-1.0", "devel/base")
            .add("devel/right", "right-1.0", "devel/base")
            .add("devel/base", "base-1.0");
        executor.failWith("devel/base@BUILD", 1);
        SchedulerFixture f = fixture(SchedulerFixture.policy().build());

        run(f, "www/app");

        assertThat(outcome(f, "devel/base")).isEqualTo(Outcome.FAILED_DIRECTLY);
        assertThat(outcome(f, "devel/left")).isEqualTo(Outcome.FAILED_BY_DEPENDENCY);
        assertThat(outcome(f, "devel/right")).isEqualTo(Outcome.FAILED_BY_DEPENDENCY);
        assertThat(outcome(f, "www/app")).isEqualTo(Outcome.FAILED_BY_DEPENDENCY);
        assertThat(failedEvents).containsExactlyInAnyOrder("devel/base", "devel/left", "devel/right", "www/app");
        assertThat(f.buildJobs()).containsExactly("devel/base@BUILD");
        assertThat(f.graph.ports()).allMatch(p -> p.getPipeline().isTerminal());
    }

    @Test
    void run_unknownDependency_failsDependant() {
        tree.add("www/app", "app-1.0", "no/such");
        SchedulerFixture f = fixture(SchedulerFixture.policy().build());

        run(f, "www/app");

        assertThat(outcome(f, "no/such")).isEqualTo(Outcome.UNRESOLVED_NAME);
        assertThat(outcome(f, "www/app")).isEqualTo(Outcome.FAILED_BY_DEPENDENCY);
        assertThat(f.graph.find("www/app").orElseThrow().getDependency().unresolvedNames())
                .containsExactly("no/such");
    }

    @Test
    void run_cycle_failsMembersAndStillFinishesOtherPorts() {
        tree.add("devel/a", "a-1.0", "devel/b")
            .add("devel/b", "b-1.0", "devel/a")
            .add("www/c", "c-1.0");
        SchedulerFixture f = fixture(SchedulerFixture.policy().build());

        RunReport report = run(f, "devel/a", "www/c");

        assertThat(outcome(f, "devel/a")).isEqualTo(Outcome.FAILED_CYCLE);
        assertThat(outcome(f, "devel/b")).isEqualTo(Outcome.FAILED_CYCLE);
        assertThat(outcome(f, "www/c")).isEqualTo(Outcome.SUCCESS);
        assertThat(f.graph.cycles()).hasSize(1);
        assertThat(f.graph.cycles().get(0)).containsExactlyInAnyOrder("devel/a", "devel/b");
        assertThat(report.cycles()).isEqualTo(f.graph.cycles());
        assertThat(f.buildJobs()).containsExactly("www/c@BUILD", "www/c@INSTALL");
    }

    @Test
    void run_selfDependency_isACycle() {
        tree.add("devel/self", "self-1.0", "devel/self");
        SchedulerFixture f = fixture(SchedulerFixture.policy().build());

        run(f, "devel/self");

        assertThat(outcome(f, "devel/self")).isEqualTo(Outcome.FAILED_CYCLE);
        assertThat(f.graph.cycles()).containsExactly(List.of("devel/self"));
    }

    @Test
    void run_packagingFailsAfterInstall_dependantsUnaffected() {
        tree.add("www/app", "app-1.0", "devel/lib").add("devel/lib", "lib-1.0");
        executor.failWith("devel/lib@PACKAGE", 1);
        SchedulerFixture f = fixture(SchedulerFixture.policy().packageStage(true).build());

        run(f, "www/app");

        assertThat(outcome(f, "devel/lib")).isEqualTo(Outcome.FAILED_DIRECTLY);
        assertThat(outcome(f, "www/app")).isEqualTo(Outcome.SUCCESS);
        assertThat(failedEvents).isEmpty();
    }

    @Test
    void run_fetchOnly_ignoresBuildDependencies() {
        tree.add("www/app", "app-1.0", "devel/lib").add("devel/lib", "lib-1.0");
        SchedulerFixture f = fixture(SchedulerFixture.policy().fetchOnly(true).build());

        RunReport report = run(f, "www/app");

        assertThat(f.graph.find("devel/lib")).isEmpty();
        assertThat(report.exitStatus()).isZero();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private SchedulerFixture fixture(BuildPolicy policy) {
        SchedulerFixture f = new SchedulerFixture(policy, tree, executor);
        f.eventLoop.connect(DependencyGraph.PORT_FAILED,
                e -> failedEvents.add(e.payload(Port.class).getOrigin()));
        return f;
    }

    private static RunReport run(SchedulerFixture f, String... origins) {
        f.scheduler.request(List.of(origins));
        return f.scheduler.run();
    }

    private static Outcome outcome(SchedulerFixture f, String origin) {
        return new FailureAnalyzer().outcome(f.graph.find(origin).orElseThrow());
    }
}
