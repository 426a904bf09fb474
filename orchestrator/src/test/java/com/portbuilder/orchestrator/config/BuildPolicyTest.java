package com.portbuilder.orchestrator.config;

import com.portbuilder.orchestrator.PortbuilderException;
import com.portbuilder.orchestrator.model.DependMethod;
import com.portbuilder.orchestrator.model.InstallStatus;
import com.portbuilder.orchestrator.model.StageName;
import com.portbuilder.orchestrator.queue.QueueName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for BuildPolicy and the property binding in PortbuilderConfiguration.
 *
 * No Spring context: the configuration method is called directly with a
 * MockEnvironment.
 */
class BuildPolicyTest {

    // ------------------------------------------------------------------
    // Defaults and validation
    // ------------------------------------------------------------------

    @Test
    void builder_defaults() {
        BuildPolicy policy = BuildPolicy.builder().build();

        assertThat(policy.portsDir()).isEqualTo(Path.of("/usr/ports"));
        assertThat(policy.chroot()).isEmpty();
        assertThat(policy.methods()).containsExactly(DependMethod.BUILD);
        assertThat(policy.load(QueueName.BUILD)).isEqualTo(2 * BuildPolicy.CPUS);
        assertThat(policy.load(QueueName.ATTR)).isEqualTo(2 * BuildPolicy.CPUS);
        assertThat(policy.load(QueueName.FETCH)).isEqualTo(1);
        assertThat(policy.load(QueueName.INSTALL)).isEqualTo(1);
    }

    @Test
    void build_negativeLoad_throwsInvalidConfig() {
        assertThatThrownBy(() -> BuildPolicy.builder().load(QueueName.FETCH, -1).build())
                .isInstanceOf(PortbuilderException.class)
                .hasMessageContaining("INVALID_CONFIG")
                .hasMessageContaining("must be >= 1");
    }

    @Test
    void build_zeroLoad_throwsInvalidConfig() {
        assertThatThrownBy(() -> BuildPolicy.builder().load(QueueName.BUILD, 0).build())
                .isInstanceOf(PortbuilderException.class)
                .hasMessageContaining("INVALID_CONFIG")
                .hasMessageContaining("'build' must be >= 1, got 0");
    }

    @Test
    void build_loadOne_isAllowed() {
        assertThat(BuildPolicy.builder().load(QueueName.BUILD, 1).build().load(QueueName.BUILD)).isEqualTo(1);
    }

    @Test
    void build_noMethods_throwsInvalidConfig() {
        assertThatThrownBy(() -> BuildPolicy.builder().methods(List.of()).build())
                .isInstanceOf(PortbuilderException.class)
                .hasMessageContaining("at least one depend method");
    }

    @Test
    void build_duplicateMethod_throwsInvalidConfig() {
        assertThatThrownBy(() -> BuildPolicy.builder()
                .methods(List.of(DependMethod.REPO, DependMethod.BUILD, DependMethod.REPO)).build())
                .isInstanceOf(PortbuilderException.class)
                .hasMessageContaining("only be listed once");
    }

    // ------------------------------------------------------------------
    // Derived values
    // ------------------------------------------------------------------

    @Test
    void threshold_dependsOnUpgrade() {
        assertThat(BuildPolicy.builder().build().threshold()).isEqualTo(InstallStatus.ABSENT);
        assertThat(BuildPolicy.builder().upgrade(true).build().threshold()).isEqualTo(InstallStatus.OLDER);
    }

    @Test
    void pipelineStages_followRunOptions() {
        assertThat(BuildPolicy.builder().fetchOnly(true).packageStage(true).build().pipelineStages())
                .containsExactly(StageName.DEPEND, StageName.CHECKSUM, StageName.FETCH);
        assertThat(BuildPolicy.builder().build().pipelineStages())
                .containsExactly(StageName.DEPEND, StageName.CHECKSUM, StageName.FETCH,
                        StageName.BUILD, StageName.INSTALL, StageName.CLEAN);
        assertThat(BuildPolicy.builder().clean(false).packageStage(true).build().pipelineStages())
                .containsExactly(StageName.DEPEND, StageName.CHECKSUM, StageName.FETCH,
                        StageName.BUILD, StageName.INSTALL, StageName.PACKAGE);
    }

    @Test
    void hostPath_prefixesChroot() {
        assertThat(BuildPolicy.builder().build().hostPath("/usr/ports/distfiles/a.tgz"))
                .isEqualTo(Path.of("/usr/ports/distfiles/a.tgz"));
        assertThat(BuildPolicy.builder().chroot("/jail").build().hostPath("/usr/ports/distfiles/a.tgz"))
                .isEqualTo(Path.of("/jail/usr/ports/distfiles/a.tgz"));
    }

    // ------------------------------------------------------------------
    // Property binding
    // ------------------------------------------------------------------

    @Test
    void buildPolicy_readsLoadsFromEnvironment() {
        MockEnvironment env = new MockEnvironment()
                .withProperty("portbuilder.loads.build", "3")
                .withProperty("portbuilder.loads.fetch", "1");

        BuildPolicy policy = new PortbuilderConfiguration().buildPolicy(
                "/ports", "", "/tmp/pb", new String[] {"package", " repo"},
                false, false, false, true, false, true, false, false, env);

        assertThat(policy.portsDir()).isEqualTo(Path.of("/ports"));
        assertThat(policy.methods()).containsExactly(DependMethod.PACKAGE, DependMethod.REPO);
        assertThat(policy.load(QueueName.BUILD)).isEqualTo(3);
        assertThat(policy.load(QueueName.FETCH)).isEqualTo(1);
        assertThat(policy.threshold()).isEqualTo(InstallStatus.OLDER);
    }

    @Test
    void parseMethods_unknownName_throwsInvalidConfig() {
        assertThatThrownBy(() -> PortbuilderConfiguration.parseMethods(new String[] {"build", "ftp"}))
                .isInstanceOf(PortbuilderException.class)
                .hasMessageContaining("INVALID_CONFIG")
                .hasMessageContaining("ftp");
    }

    @Test
    void parseMethods_skipsBlankEntries() {
        assertThat(PortbuilderConfiguration.parseMethods(new String[] {"", "BUILD"}))
                .containsExactly(DependMethod.BUILD);
    }
}
