package com.portbuilder.orchestrator.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PortPipelineTest {

    static final List<StageName> FULL = List.of(StageName.DEPEND, StageName.CHECKSUM, StageName.FETCH,
            StageName.BUILD, StageName.INSTALL, StageName.PACKAGE, StageName.CLEAN);

    // ------------------------------------------------------------------
    // Shape
    // ------------------------------------------------------------------

    @Test
    void constructor_notStartingWithDepend_rejected() {
        assertThatThrownBy(() -> new PortPipeline(List.of(StageName.BUILD, StageName.INSTALL)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_outOfOrder_rejected() {
        assertThatThrownBy(() -> new PortPipeline(List.of(StageName.DEPEND, StageName.INSTALL, StageName.BUILD)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void next_walksStagesInOrder() {
        PortPipeline pipeline = new PortPipeline(List.of(StageName.DEPEND, StageName.BUILD, StageName.INSTALL));

        Stage build = pipeline.next(pipeline.stage(StageName.DEPEND));

        assertThat(build.getName()).isEqualTo(StageName.BUILD);
        assertThat(build.getPrev().getName()).isEqualTo(StageName.DEPEND);
        assertThat(pipeline.next(pipeline.stage(StageName.INSTALL))).isNull();
        assertThat(pipeline.stage(StageName.PACKAGE)).isNull();
    }

    @Test
    void resolvingStage_installPresent_isInstall() {
        assertThat(new PortPipeline(FULL).resolvingStage().getName()).isEqualTo(StageName.INSTALL);
    }

    @Test
    void resolvingStage_fetchOnly_isFetch() {
        PortPipeline pipeline = new PortPipeline(List.of(StageName.DEPEND, StageName.CHECKSUM, StageName.FETCH));

        assertThat(pipeline.resolvingStage().getName()).isEqualTo(StageName.FETCH);
        assertThat(pipeline.requiredDependencyTypes()).containsExactly(DependencyType.FETCH);
    }

    @Test
    void requiredDependencyTypes_fullPipeline_coversEveryType() {
        assertThat(new PortPipeline(FULL).requiredDependencyTypes())
                .containsExactlyInAnyOrder(DependencyType.values());
    }

    // ------------------------------------------------------------------
    // Verdicts
    // ------------------------------------------------------------------

    @Test
    void recordFailure_commonStage_failsEveryStack() {
        PortPipeline pipeline = new PortPipeline(FULL);
        Stage depend = pipeline.stage(StageName.DEPEND);
        depend.transitionTo(StageState.QUEUED);
        depend.transitionTo(StageState.FAILED);

        pipeline.recordFailure(depend);

        assertThat(pipeline.failedStacks()).extracting(Stack::getName)
                .containsExactlyInAnyOrder(Stack.COMMON, Stack.BUILD, Stack.CLEAN);
        assertThat(pipeline.stack(Stack.BUILD).getFailedStage()).isEqualTo(StageName.DEPEND);
    }

    @Test
    void recordFailure_buildStage_onlyFailsBuildStack() {
        PortPipeline pipeline = new PortPipeline(FULL);

        pipeline.recordFailure(pipeline.stage(StageName.BUILD));
        pipeline.recordFailure(pipeline.stage(StageName.INSTALL));

        assertThat(pipeline.failedStacks()).extracting(Stack::getName).containsExactly(Stack.BUILD);
        assertThat(pipeline.stack(Stack.BUILD).getFailedStage()).isEqualTo(StageName.BUILD);
    }

    @Test
    void skipRemaining_exceptClean_withdrawsQueuedStages() {
        PortPipeline pipeline = new PortPipeline(FULL);
        pipeline.stage(StageName.DEPEND).transitionTo(StageState.QUEUED);
        pipeline.stage(StageName.DEPEND).transitionTo(StageState.DONE);
        pipeline.stage(StageName.CHECKSUM).transitionTo(StageState.QUEUED);

        List<Stage> withdrawn = pipeline.skipRemaining(Set.of(StageName.CLEAN), false);

        assertThat(withdrawn).extracting(Stage::getName).containsExactly(StageName.CHECKSUM);
        assertThat(pipeline.stage(StageName.CLEAN).getState()).isEqualTo(StageState.PENDING);
        assertThat(pipeline.stage(StageName.PACKAGE).getState()).isEqualTo(StageState.SKIPPED);
        assertThat(pipeline.isTerminal()).isFalse();
    }

    @Test
    void ranBuildJob_onlyAfterABuildStackStageRan() {
        PortPipeline pipeline = new PortPipeline(FULL);
        Stage depend = pipeline.stage(StageName.DEPEND);
        depend.transitionTo(StageState.QUEUED);
        depend.transitionTo(StageState.RUNNING);
        assertThat(pipeline.ranBuildJob()).isFalse();

        Stage build = pipeline.stage(StageName.BUILD);
        build.transitionTo(StageState.QUEUED);
        build.transitionTo(StageState.RUNNING);

        assertThat(pipeline.ranBuildJob()).isTrue();
    }
}
