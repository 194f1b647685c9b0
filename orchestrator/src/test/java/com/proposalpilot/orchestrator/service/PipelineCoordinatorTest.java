package com.proposalpilot.orchestrator.service;

import com.proposalpilot.orchestrator.agent.FinalProposalAgent;
import com.proposalpilot.orchestrator.artifact.Artifact;
import com.proposalpilot.orchestrator.artifact.ProposalDocument;
import com.proposalpilot.orchestrator.artifact.ProposalSection;
import com.proposalpilot.orchestrator.artifact.SectionKind;
import com.proposalpilot.orchestrator.config.PipelineProperties;
import com.proposalpilot.orchestrator.model.AgentKind;
import com.proposalpilot.orchestrator.model.ArtifactKind;
import com.proposalpilot.orchestrator.model.PipelineRequest;
import com.proposalpilot.orchestrator.model.RunFailure;
import com.proposalpilot.orchestrator.model.RunSnapshot;
import com.proposalpilot.orchestrator.model.RunStatus;
import com.proposalpilot.orchestrator.model.TaskSnapshot;
import com.proposalpilot.orchestrator.model.TaskStatus;
import com.proposalpilot.orchestrator.proposal.ProposalAssembler;
import com.proposalpilot.orchestrator.support.TestPipeline;
import com.proposalpilot.orchestrator.tool.ProviderIds;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end runs of the coordinator over scripted backends.
 *
 * Everything is wired by hand (no Spring context); backends answer from
 * memory, so each run finishes in milliseconds unless a test scripts delays.
 */
class PipelineCoordinatorTest {

    static final PipelineProperties FAST = PipelineProperties.defaults().withRetries(2, Duration.ofMillis(5));

    TestPipeline pipeline;

    @AfterEach
    void tearDown() {
        pipeline.close();
    }

    // ------------------------------------------------------------------
    // Happy path
    // ------------------------------------------------------------------

    @Test
    void allProvidersSucceed_completedWithFullDocument() throws Exception {
        pipeline = new TestPipeline(FAST);
        pipeline.backend(ProviderIds.DATASET_SEARCH).returning(2);
        pipeline.backend(ProviderIds.CODE_SEARCH).returning(1);

        RunSnapshot run = awaitTerminal(pipeline.coordinator.submit("Acme Logistics", "supply-chain").id());

        assertThat(run.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(run.tasks()).allMatch(t -> t.status() == TaskStatus.SUCCEEDED);

        ProposalDocument doc = run.document();
        assertThat(doc.complete()).isTrue();
        assertThat(doc.metrics().trendsIdentified()).isEqualTo(3);
        assertThat(doc.sections()).hasSize(5).allSatisfy(s -> {
            assertThat(s.available()).isTrue();
            assertThat(s.body()).doesNotContain(ProposalSection.NOT_AVAILABLE);
        });
        String resources = doc.section(SectionKind.RESOURCES).body();
        assertThat(resources.lines().filter(l -> l.startsWith("- [")).count()).isEqualTo(3);

        awaitMetric("completed");
    }

    @Test
    void researchAvailable_resourceQueriesUseItsKeyTerms() throws Exception {
        pipeline = new TestPipeline(FAST);

        RunSnapshot run = awaitTerminal(pipeline.coordinator.submit("Acme Logistics", "supply-chain").id());

        assertThat(run.status()).isEqualTo(RunStatus.COMPLETED);
        String query = pipeline.backend(ProviderIds.DATASET_SEARCH).queries().get(0).text();
        assertThat(query).startsWith("supply-chain ").isNotEqualTo("supply-chain");
        assertThat(run.task(AgentKind.RESOURCE_ASSET).orElseThrow().degradedInputs()).isEmpty();
    }

    // ------------------------------------------------------------------
    // Degradation
    // ------------------------------------------------------------------

    @Test
    void resourceProvidersRateLimited_partiallyFailedWithResourcesPlaceholder() throws Exception {
        pipeline = new TestPipeline(FAST);
        pipeline.backend(ProviderIds.DATASET_SEARCH).failingWith(429);
        pipeline.backend(ProviderIds.CODE_SEARCH).failingWith(429);

        RunSnapshot run = awaitTerminal(pipeline.coordinator.submit("Acme Logistics", "supply-chain").id());

        assertThat(run.status()).isEqualTo(RunStatus.PARTIALLY_FAILED);
        assertThat(run.missingSections()).containsExactly("resources");

        TaskSnapshot resourceTask = run.task(AgentKind.RESOURCE_ASSET).orElseThrow();
        assertThat(resourceTask.status()).isEqualTo(TaskStatus.FAILED);
        assertThat(resourceTask.retries()).isEqualTo(2);
        assertThat(resourceTask.lastError()).contains("RATE_LIMITED");
        assertThat(pipeline.backend(ProviderIds.DATASET_SEARCH).calls()).isEqualTo(2);

        ProposalDocument doc = run.document();
        assertThat(doc.section(SectionKind.RESOURCES).body()).contains(ProposalSection.NOT_AVAILABLE);
        assertThat(doc.section(SectionKind.SUMMARY).available()).isTrue();
        assertThat(doc.section(SectionKind.TRENDS).available()).isTrue();
        assertThat(doc.section(SectionKind.USE_CASES).available()).isTrue();
        assertThat(run.task(AgentKind.FINAL_PROPOSAL).orElseThrow().degradedInputs())
                .containsExactly(ArtifactKind.RESOURCE_BUNDLE);
    }

    @Test
    void researchFailsEntirely_runStillProducesDocument() throws Exception {
        pipeline = new TestPipeline(FAST);
        pipeline.backend(ProviderIds.WEB_SEARCH).failingWith(500);
        pipeline.backend(ProviderIds.BUSINESS_ANALYSIS).failingWith(500);

        RunSnapshot run = awaitTerminal(pipeline.coordinator.submit("Acme Logistics", "supply-chain").id());

        assertThat(run.status()).isIn(RunStatus.COMPLETED, RunStatus.PARTIALLY_FAILED);
        assertThat(run.missingSections()).contains("summary");
        assertThat(run.task(AgentKind.RESEARCH).orElseThrow().status()).isEqualTo(TaskStatus.FAILED);

        TaskSnapshot resourceTask = run.task(AgentKind.RESOURCE_ASSET).orElseThrow();
        assertThat(resourceTask.degradedInputs()).containsExactly(ArtifactKind.RESEARCH_PROFILE);
        assertThat(pipeline.backend(ProviderIds.CODE_SEARCH).queries())
                .allSatisfy(q -> assertThat(q.text()).isEqualTo("supply-chain"));
    }

    @Test
    void researchSlowerThanItsWaitBudget_resourceAssetProceedsWithRawIndustry() throws Exception {
        PipelineProperties props = FAST.withDependencyTimeout(ArtifactKind.RESEARCH_PROFILE, Duration.ofMillis(100));
        pipeline = new TestPipeline(props);
        pipeline.backend(ProviderIds.WEB_SEARCH).delayedBy(Duration.ofMillis(1500));

        RunSnapshot run = awaitTerminal(pipeline.coordinator.submit("Acme Logistics", "supply-chain").id());

        assertThat(run.status().hasDocument()).isTrue();
        assertThat(run.task(AgentKind.RESOURCE_ASSET).orElseThrow().degradedInputs())
                .containsExactly(ArtifactKind.RESEARCH_PROFILE);
        assertThat(pipeline.backend(ProviderIds.DATASET_SEARCH).queries().get(0).text()).isEqualTo("supply-chain");
    }

    // ------------------------------------------------------------------
    // Failure
    // ------------------------------------------------------------------

    @Test
    void assemblerDefect_runFailed() throws Exception {
        ProposalAssembler broken = new ProposalAssembler() {
            @Override
            public ProposalDocument assemble(PipelineRequest request, Collection<? extends Artifact> artifacts) {
                throw new IllegalStateException("section template missing");
            }
        };
        pipeline = new TestPipeline(FAST,
                TestPipeline.replacing(AgentKind.FINAL_PROPOSAL, new FinalProposalAgent(broken)), false);

        UUID id = pipeline.coordinator.submit("Acme Logistics", "supply-chain").id();
        RunSnapshot run = awaitTerminal(id);

        assertThat(run.status()).isEqualTo(RunStatus.FAILED);
        assertThat(run.failure()).isEqualTo(RunFailure.ASSEMBLER_DEFECT);
        assertThat(run.failureReason()).contains("section template missing");
        assertThat(run.document()).isNull();
        assertThat(pipeline.coordinator.result(id)).containsInstanceOf(RunResult.Failed.class);
        awaitMetric("failed");
    }

    @Test
    void assemblerThrowsError_runFailedWithoutWaitingForTheDeadline() throws Exception {
        ProposalAssembler broken = new ProposalAssembler() {
            @Override
            public ProposalDocument assemble(PipelineRequest request, Collection<? extends Artifact> artifacts) {
                throw new StackOverflowError("template recursion");
            }
        };
        pipeline = new TestPipeline(FAST,
                TestPipeline.replacing(AgentKind.FINAL_PROPOSAL, new FinalProposalAgent(broken)), false);

        RunSnapshot run = awaitTerminal(pipeline.coordinator.submit("Acme Logistics", "supply-chain").id());

        assertThat(run.status()).isEqualTo(RunStatus.FAILED);
        assertThat(run.failure()).isEqualTo(RunFailure.ASSEMBLER_DEFECT);
        assertThat(run.failureReason()).contains("template recursion");
        assertThat(run.task(AgentKind.FINAL_PROPOSAL).orElseThrow().status()).isEqualTo(TaskStatus.FAILED);
    }

    @Test
    void runOverMaxDuration_failedWithDeadlineExceeded() throws Exception {
        pipeline = new TestPipeline(FAST.withMaxRunDuration(Duration.ofMillis(300)));
        pipeline.backends.values().forEach(b -> b.hanging());

        long start = System.nanoTime();
        RunSnapshot run = awaitTerminal(pipeline.coordinator.submit("Acme Logistics", "supply-chain").id());

        assertThat(run.status()).isEqualTo(RunStatus.FAILED);
        assertThat(run.failure()).isEqualTo(RunFailure.RUN_DEADLINE_EXCEEDED);
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(5));
        assertThat(run.tasks()).allMatch(t -> t.status().isTerminal());
        assertThat(pipeline.backend(ProviderIds.WEB_SEARCH).interruptions().await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void runsQueuedForADriverThread_stillEndWithinMaxDurationOfSubmission() throws Exception {
        Duration max = Duration.ofMillis(400);
        pipeline = new TestPipeline(FAST.withMaxRunDuration(max));   // two driver threads
        pipeline.backend(ProviderIds.WEB_SEARCH).hanging();

        List<UUID> ids = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            ids.add(pipeline.coordinator.submit("Acme Logistics " + i, "supply-chain").id());
        }

        for (UUID id : ids) {
            RunSnapshot run = awaitTerminal(id);
            assertThat(run.status()).isEqualTo(RunStatus.FAILED);
            assertThat(run.failure()).isEqualTo(RunFailure.RUN_DEADLINE_EXCEEDED);
            assertThat(Duration.between(run.createdAt(), run.completedAt()))
                    .isLessThan(max.plusMillis(250));
        }
    }

    // ------------------------------------------------------------------
    // Concurrency
    // ------------------------------------------------------------------

    @Test
    void marketStandardsRunsAlongsideResearch_andFinishesFirstWhenResearchIsSlow() throws Exception {
        pipeline = new TestPipeline(FAST);
        pipeline.backend(ProviderIds.BUSINESS_ANALYSIS).hanging();

        UUID id = pipeline.coordinator.submit("Acme Logistics", "supply-chain").id();
        RunSnapshot run = await(id, r -> r.task(AgentKind.MARKET_STANDARDS).orElseThrow().status() == TaskStatus.SUCCEEDED);

        assertThat(run.task(AgentKind.RESEARCH).orElseThrow().status()).isEqualTo(TaskStatus.RUNNING);
        assertThat(run.status()).isEqualTo(RunStatus.RUNNING);

        pipeline.coordinator.cancel(id);
    }

    @Test
    void blankRequest_rejected() {
        pipeline = new TestPipeline(FAST);

        assertThatThrownBy(() -> pipeline.coordinator.submit(" ", "supply-chain"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("companyName");
        assertThat(pipeline.runs.count()).isZero();
    }

    // ------------------------------------------------------------------
    // Status, result and cancellation
    // ------------------------------------------------------------------

    @Test
    void whileRunning_resultNotReady() throws Exception {
        pipeline = new TestPipeline(FAST);
        pipeline.backend(ProviderIds.WEB_SEARCH).hanging();

        UUID id = pipeline.coordinator.submit("Acme Logistics", "supply-chain").id();
        await(id, r -> r.task(AgentKind.RESEARCH).orElseThrow().status() == TaskStatus.RUNNING);

        assertThat(pipeline.coordinator.result(id)).hasValue(new RunResult.NotReady(RunStatus.RUNNING));
    }

    @Test
    void cancel_abortsCallsSkipsTasksAndDiscardsArtifacts() throws Exception {
        pipeline = new TestPipeline(FAST);
        pipeline.backend(ProviderIds.WEB_SEARCH).hanging();

        UUID id = pipeline.coordinator.submit("Acme Logistics", "supply-chain").id();
        await(id, r -> r.task(AgentKind.RESEARCH).orElseThrow().status() == TaskStatus.RUNNING);

        RunSnapshot afterCancel = pipeline.coordinator.cancel(id).orElseThrow();

        assertThat(afterCancel.status()).isEqualTo(RunStatus.CANCELLED);
        assertThat(afterCancel.tasks()).allMatch(t -> t.status().isTerminal());
        assertThat(afterCancel.task(AgentKind.RESEARCH).orElseThrow().status()).isEqualTo(TaskStatus.SKIPPED);
        assertThat(pipeline.runs.findById(id).orElseThrow().artifacts()).isEmpty();
        assertThat(pipeline.backend(ProviderIds.WEB_SEARCH).interruptions().await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(pipeline.coordinator.result(id)).containsInstanceOf(RunResult.Cancelled.class);
        awaitMetric("cancelled");
    }

    @Test
    void cancel_terminalRunLeftAsItIs() throws Exception {
        pipeline = new TestPipeline(FAST);
        UUID id = pipeline.coordinator.submit("Acme Logistics", "supply-chain").id();
        awaitTerminal(id);

        RunSnapshot after = pipeline.coordinator.cancel(id).orElseThrow();

        assertThat(after.status()).isEqualTo(RunStatus.COMPLETED);
    }

    @Test
    void unknownRun_empty() {
        pipeline = new TestPipeline(FAST);
        UUID unknown = UUID.randomUUID();

        assertThat(pipeline.coordinator.status(unknown)).isEmpty();
        assertThat(pipeline.coordinator.result(unknown)).isEmpty();
        assertThat(pipeline.coordinator.cancel(unknown)).isEmpty();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    RunSnapshot awaitTerminal(UUID id) throws InterruptedException {
        return await(id, r -> r.status().isTerminal());
    }

    RunSnapshot await(UUID id, Predicate<RunSnapshot> condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        RunSnapshot last = null;
        while (System.nanoTime() < deadline) {
            last = pipeline.coordinator.status(id).orElseThrow();
            if (condition.test(last)) return last;
            Thread.sleep(10);
        }
        throw new AssertionError("Condition not reached in time; last state: " + last);
    }

    void awaitMetric(String status) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            if (pipeline.meters.counter("proposal.runs", "status", status).count() >= 1.0) return;
            Thread.sleep(10);
        }
        throw new AssertionError("proposal.runs{status=" + status + "} never incremented");
    }
}
