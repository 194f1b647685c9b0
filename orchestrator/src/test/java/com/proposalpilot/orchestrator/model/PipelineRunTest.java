package com.proposalpilot.orchestrator.model;

import com.proposalpilot.orchestrator.artifact.ProposalDocument;
import com.proposalpilot.orchestrator.artifact.ResearchProfile;
import com.proposalpilot.orchestrator.graph.StageGraph;
import com.proposalpilot.orchestrator.proposal.ProposalAssembler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineRunTest {

    static final PipelineRequest ACME = new PipelineRequest("Acme Logistics", "supply-chain");
    static final Instant T0 = Instant.parse("2026-10-19T10:00:00Z");

    PipelineRun run;

    @BeforeEach
    void setUp() {
        run = new PipelineRun(UUID.randomUUID(), ACME, StageGraph.defaultGraph().dependencySets(), T0);
    }

    @Test
    void newRun_pendingWithEveryTaskWaiting() {
        RunSnapshot snap = run.snapshot();

        assertThat(snap.status()).isEqualTo(RunStatus.PENDING);
        assertThat(snap.tasks()).hasSize(4).allMatch(t -> t.status() == TaskStatus.WAITING);
        assertThat(snap.task(AgentKind.FINAL_PROPOSAL).orElseThrow().dependencies()).hasSize(3);
    }

    @Test
    void completeWithGaps_partiallyFailedAndUnfinishedTasksSkipped() {
        run.start(T0);
        run.markReady(AgentKind.RESEARCH, Set.of());
        run.markRunning(AgentKind.RESEARCH, T0);
        ProposalDocument doc = new ProposalAssembler().assemble(ACME, null, null, null);

        run.complete(doc, T0.plusSeconds(3));

        RunSnapshot snap = run.snapshot();
        assertThat(snap.status()).isEqualTo(RunStatus.PARTIALLY_FAILED);
        assertThat(snap.missingSections()).isNotEmpty();
        assertThat(snap.task(AgentKind.RESEARCH).orElseThrow().status()).isEqualTo(TaskStatus.SKIPPED);
        assertThat(snap.elapsed()).hasValueSatisfying(d -> assertThat(d.getSeconds()).isEqualTo(3));
    }

    @Test
    void cancel_discardsArtifactsAndFreezesTheRun() {
        run.start(T0);
        ResearchProfile profile = new ResearchProfile("Acme Logistics", "supply-chain",
                List.of(), List.of(), List.of(), List.of(), List.of());
        run.markSucceeded(AgentKind.RESEARCH, profile, 0, null, T0);

        assertThat(run.cancel("Cancelled by request", T0)).isTrue();
        run.markSucceeded(AgentKind.MARKET_STANDARDS, profile, 0, null, T0);

        assertThat(run.artifacts()).isEmpty();
        assertThat(run.getStatus()).isEqualTo(RunStatus.CANCELLED);
        assertThat(run.taskStatus(AgentKind.MARKET_STANDARDS)).isEqualTo(TaskStatus.SKIPPED);
        assertThat(run.cancel("again", T0)).isFalse();
    }

    @Test
    void fail_recordsReason() {
        run.start(T0);

        run.fail(RunFailure.RUN_DEADLINE_EXCEEDED, "too slow", T0.plusSeconds(300));

        RunSnapshot snap = run.snapshot();
        assertThat(snap.status()).isEqualTo(RunStatus.FAILED);
        assertThat(snap.failure()).isEqualTo(RunFailure.RUN_DEADLINE_EXCEEDED);
        assertThat(snap.failureReason()).isEqualTo("too slow");
        assertThat(snap.document()).isNull();
    }
}
