package com.proposalpilot.orchestrator.agent;

import com.proposalpilot.orchestrator.artifact.ProposalDocument;
import com.proposalpilot.orchestrator.model.PipelineRequest;
import com.proposalpilot.orchestrator.proposal.ProposalAssembler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FinalProposalAgentTest {

    static final PipelineRequest ACME = new PipelineRequest("Acme Logistics", "supply-chain");

    @Mock ProposalAssembler brokenAssembler;

    @Test
    void noInputs_stillProducesDocumentWithPlaceholders() {
        FinalProposalAgent agent = new FinalProposalAgent(new ProposalAssembler());

        ProposalDocument doc = (ProposalDocument) agent.run(new AgentContext(UUID.randomUUID(), ACME, Map.of(),
                new ToolCallLedger()));

        assertThat(doc.complete()).isFalse();
        assertThat(doc.sections()).hasSize(5);
    }

    @Test
    void assemblerThrows_becomesInternalAssemblyError() {
        when(brokenAssembler.assemble(any(PipelineRequest.class), anyCollection()))
                .thenThrow(new IllegalStateException("boom"));
        FinalProposalAgent agent = new FinalProposalAgent(brokenAssembler);

        assertThatThrownBy(() -> agent.run(new AgentContext(UUID.randomUUID(), ACME, Map.of(),
                new ToolCallLedger())))
                .isInstanceOf(AgentFailureException.class)
                .satisfies(e -> assertThat(((AgentFailureException) e).getKind())
                        .isEqualTo(AgentFailureException.Kind.INTERNAL_ASSEMBLY_ERROR))
                .hasRootCauseMessage("boom");
    }
}
