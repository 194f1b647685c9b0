package com.proposalpilot.orchestrator.agent;

import com.proposalpilot.orchestrator.artifact.Artifact;
import com.proposalpilot.orchestrator.model.AgentKind;
import com.proposalpilot.orchestrator.proposal.ProposalAssembler;
import org.springframework.stereotype.Component;

/**
 * Composes the proposal document from whatever upstream artifacts arrived.
 * Makes no tool calls; missing inputs only degrade the document.
 */
@Component
public class FinalProposalAgent implements Agent {

    private final ProposalAssembler assembler;

    public FinalProposalAgent(ProposalAssembler assembler) {
        this.assembler = assembler;
    }

    @Override
    public AgentKind kind() {
        return AgentKind.FINAL_PROPOSAL;
    }

    @Override
    public Artifact run(AgentContext ctx) {
        try {
            return assembler.assemble(ctx.request(), ctx.inputs().values());
        } catch (RuntimeException e) {
            throw AgentFailureException.internal(kind(), e);
        }
    }
}
