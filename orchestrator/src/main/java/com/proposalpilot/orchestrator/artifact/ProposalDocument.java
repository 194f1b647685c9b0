package com.proposalpilot.orchestrator.artifact;

import com.proposalpilot.orchestrator.model.ArtifactKind;

import java.util.List;

/**
 * The terminal artifact: the assembled proposal.
 *
 * Always carries all five sections in {@link SectionKind} order. When an
 * input was missing, its section holds a placeholder and is listed in
 * {@code missingSections}; {@code complete} is true only when nothing is missing.
 *
 * @param missingSections section ids ("resources") and partial gaps ("summary/strategic_focus"), sorted
 */
public record ProposalDocument(
        String                title,
        String                companyName,
        String                industry,
        List<ProposalSection> sections,
        boolean               complete,
        List<String>          missingSections,
        ProposalMetrics       metrics
) implements Artifact {

    public ProposalDocument {
        sections        = List.copyOf(sections);
        missingSections = missingSections.stream().distinct().sorted().toList();
    }

    public ProposalSection section(SectionKind kind) {
        return sections.stream()
                .filter(s -> s.kind() == kind)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Section missing from document: " + kind));
    }

    @Override
    public ArtifactKind kind() {
        return ArtifactKind.PROPOSAL_DOCUMENT;
    }

    @Override
    public List<String> missingParts() {
        return missingSections;
    }
}
