package com.proposalpilot.orchestrator.artifact;

import java.util.List;

/**
 * One rendered section of the proposal.
 *
 * @param available false when the section's input was missing and the body is only a placeholder
 * @param gaps      parts of an otherwise available section that are placeholders
 */
public record ProposalSection(SectionKind kind, String title, String body, boolean available, List<String> gaps) {

    /** Marker every placeholder starts with. Never produced from real provider data. */
    public static final String NOT_AVAILABLE = "Not available";

    public ProposalSection {
        gaps = List.copyOf(gaps);
    }

    public static String placeholder(String reason) {
        return "_" + NOT_AVAILABLE + ": " + reason + "._";
    }
}
