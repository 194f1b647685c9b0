package com.proposalpilot.orchestrator.proposal;

import com.proposalpilot.orchestrator.artifact.ProposalDocument;
import com.proposalpilot.orchestrator.artifact.ProposalSection;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Renders a {@link ProposalDocument} as a Markdown file, the format the
 * proposal is downloaded in.
 */
public final class ProposalMarkdownRenderer {

    private static final DateTimeFormatter FILE_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private ProposalMarkdownRenderer() {}

    public static String render(ProposalDocument doc) {
        StringBuilder sb = new StringBuilder();
        sb.append("# ").append(doc.title()).append("\n\n");
        sb.append("_Industry: ").append(doc.industry()).append("_\n\n");
        if (!doc.complete()) {
            sb.append("> **Incomplete proposal.** Missing: ")
              .append(String.join(", ", doc.missingSections())).append("\n\n");
        }
        int n = 1;
        for (ProposalSection section : doc.sections()) {
            sb.append("## ").append(n++).append(". ").append(section.title()).append("\n\n");
            sb.append(section.body()).append("\n\n");
        }
        return sb.toString().stripTrailing() + "\n";
    }

    /** e.g. {@code ai_proposal_acme_logistics_20261019_143000.md} */
    public static String fileName(ProposalDocument doc, Instant generatedAt) {
        String slug = doc.companyName().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_+|_+$", "");
        return "ai_proposal_" + (slug.isEmpty() ? "company" : slug) + "_" + FILE_STAMP.format(generatedAt) + ".md";
    }
}
