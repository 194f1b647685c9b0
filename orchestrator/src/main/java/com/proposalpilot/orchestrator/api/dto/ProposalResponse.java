package com.proposalpilot.orchestrator.api.dto;

import com.proposalpilot.orchestrator.artifact.ProposalDocument;
import com.proposalpilot.orchestrator.artifact.ProposalMetrics;
import com.proposalpilot.orchestrator.artifact.ProposalSection;
import com.proposalpilot.orchestrator.model.RunFailure;
import com.proposalpilot.orchestrator.model.RunSnapshot;
import com.proposalpilot.orchestrator.model.RunStatus;

import java.util.List;
import java.util.UUID;

/**
 * Response body for GET /runs/{id}/result.
 *
 * For COMPLETED and PARTIALLY_FAILED runs the document fields are set; for
 * FAILED and CANCELLED runs only status, failure and reason are.
 */
public record ProposalResponse(
        UUID                  runId,
        RunStatus             status,
        String                title,
        boolean               complete,
        List<ProposalSection> sections,
        List<String>          missingSections,
        Metrics               metrics,
        RunFailure            failure,
        String                reason
) {

    /** Document metrics plus the run's wall time. */
    public record Metrics(int trendsIdentified, int useCasesGenerated, int datasetsFound,
                          int repositoriesFound, int resourcesFound, Long completionTimeMs) {

        static Metrics of(ProposalMetrics m, RunSnapshot run) {
            return new Metrics(m.trendsIdentified(), m.useCasesGenerated(), m.datasetsFound(),
                    m.repositoriesFound(), m.resourcesFound(),
                    run.elapsed().map(d -> d.toMillis()).orElse(null));
        }
    }

    public static ProposalResponse ready(ProposalDocument doc, RunSnapshot run) {
        return new ProposalResponse(run.id(), run.status(), doc.title(), doc.complete(),
                doc.sections(), doc.missingSections(), Metrics.of(doc.metrics(), run), null, null);
    }

    public static ProposalResponse ended(UUID runId, RunStatus status, RunFailure failure, String reason) {
        return new ProposalResponse(runId, status, null, false, List.of(), List.of(), null, failure, reason);
    }
}
