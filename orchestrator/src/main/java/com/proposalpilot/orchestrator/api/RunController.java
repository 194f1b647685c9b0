package com.proposalpilot.orchestrator.api;

import com.proposalpilot.orchestrator.api.dto.ProposalResponse;
import com.proposalpilot.orchestrator.api.dto.RunResponse;
import com.proposalpilot.orchestrator.api.dto.SubmitRunRequest;
import com.proposalpilot.orchestrator.api.dto.TaskResponse;
import com.proposalpilot.orchestrator.artifact.ProposalDocument;
import com.proposalpilot.orchestrator.model.RunSnapshot;
import com.proposalpilot.orchestrator.model.RunStatus;
import com.proposalpilot.orchestrator.proposal.ProposalMarkdownRenderer;
import com.proposalpilot.orchestrator.service.PipelineCoordinator;
import com.proposalpilot.orchestrator.service.RunResult;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for pipeline runs.
 *
 * POST   /runs                  submit a proposal run
 * GET    /runs/{id}             poll the run's status
 * GET    /runs/{id}/tasks       list the four agent tasks
 * GET    /runs/{id}/result      the proposal (or why there is none)
 * GET    /runs/{id}/proposal.md the proposal as a Markdown download
 * DELETE /runs/{id}             cancel the run
 */
@RestController
@RequestMapping("/runs")
public class RunController {

    static final MediaType TEXT_MARKDOWN = new MediaType("text", "markdown", StandardCharsets.UTF_8);

    private final PipelineCoordinator coordinator;

    public RunController(PipelineCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    /**
     * Submit a new run.
     *
     * Example:
     *   curl -X POST http://localhost:8080/runs \
     *     -H "Content-Type: application/json" \
     *     -d '{"companyName":"Acme Logistics","industry":"supply-chain"}'
     */
    @PostMapping
    public ResponseEntity<RunResponse> submit(@RequestBody SubmitRunRequest req) {
        try {
            RunSnapshot run = coordinator.submit(req.companyName(), req.industry());
            return ResponseEntity.status(HttpStatus.CREATED).body(RunResponse.from(run));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
    }

    @GetMapping("/{id}")
    public RunResponse getRun(@PathVariable UUID id) {
        return RunResponse.from(find(id));
    }

    @GetMapping("/{id}/tasks")
    public List<TaskResponse> getTasks(@PathVariable UUID id) {
        return find(id).tasks().stream()
                .map(TaskResponse::from)
                .toList();
    }

    /**
     * HTTP 200 with the document when the run is COMPLETED or PARTIALLY_FAILED
     * HTTP 202 while the run is still PENDING or RUNNING
     * HTTP 200 with status and reason when the run FAILED or was CANCELLED
     * HTTP 404 when the run is unknown
     */
    @GetMapping("/{id}/result")
    public ResponseEntity<?> getResult(@PathVariable UUID id) {
        RunResult result = coordinator.result(id).orElseThrow(() -> notFound(id));

        if (result instanceof RunResult.Ready ready) {
            return ResponseEntity.ok(ProposalResponse.ready(ready.document(), ready.run()));
        }
        if (result instanceof RunResult.NotReady notReady) {
            return ResponseEntity.accepted()
                    .body(Map.of("runId", id.toString(), "status", notReady.status().name()));
        }
        if (result instanceof RunResult.Failed failed) {
            return ResponseEntity.ok(ProposalResponse.ended(id, RunStatus.FAILED, failed.failure(), failed.reason()));
        }
        RunResult.Cancelled cancelled = (RunResult.Cancelled) result;
        return ResponseEntity.ok(ProposalResponse.ended(id, RunStatus.CANCELLED, null, cancelled.reason()));
    }

    /**
     * Download the proposal as Markdown, named after the company and the
     * completion time. HTTP 409 when the run has no document (yet).
     */
    @GetMapping("/{id}/proposal.md")
    public ResponseEntity<String> getMarkdown(@PathVariable UUID id) {
        RunSnapshot run = find(id);
        if (!run.status().hasDocument()) {
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "Run " + id + " has no proposal (status " + run.status() + ")");
        }
        ProposalDocument doc = run.document();
        String fileName = ProposalMarkdownRenderer.fileName(doc, run.completedAt());
        return ResponseEntity.ok()
                .contentType(TEXT_MARKDOWN)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(fileName).build().toString())
                .body(ProposalMarkdownRenderer.render(doc));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<RunResponse> cancel(@PathVariable UUID id) {
        RunSnapshot run = coordinator.cancel(id).orElseThrow(() -> notFound(id));
        return ResponseEntity.accepted().body(RunResponse.from(run));
    }

    private RunSnapshot find(UUID id) {
        return coordinator.status(id).orElseThrow(() -> notFound(id));
    }

    private static ResponseStatusException notFound(UUID id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found: " + id);
    }
}
