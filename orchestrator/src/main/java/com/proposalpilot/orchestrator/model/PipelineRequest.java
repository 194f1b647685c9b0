package com.proposalpilot.orchestrator.model;

/**
 * What the user asked for: a proposal for one company within one industry.
 */
public record PipelineRequest(String companyName, String industry) {

    public PipelineRequest {
        if (companyName == null || companyName.isBlank()) {
            throw new IllegalArgumentException("companyName must not be blank");
        }
        if (industry == null || industry.isBlank()) {
            throw new IllegalArgumentException("industry must not be blank");
        }
        companyName = companyName.strip();
        industry    = industry.strip();
    }
}
