package com.proposalpilot.orchestrator.api.dto;

/**
 * Request body for POST /runs. Both fields are required and must not be blank.
 */
public record SubmitRunRequest(String companyName, String industry) {}
