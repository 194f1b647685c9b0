package com.proposalpilot.orchestrator.artifact;

public enum ResourceType {
    DATASET,
    CODE_REPOSITORY
}
