package com.proposalpilot.orchestrator.artifact;

/**
 * Sections of the proposal, in document order.
 * The declaration order is the rendering order and must not change.
 */
public enum SectionKind {
    SUMMARY("summary",         "Company & Industry Summary"),
    TRENDS("trends",           "Market Trends"),
    USE_CASES("use_cases",     "AI/ML Use Cases"),
    FEASIBILITY("feasibility", "Feasibility Notes"),
    RESOURCES("resources",     "Linked Resources");

    private final String id;
    private final String title;

    SectionKind(String id, String title) {
        this.id    = id;
        this.title = title;
    }

    public String id()    { return id; }
    public String title() { return title; }
}
