package com.astrocatalog.model;

public enum SessionStatus {
    MISSING("Missing"),
    PARTIAL("Partial"),
    COMPLETE("Complete"),
    COMPLETE_WITH_MASTERS("Complete (Masters)");

    private final String label;

    SessionStatus(String label) {
        this.label = label;
    }

    public String label() { return label; }

    public boolean isComplete() {
        return this == COMPLETE || this == COMPLETE_WITH_MASTERS;
    }
}
