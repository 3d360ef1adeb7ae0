package com.purchasingpower.codegraph.orchestration;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OutcomeStatus {
    RUNNING,
    DONE,
    FAILED,
    SKIPPED;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase();
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
