package com.graphmem.core.service.simulation;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a simulation job.
 *
 * queued -> running -> {completed, failed, cancelled}. A queued job may also be
 * cancelled, or failed when it cannot be scheduled.
 */
public enum SimulationStatus {

    QUEUED("queued"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String value;

    SimulationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(SimulationStatus next) {
        return switch (this) {
            case QUEUED -> next == RUNNING || next == FAILED || next == CANCELLED;
            case RUNNING -> next == COMPLETED || next == FAILED || next == CANCELLED;
            default -> false;
        };
    }
}
