package com.graphmem.core.service.simulation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.graphmem.core.service.model.GraphDelta;

import java.time.Instant;
import java.util.List;

/**
 * Immutable, consistent view of a simulation job handed to pollers.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SimulationJobSnapshot(
        String jobId,
        SimulationStatus status,
        List<SimulationParticipant> participants,
        int turnLimit,
        String seedContext,
        List<ProgressRecord> progress,
        GraphDelta latestDelta,
        GraphDelta proposedDelta,
        String summary,
        String error,
        boolean committed,
        String committedSessionId,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt
) {

    public SimulationJobSnapshot {
        participants = List.copyOf(participants);
        progress = List.copyOf(progress);
    }
}
