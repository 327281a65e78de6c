package com.graphmem.core.service.simulation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.graphmem.core.service.model.GraphDelta;

import java.time.Instant;

/**
 * One completed turn of a simulation. {@code delta} is the dialogue so far
 * as a graph delta, present when snapshots are enabled.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressRecord(int turnIndex, String speaker, String content, Instant timestamp, GraphDelta delta) {
}
