package com.graphmem.core.service.simulation;

/**
 * One agent of a simulated dialogue: its role name and an optional persona hint.
 */
public record SimulationParticipant(String role, String persona) {
}
