package com.graphmem.core.service.api.dto;

import com.graphmem.core.service.simulation.SimulationStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO returned when a simulation has been accepted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimulationStartResponse {

    private String jobId;

    private SimulationStatus status;
}
