package com.graphmem.core.service.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for committing a completed simulation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimulationCommitRequest {

    @NotBlank(message = "jobId is required")
    private String jobId;

    /**
     * Session receiving the dialogue; defaults to simulation-&lt;jobId&gt;.
     */
    private String targetSessionId;

    private String note;
}
