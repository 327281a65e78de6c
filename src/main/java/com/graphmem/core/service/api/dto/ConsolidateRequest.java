package com.graphmem.core.service.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for an operator-triggered consolidation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConsolidateRequest {

    @NotBlank(message = "sessionId is required")
    @JsonAlias("session")
    private String sessionId;

    /**
     * Optional operator note stored on the knowledge node.
     */
    private String note;
}
