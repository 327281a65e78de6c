package com.graphmem.core.service.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * DTO for a simulation submission.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimulationRunRequest {

    /**
     * Participants in speaking order; roles must be distinct.
     */
    @NotNull(message = "participants are required")
    @Size(min = 2, message = "at least two participants are required")
    @Valid
    private List<ParticipantDto> participants;

    @Min(value = 1, message = "turnLimit must be at least 1")
    @JsonAlias("turns")
    private int turnLimit;

    /**
     * Optional scenario the dialogue starts from.
     */
    @JsonAlias("context")
    private String seedContext;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ParticipantDto {

        @NotBlank(message = "participant role is required")
        private String role;

        private String persona;
    }
}
