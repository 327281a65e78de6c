package com.graphmem.core.service.api.controller;

import com.graphmem.core.service.api.dto.ApiResponse;
import com.graphmem.core.service.api.dto.SimulationCommitRequest;
import com.graphmem.core.service.api.dto.SimulationRunRequest;
import com.graphmem.core.service.api.dto.SimulationStartResponse;
import com.graphmem.core.service.simulation.CommitResult;
import com.graphmem.core.service.simulation.SimulationJobCoordinator;
import com.graphmem.core.service.simulation.SimulationJobSnapshot;
import com.graphmem.core.service.simulation.SimulationParticipant;
import com.graphmem.core.service.simulation.SimulationStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Controller for simulation jobs.
 * Submission returns immediately; progress is observed by polling.
 */
@Slf4j
@RestController
@Tag(name = "Simulation", description = "Asynchronous multi-agent dialogue jobs")
@RequiredArgsConstructor
public class SimulationController {

    private final SimulationJobCoordinator coordinator;

    @PostMapping("/simulation/run")
    @Operation(summary = "Start a simulation", description = "Queues a dialogue job and returns its id")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Job accepted"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid participants or turn limit")
    })
    public ResponseEntity<ApiResponse<SimulationStartResponse>> submit(@Valid @RequestBody SimulationRunRequest request) {
        List<SimulationParticipant> participants = request.getParticipants().stream()
                .map(p -> new SimulationParticipant(p.getRole(), p.getPersona()))
                .toList();

        String jobId = coordinator.submit(participants, request.getTurnLimit(), request.getSeedContext());

        var response = SimulationStartResponse.builder()
                .jobId(jobId)
                .status(SimulationStatus.QUEUED)
                .build();
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.success(response));
    }

    @GetMapping("/simulation/run")
    @Operation(summary = "List simulations", description = "Returns snapshots of all retained jobs")
    public ResponseEntity<ApiResponse<List<SimulationJobSnapshot>>> list() {
        return ResponseEntity.ok(ApiResponse.success(coordinator.list()));
    }

    @GetMapping("/simulation/run/{jobId}")
    @Operation(summary = "Poll a simulation", description = "Returns status, progress so far and the latest graph delta")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Job found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Job not found")
    })
    public ResponseEntity<ApiResponse<SimulationJobSnapshot>> status(
            @Parameter(description = "Job ID") @PathVariable String jobId) {
        return ResponseEntity.ok(ApiResponse.success(coordinator.status(jobId)));
    }

    @PostMapping("/simulation/run/{jobId}/cancel")
    @Operation(summary = "Cancel a simulation", description = "Stops a queued or running job; no-op on finished jobs")
    public ResponseEntity<ApiResponse<SimulationJobSnapshot>> cancel(
            @Parameter(description = "Job ID") @PathVariable String jobId) {
        return ResponseEntity.ok(ApiResponse.success(coordinator.cancel(jobId)));
    }

    @DeleteMapping("/simulation/run/{jobId}")
    @Operation(summary = "Discard a simulation", description = "Removes a job, cancelling it first if still active")
    public ResponseEntity<Void> discard(@Parameter(description = "Job ID") @PathVariable String jobId) {
        coordinator.discard(jobId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/simulation/commit")
    @Operation(summary = "Commit a simulation",
               description = "Applies the proposed graph delta of a completed job to a session")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Delta applied"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Job not completed or already committed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Graph store unavailable")
    })
    public ResponseEntity<ApiResponse<CommitResult>> commit(@Valid @RequestBody SimulationCommitRequest request) {
        CommitResult result = coordinator.commit(request.getJobId(), request.getTargetSessionId(), request.getNote());
        return ResponseEntity.ok(ApiResponse.success(result));
    }
}
