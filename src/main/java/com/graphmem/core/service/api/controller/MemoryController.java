package com.graphmem.core.service.api.controller;

import com.graphmem.core.service.api.dto.ApiResponse;
import com.graphmem.core.service.api.dto.ConsolidateRequest;
import com.graphmem.core.service.memory.GraphMemoryService;
import com.graphmem.core.service.model.Knowledge;
import com.graphmem.core.service.model.MemoryHealth;
import com.graphmem.core.service.model.ShortTermMessage;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Controller for short-term memory and consolidation.
 */
@Slf4j
@RestController
@Tag(name = "Memory", description = "Short-term memory, consolidation and store health")
@RequiredArgsConstructor
public class MemoryController {

    private final GraphMemoryService memoryService;

    @PostMapping("/memory/consolidate")
    @Operation(summary = "Consolidate a session",
               description = "Summarizes the live short-term messages of a session into a knowledge node")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Knowledge created"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "No live messages"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Graph store unavailable")
    })
    public ResponseEntity<ApiResponse<Knowledge>> consolidate(@Valid @RequestBody ConsolidateRequest request) {
        log.debug("Consolidation requested for session {}", request.getSessionId());

        Knowledge knowledge = memoryService.consolidate(request.getSessionId(), request.getNote());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(knowledge));
    }

    @GetMapping("/memory/health")
    @Operation(summary = "Memory health", description = "Reports store reachability and fallback cache usage")
    public ResponseEntity<ApiResponse<MemoryHealth>> health() {
        return ResponseEntity.ok(ApiResponse.success(memoryService.health()));
    }

    @GetMapping("/memory/{sessionId}")
    @Operation(summary = "Short-term history", description = "Returns the live messages of a session in chain order")
    public ResponseEntity<ApiResponse<List<ShortTermMessage>>> history(
            @Parameter(description = "Session ID") @PathVariable String sessionId) {
        var messages = memoryService.history(sessionId);
        log.debug("Returning {} live messages for session {}", messages.size(), sessionId);
        return ResponseEntity.ok(ApiResponse.success(messages));
    }
}
