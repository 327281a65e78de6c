package com.graphmem.core.service.api.controller;

import com.graphmem.core.service.api.dto.ApiResponse;
import com.graphmem.core.service.memory.GraphMemoryService;
import com.graphmem.core.service.model.GraphView;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Controller for the memory graph view and reset.
 */
@Slf4j
@RestController
@Tag(name = "Graph", description = "Export and reset of the memory graph")
@RequiredArgsConstructor
public class GraphController {

    private final GraphMemoryService memoryService;

    @GetMapping("/graph")
    @Operation(summary = "Export graph",
               description = "Returns nodes and edges, including messages still held by the fallback cache")
    public ResponseEntity<ApiResponse<GraphView>> exportGraph(
            @Parameter(description = "Limit the view to one session")
            @RequestParam(required = false) String sessionId) {
        GraphView view = memoryService.exportGraph(sessionId);
        log.debug("Exported {} nodes and {} edges", view.nodes().size(), view.edges().size());
        return ResponseEntity.ok(ApiResponse.success(view));
    }

    @DeleteMapping("/graph")
    @Operation(summary = "Reset graph", description = "Irreversibly deletes all persisted and cached memory")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "204", description = "Graph reset"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Confirmation missing"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Graph store unavailable")
    })
    public ResponseEntity<Void> resetGraph(
            @Parameter(description = "Must be true to confirm the reset")
            @RequestParam(defaultValue = "false") boolean confirm) {
        if (!confirm) {
            throw new IllegalArgumentException("Graph reset requires confirm=true");
        }
        memoryService.reset();
        return ResponseEntity.noContent().build();
    }
}
