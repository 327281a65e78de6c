package com.graphmem.core.service.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.graphmem.core.service.api.dto.ChatRequest;
import com.graphmem.core.service.api.dto.ConsolidateRequest;
import com.graphmem.core.service.api.dto.SimulationCommitRequest;
import com.graphmem.core.service.api.dto.SimulationRunRequest;
import com.graphmem.core.service.support.ScriptedCompletionConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItems;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Smoke tests for the Graph Memory Service endpoints.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(ScriptedCompletionConfig.class)
class GraphMemoryServiceSmokeTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void contextLoads() {
        // Context loads successfully
    }

    @Test
    void healthEndpointReportsStore() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.graphStore.details.storeReachable").value(true));
    }

    @Test
    void swaggerUiAvailable() throws Exception {
        mockMvc.perform(get("/swagger-ui.html"))
                .andExpect(status().is3xxRedirection());
    }

    @Test
    void apiDocsDescribeThisService() throws Exception {
        mockMvc.perform(get("/api-docs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.info.title").value("Graph Memory Service API"))
                .andExpect(jsonPath("$.info.description", containsString("Simulations run up to 50 turns")))
                .andExpect(jsonPath("$.tags[*].name", hasItems("Chat", "Memory", "Graph", "Simulation")));
    }

    @Test
    void memoryHealthReportsReachableStore() throws Exception {
        mockMvc.perform(get("/memory/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.storeReachable").value(true))
                .andExpect(jsonPath("$.data.fallbackActive").value(false));
    }

    @Test
    void chat_validRequest_returnsReplyAndShortTermMemory() throws Exception {
        var request = ChatRequest.builder()
                .sessionId("smoke-chat")
                .content("Hello")
                .build();

        mockMvc.perform(post("/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.reply").value(ScriptedCompletionConfig.CHAT_REPLY))
                .andExpect(jsonPath("$.data.message.role").value("user"))
                .andExpect(jsonPath("$.data.replyMessage.role").value("assistant"))
                .andExpect(jsonPath("$.data.shortTerm.length()").value(2))
                .andExpect(jsonPath("$.data.degraded").value(false));
    }

    @Test
    void chat_acceptsLegacySessionField() throws Exception {
        mockMvc.perform(post("/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"session\":\"smoke-legacy\",\"content\":\"Hi\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.sessionId").value("smoke-legacy"));
    }

    @Test
    void chat_missingSessionId_returns400() throws Exception {
        mockMvc.perform(post("/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"Hello\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void chat_malformedBody_returns400() throws Exception {
        mockMvc.perform(post("/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void consolidate_unknownSession_returns404() throws Exception {
        var request = ConsolidateRequest.builder().sessionId("smoke-empty").build();

        mockMvc.perform(post("/memory/consolidate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NO_MESSAGES"))
                .andExpect(jsonPath("$.error.entityId").value("smoke-empty"));
    }

    @Test
    void history_unknownSession_returnsEmptyList() throws Exception {
        mockMvc.perform(get("/memory/smoke-nobody"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").isArray())
                .andExpect(jsonPath("$.data.length()").value(0));
    }

    @Test
    void simulation_singleParticipant_returns400() throws Exception {
        var request = SimulationRunRequest.builder()
                .participants(List.of(SimulationRunRequest.ParticipantDto.builder().role("Economist").build()))
                .turnLimit(3)
                .build();

        mockMvc.perform(post("/simulation/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void simulation_duplicateRoles_returns400() throws Exception {
        var request = SimulationRunRequest.builder()
                .participants(List.of(
                        SimulationRunRequest.ParticipantDto.builder().role("Economist").build(),
                        SimulationRunRequest.ParticipantDto.builder().role("Economist").build()))
                .turnLimit(3)
                .build();

        mockMvc.perform(post("/simulation/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void simulation_unknownJob_returns404() throws Exception {
        mockMvc.perform(get("/simulation/run/non-existent-job"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
    }

    @Test
    void commit_unknownJob_returns404() throws Exception {
        var request = SimulationCommitRequest.builder().jobId("non-existent-job").build();

        mockMvc.perform(post("/simulation/commit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
    }

    @Test
    void resetGraph_withoutConfirmation_returns400() throws Exception {
        mockMvc.perform(delete("/graph"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_ARGUMENT"));
    }
}
