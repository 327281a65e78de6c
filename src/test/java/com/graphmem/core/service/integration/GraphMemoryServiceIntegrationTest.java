package com.graphmem.core.service.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.graphmem.core.service.api.dto.ChatRequest;
import com.graphmem.core.service.api.dto.ConsolidateRequest;
import com.graphmem.core.service.api.dto.SimulationCommitRequest;
import com.graphmem.core.service.api.dto.SimulationRunRequest;
import com.graphmem.core.service.support.ScriptedCompletionConfig;
import org.junit.jupiter.api.*;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * End-to-end flow over the HTTP API with the in-memory graph store:
 * chat, consolidation, a simulated dialogue and its commit.
 */
@SpringBootTest
@AutoConfigureMockMvc
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
@ActiveProfiles("test")
@Import(ScriptedCompletionConfig.class)
class GraphMemoryServiceIntegrationTest {

    private static final String SESSION_ID = "integration-" + UUID.randomUUID();

    private static String knowledgeId;
    private static String jobId;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    // ==================== Live Chat ====================

    @Test
    @Order(1)
    @DisplayName("1. Two chat turns build a four message chain")
    void step1_chat() throws Exception {
        chat("What is a knowledge graph?");
        JsonNode data = chat("And short-term memory?");

        assertThat(data.path("shortTerm").size()).isEqualTo(4);
        assertThat(data.path("degraded").asBoolean()).isFalse();

        JsonNode history = readData(mockMvc.perform(get("/memory/" + SESSION_ID))
                .andExpect(status().isOk())
                .andReturn());
        List<String> roles = new ArrayList<>();
        history.forEach(message -> roles.add(message.path("role").asText()));
        assertThat(roles).containsExactly("user", "assistant", "user", "assistant");
        assertThat(history.get(3).path("sequence").asLong()).isEqualTo(3);
    }

    // ==================== Consolidation ====================

    @Test
    @Order(2)
    @DisplayName("2. Consolidation links every live message to one knowledge node")
    void step2_consolidate() throws Exception {
        var request = ConsolidateRequest.builder().sessionId(SESSION_ID).note("first review").build();

        JsonNode knowledge = readData(mockMvc.perform(post("/memory/consolidate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.summary").value(ScriptedCompletionConfig.SUMMARY))
                .andExpect(jsonPath("$.data.note").value("first review"))
                .andReturn());

        knowledgeId = knowledge.path("id").asText();
        assertThat(knowledge.path("sourceMessageIds").size()).isEqualTo(4);
    }

    @Test
    @Order(3)
    @DisplayName("3. Graph export shows session, messages and knowledge")
    void step3_exportGraph() throws Exception {
        JsonNode graph = readData(mockMvc.perform(get("/graph").param("sessionId", SESSION_ID))
                .andExpect(status().isOk())
                .andReturn());

        assertThat(countByField(graph.path("nodes"), "label", "ShortTermMessage")).isEqualTo(4);
        assertThat(countByField(graph.path("nodes"), "label", "Knowledge")).isEqualTo(1);
        assertThat(countByField(graph.path("edges"), "type", "NEXT")).isEqualTo(3);
        assertThat(countByField(graph.path("edges"), "type", "CONTRIBUTED_TO")).isEqualTo(4);
        assertThat(countByField(graph.path("nodes"), "id", knowledgeId)).isEqualTo(1);
    }

    // ==================== Simulation ====================

    @Test
    @Order(4)
    @DisplayName("4. A simulation runs in the background to its turn limit")
    void step4_runSimulation() throws Exception {
        var request = SimulationRunRequest.builder()
                .participants(List.of(
                        SimulationRunRequest.ParticipantDto.builder().role("Economist").persona("Focus on costs").build(),
                        SimulationRunRequest.ParticipantDto.builder().role("Engineer").build()))
                .turnLimit(3)
                .seedContext("Planning the next release")
                .build();

        JsonNode started = readData(mockMvc.perform(post("/simulation/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.data.status").value("queued"))
                .andReturn());
        jobId = started.path("jobId").asText();

        await().atMost(10, TimeUnit.SECONDS)
                .until(() -> "completed".equals(pollJob().path("status").asText()));

        JsonNode job = pollJob();
        assertThat(job.path("progress").size()).isEqualTo(3);
        assertThat(job.path("progress").get(1).path("speaker").asText()).isEqualTo("Engineer");
        assertThat(job.path("progress").get(2).path("content").asText()).isEqualTo(ScriptedCompletionConfig.DIALOGUE_TURN);
        assertThat(job.path("summary").asText()).isEqualTo(ScriptedCompletionConfig.SUMMARY);
        assertThat(countByField(job.path("proposedDelta").path("nodes"), "label", "ShortTermMessage")).isEqualTo(3);
        assertThat(job.path("committed").asBoolean()).isFalse();
    }

    @Test
    @Order(5)
    @DisplayName("5. Committing the simulation persists it once")
    void step5_commitSimulation() throws Exception {
        var request = SimulationCommitRequest.builder().jobId(jobId).note("approved").build();
        String body = objectMapper.writeValueAsString(request);

        mockMvc.perform(post("/simulation/commit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.sessionId").value("simulation-session-" + jobId))
                .andExpect(jsonPath("$.data.messagesApplied").value(3))
                .andExpect(jsonPath("$.data.nodesCreated").value(5))
                .andExpect(jsonPath("$.data.edgesCreated").value(9));

        mockMvc.perform(post("/simulation/commit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.code").value("ALREADY_COMMITTED"));

        JsonNode history = readData(mockMvc.perform(get("/memory/simulation-session-" + jobId))
                .andExpect(status().isOk())
                .andReturn());
        assertThat(history.size()).isEqualTo(3);
        assertThat(history.get(0).path("role").asText()).isEqualTo("Economist");
    }

    @Test
    @Order(6)
    @DisplayName("6. Jobs can be listed and discarded")
    void step6_listAndDiscard() throws Exception {
        JsonNode jobs = readData(mockMvc.perform(get("/simulation/run"))
                .andExpect(status().isOk())
                .andReturn());
        assertThat(countByField(jobs, "jobId", jobId)).isEqualTo(1);

        mockMvc.perform(delete("/simulation/run/" + jobId))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/simulation/run/" + jobId))
                .andExpect(status().isNotFound());
    }

    // ==================== Reset ====================

    @Test
    @Order(7)
    @DisplayName("7. A confirmed reset empties the graph")
    void step7_reset() throws Exception {
        mockMvc.perform(delete("/graph").param("confirm", "true"))
                .andExpect(status().isNoContent());

        JsonNode graph = readData(mockMvc.perform(get("/graph").param("sessionId", SESSION_ID))
                .andExpect(status().isOk())
                .andReturn());
        assertThat(graph.path("nodes").size()).isZero();
        assertThat(graph.path("edges").size()).isZero();
    }

    // ==================== Helper Methods ====================

    private JsonNode chat(String content) throws Exception {
        var request = ChatRequest.builder().sessionId(SESSION_ID).content(content).build();
        return readData(mockMvc.perform(post("/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.reply").value(ScriptedCompletionConfig.CHAT_REPLY))
                .andReturn());
    }

    private JsonNode pollJob() throws Exception {
        return readData(mockMvc.perform(get("/simulation/run/" + jobId))
                .andExpect(status().isOk())
                .andReturn());
    }

    private JsonNode readData(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString()).path("data");
    }

    private static long countByField(JsonNode array, String field, String value) {
        long count = 0;
        for (JsonNode element : array) {
            if (value.equals(element.path(field).asText())) {
                count++;
            }
        }
        return count;
    }
}
