package com.graphmem.core.service.simulation;

import com.graphmem.core.service.model.DialogueLine;
import com.graphmem.core.service.model.GraphDelta;
import com.graphmem.core.service.model.GraphEdge;
import com.graphmem.core.service.model.GraphLabels;
import com.graphmem.core.service.model.GraphNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the proposed graph of a simulated dialogue.
 *
 * Node identifiers are derived from the job id so that successive snapshots of
 * the same job describe the same entities.
 */
final class GraphDeltaBuilder {

    private GraphDeltaBuilder() {
    }

    static String sessionNodeId(String jobId) {
        return "simulation-session-" + jobId;
    }

    static String messageNodeId(String jobId, int index) {
        return "simulation-message-" + jobId + "-" + index;
    }

    static String knowledgeNodeId(String jobId) {
        return "simulation-knowledge-" + jobId;
    }

    /**
     * @param summary knowledge text; when null no knowledge node is proposed
     */
    static GraphDelta build(SimulationJob job, List<DialogueLine> transcript, String summary, Instant now) {
        String jobId = job.getId();
        String sessionNodeId = sessionNodeId(jobId);
        List<GraphNode> nodes = new ArrayList<>();
        List<GraphEdge> edges = new ArrayList<>();

        Map<String, Object> session = new LinkedHashMap<>();
        session.put("id", sessionNodeId);
        session.put("jobId", jobId);
        session.put("createdAt", job.getCreatedAt().toEpochMilli());
        session.put("context", job.getSeedContext() != null ? job.getSeedContext() : "");
        session.put("turnLimit", job.getTurnLimit());
        session.put("participants", job.getParticipants().stream().map(SimulationParticipant::role).toList());
        nodes.add(new GraphNode(sessionNodeId, GraphLabels.CHAT_SESSION, session));

        String previous = null;
        List<String> messageIds = new ArrayList<>();
        for (int index = 0; index < transcript.size(); index++) {
            DialogueLine line = transcript.get(index);
            String messageId = messageNodeId(jobId, index);

            Map<String, Object> message = new LinkedHashMap<>();
            message.put("id", messageId);
            message.put("sessionId", sessionNodeId);
            message.put("role", line.role());
            message.put("content", line.content());
            message.put("createdAt", line.timestamp().toEpochMilli());
            message.put("sequence", index);
            nodes.add(new GraphNode(messageId, GraphLabels.SHORT_TERM_MESSAGE, message));

            edges.add(new GraphEdge(sessionNodeId, messageId, GraphLabels.HAS_MESSAGE));
            if (previous != null) {
                edges.add(new GraphEdge(previous, messageId, GraphLabels.NEXT));
            }
            previous = messageId;
            messageIds.add(messageId);
        }

        if (summary != null) {
            String knowledgeId = knowledgeNodeId(jobId);
            Map<String, Object> knowledge = new LinkedHashMap<>();
            knowledge.put("id", knowledgeId);
            knowledge.put("sessionId", sessionNodeId);
            knowledge.put("summary", summary);
            knowledge.put("createdAt", now.toEpochMilli());
            nodes.add(new GraphNode(knowledgeId, GraphLabels.KNOWLEDGE, knowledge));

            edges.add(new GraphEdge(sessionNodeId, knowledgeId, GraphLabels.YIELDED));
            messageIds.forEach(messageId -> edges.add(new GraphEdge(messageId, knowledgeId, GraphLabels.CONTRIBUTED_TO)));
        }

        return new GraphDelta(nodes, edges);
    }
}
