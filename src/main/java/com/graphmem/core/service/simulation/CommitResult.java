package com.graphmem.core.service.simulation;

/**
 * Summary of a committed simulation delta.
 */
public record CommitResult(
        String jobId,
        String sessionId,
        String knowledgeId,
        int messagesApplied,
        int nodesCreated,
        int edgesCreated
) {
}
