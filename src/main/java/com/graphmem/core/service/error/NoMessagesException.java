package com.graphmem.core.service.error;

/**
 * Thrown when consolidation is requested for a session without live messages.
 */
public class NoMessagesException extends MemoryServiceException {

    public static final String CODE = "NO_MESSAGES";

    public NoMessagesException(String sessionId) {
        super("No live short-term messages for session " + sessionId, sessionId, CODE);
    }
}
