package com.graphmem.core.service.model;

import java.time.Instant;

/**
 * One utterance of a dialogue that has not been persisted yet.
 */
public record DialogueLine(String role, String content, Instant timestamp) implements ConversationLine {
}
