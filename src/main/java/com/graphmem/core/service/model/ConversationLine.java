package com.graphmem.core.service.model;

/**
 * A single speaker/content pair, as rendered into prompts.
 */
public interface ConversationLine {

    String role();

    String content();
}
