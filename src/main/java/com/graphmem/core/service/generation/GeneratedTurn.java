package com.graphmem.core.service.generation;

/**
 * Output of a dialogue turn. {@code finished} signals natural completion of the dialogue.
 */
public record GeneratedTurn(String content, boolean finished) {
}
