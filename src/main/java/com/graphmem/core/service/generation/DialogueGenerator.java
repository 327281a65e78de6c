package com.graphmem.core.service.generation;

/**
 * Produces the next utterance of a simulated dialogue.
 */
public interface DialogueGenerator {

    GeneratedTurn nextTurn(DialogueContext context);
}
