package com.graphmem.core.service.generation;

import com.graphmem.core.service.error.GeneratorException;

/**
 * Text-completion capability consumed by the chat flow, the summarizer and
 * the dialogue generator. Prompt shaping is owned by the callers.
 */
public interface TextCompletionClient {

    /**
     * Completes a prompt.
     *
     * @param prompt the full prompt text
     * @return the generated text
     * @throws GeneratorException on transient or permanent failure
     */
    String complete(String prompt);
}
