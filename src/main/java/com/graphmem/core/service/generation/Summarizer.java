package com.graphmem.core.service.generation;

import com.graphmem.core.service.model.ConversationLine;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Condenses a conversation into knowledge text.
 */
@Component
@RequiredArgsConstructor
public class Summarizer {

    private final TextCompletionClient completionClient;

    public String summarize(List<? extends ConversationLine> lines) {
        return completionClient.complete(PromptTemplates.summary(lines)).strip();
    }
}
