package com.graphmem.core.service.generation;

import com.graphmem.core.service.config.GeneratorConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Dialogue generator backed by the text-completion client.
 *
 * A reply ending with the configured stop marker finishes the dialogue;
 * the marker is stripped from the recorded content.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PromptDialogueGenerator implements DialogueGenerator {

    private final TextCompletionClient completionClient;
    private final GeneratorConfig generatorConfig;

    @Override
    public GeneratedTurn nextTurn(DialogueContext context) {
        String marker = generatorConfig.getStopMarker();
        String reply = completionClient.complete(PromptTemplates.dialogueTurn(context, marker)).strip();

        if (marker != null && !marker.isEmpty() && reply.endsWith(marker)) {
            log.debug("Participant {} ended the dialogue", context.speaker().role());
            return new GeneratedTurn(reply.substring(0, reply.length() - marker.length()).strip(), true);
        }
        return new GeneratedTurn(reply, false);
    }
}
