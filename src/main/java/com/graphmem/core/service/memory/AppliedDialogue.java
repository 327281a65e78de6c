package com.graphmem.core.service.memory;

import com.graphmem.core.service.model.Knowledge;
import com.graphmem.core.service.model.ShortTermMessage;

import java.util.List;

/**
 * Result of durably applying a dialogue: the messages written and the knowledge derived from them.
 */
public record AppliedDialogue(List<ShortTermMessage> messages, Knowledge knowledge) {

    public AppliedDialogue {
        messages = List.copyOf(messages);
    }
}
