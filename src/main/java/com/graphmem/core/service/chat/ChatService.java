package com.graphmem.core.service.chat;

import com.graphmem.core.service.generation.PromptTemplates;
import com.graphmem.core.service.generation.TextCompletionClient;
import com.graphmem.core.service.memory.GraphMemoryService;
import com.graphmem.core.service.model.ShortTermMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Live chat: records the inbound message, asks the text-completion
 * collaborator for a reply built from the session history and records the
 * reply as an assistant message.
 *
 * Keeps working while the graph store is down; the result is then flagged
 * as degraded. A failed reply generation propagates, the inbound message
 * stays recorded.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatService {

    static final String ASSISTANT_ROLE = "assistant";

    private final GraphMemoryService memoryService;
    private final TextCompletionClient completionClient;

    public ChatResult chat(String sessionId, String role, String content) {
        ShortTermMessage inbound = memoryService.recordMessage(sessionId, role, content);

        List<ShortTermMessage> history = memoryService.history(sessionId);
        String replyText = completionClient.complete(PromptTemplates.chatReply(history)).strip();
        ShortTermMessage reply = memoryService.recordMessage(sessionId, ASSISTANT_ROLE, replyText);

        List<ShortTermMessage> shortTerm = memoryService.history(sessionId);
        boolean degraded = inbound.degraded() || reply.degraded() || !memoryService.health().storeReachable();
        if (degraded) {
            log.warn("Chat turn for session {} served from the fallback cache", sessionId);
        }
        log.debug("Chat turn for session {}: {} messages in short-term memory", sessionId, shortTerm.size());
        return new ChatResult(inbound, reply, shortTerm, degraded);
    }
}
