package com.graphmem.core.service.chat;

import com.graphmem.core.service.model.ShortTermMessage;

import java.util.List;

/**
 * Outcome of one chat turn: the recorded inbound message, the recorded reply
 * and the session's short-term memory after both.
 */
public record ChatResult(
        ShortTermMessage message,
        ShortTermMessage reply,
        List<ShortTermMessage> shortTerm,
        boolean degraded
) {

    public ChatResult {
        shortTerm = List.copyOf(shortTerm);
    }
}
