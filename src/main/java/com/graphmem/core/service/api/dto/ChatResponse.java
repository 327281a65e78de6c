package com.graphmem.core.service.api.dto;

import com.graphmem.core.service.model.ShortTermMessage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * DTO for a completed chat turn.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponse {

    private String sessionId;

    private String reply;

    private ShortTermMessage message;

    private ShortTermMessage replyMessage;

    /**
     * Live short-term memory of the session after the turn.
     */
    private List<ShortTermMessage> shortTerm;

    /**
     * True when the turn was served from the fallback cache.
     */
    private boolean degraded;
}
