package com.graphmem.core.service.api.controller;

import com.graphmem.core.service.api.dto.ApiResponse;
import com.graphmem.core.service.api.dto.ChatRequest;
import com.graphmem.core.service.api.dto.ChatResponse;
import com.graphmem.core.service.chat.ChatResult;
import com.graphmem.core.service.chat.ChatService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Controller for live chat turns.
 */
@Slf4j
@RestController
@Tag(name = "Chat", description = "Live conversation recorded into short-term memory")
@RequiredArgsConstructor
public class ChatController {

    private final ChatService chatService;

    @PostMapping("/chat")
    @Operation(summary = "Send a chat message",
               description = "Records the message, generates a reply and records it as an assistant message")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Reply generated"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid request"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "502", description = "Reply generation failed")
    })
    public ResponseEntity<ApiResponse<ChatResponse>> chat(@Valid @RequestBody ChatRequest request) {
        log.debug("Chat turn for session {} from {}", request.getSessionId(), request.getRole());

        ChatResult result = chatService.chat(request.getSessionId(), request.getRole(), request.getContent());

        var response = ChatResponse.builder()
                .sessionId(request.getSessionId())
                .reply(result.reply().content())
                .message(result.message())
                .replyMessage(result.reply())
                .shortTerm(result.shortTerm())
                .degraded(result.degraded())
                .build();
        return ResponseEntity.ok(ApiResponse.success(response));
    }
}
