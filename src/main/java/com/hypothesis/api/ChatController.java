package com.hypothesis.api;

import com.hypothesis.agent.ConversationOrchestrator;
import com.hypothesis.agent.TurnResponse;
import com.hypothesis.core.Session;
import com.hypothesis.service.SessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * REST controller for the chat API. One request is one turn.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/chat")
@RequiredArgsConstructor
public class ChatController {

    private final ConversationOrchestrator orchestrator;
    private final SessionService sessionService;

    /**
     * Send a message.
     *
     * POST /api/v1/chat
     *
     * Omit sessionId to start a new session; the response carries the id to use for follow-ups.
     */
    @PostMapping
    public ResponseEntity<ChatResponse> chat(@RequestBody ChatRequest request) {
        if (request.getMessage() == null || request.getMessage().isBlank()) {
            return ResponseEntity.badRequest()
                .body(ChatResponse.error("Message is required"));
        }

        try {
            TurnResponse turn = orchestrator.handleTurn(request.getSessionId(), request.getMessage().trim());
            return ResponseEntity.ok(ChatResponse.from(turn));

        } catch (Exception e) {
            log.error("Chat failed", e);
            return ResponseEntity.internalServerError()
                .body(ChatResponse.error("Internal error: " + e.getMessage()));
        }
    }

    /**
     * Get session history.
     *
     * GET /api/v1/chat/{id}/history
     */
    @GetMapping("/{sessionId}/history")
    public ResponseEntity<ConversationHistory> getHistory(@PathVariable String sessionId) {
        Optional<Session> session = sessionService.find(sessionId);
        if (session.isEmpty()) {
            return ResponseEntity.notFound().build();
        }

        List<ConversationHistory.Message> messages = session.get().getTurns().stream()
            .map(turn -> ConversationHistory.Message.builder()
                .role(turn.speaker().getRole())
                .content(turn.text())
                .mode(turn.mode() != null ? turn.mode().getLabel() : null)
                .timestamp(turn.timestamp().toString())
                .objective(turn.isResearch() ? turn.plan().objective() : null)
                .build())
            .collect(Collectors.toList());

        return ResponseEntity.ok(ConversationHistory.builder()
            .sessionId(sessionId)
            .mode(session.get().getMode().getLabel())
            .messages(messages)
            .build());
    }

    /**
     * Clear session history and failure counters.
     *
     * DELETE /api/v1/chat/{id}/history
     */
    @DeleteMapping("/{sessionId}/history")
    public ResponseEntity<Void> clearHistory(@PathVariable String sessionId) {
        return orchestrator.clearSession(sessionId)
            ? ResponseEntity.noContent().build()
            : ResponseEntity.notFound().build();
    }

    /**
     * Abandon the in-flight research turn before its next step.
     *
     * POST /api/v1/chat/{id}/abandon
     */
    @PostMapping("/{sessionId}/abandon")
    public ResponseEntity<Void> abandon(@PathVariable String sessionId) {
        return orchestrator.abandonTurn(sessionId)
            ? ResponseEntity.accepted().build()
            : ResponseEntity.notFound().build();
    }

    /**
     * End a session.
     *
     * DELETE /api/v1/chat/{id}
     */
    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> deleteSession(@PathVariable String sessionId) {
        return sessionService.remove(sessionId)
            ? ResponseEntity.noContent().build()
            : ResponseEntity.notFound().build();
    }
}
