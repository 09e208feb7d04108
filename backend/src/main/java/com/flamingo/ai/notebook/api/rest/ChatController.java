package com.flamingo.ai.notebook.api.rest;

import com.flamingo.ai.notebook.api.dto.request.ChatRequest;
import com.flamingo.ai.notebook.api.dto.request.CreateChatSessionRequest;
import com.flamingo.ai.notebook.api.dto.request.UpdateChatSessionRequest;
import com.flamingo.ai.notebook.api.dto.response.ChatExchangeResponse;
import com.flamingo.ai.notebook.api.dto.response.ChatMessageResponse;
import com.flamingo.ai.notebook.api.dto.response.ChatSessionResponse;
import com.flamingo.ai.notebook.domain.entity.ChatSession;
import com.flamingo.ai.notebook.domain.repository.ChatMessageRepository;
import com.flamingo.ai.notebook.service.chat.ChatOrchestrator;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for chat sessions and messages. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ChatController {

  private final ChatOrchestrator chatOrchestrator;
  private final ChatMessageRepository chatMessageRepository;

  /** Creates a chat session in a notebook. */
  @PostMapping("/notebooks/{notebookId}/chats")
  public ResponseEntity<ChatSessionResponse> createSession(
      @PathVariable UUID notebookId,
      @Valid @RequestBody(required = false) CreateChatSessionRequest request) {
    String title = request != null ? request.getTitle() : null;
    ChatSession session = chatOrchestrator.createSession(notebookId, title);
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(ChatSessionResponse.fromEntity(session, 0));
  }

  /** Lists the chat sessions of a notebook. */
  @GetMapping("/notebooks/{notebookId}/chats")
  public ResponseEntity<List<ChatSessionResponse>> listSessions(@PathVariable UUID notebookId) {
    return ResponseEntity.ok(
        chatOrchestrator.listSessions(notebookId).stream().map(this::toResponse).toList());
  }

  @GetMapping("/chats/{sessionId}")
  public ResponseEntity<ChatSessionResponse> getSession(@PathVariable UUID sessionId) {
    return ResponseEntity.ok(toResponse(chatOrchestrator.getSession(sessionId)));
  }

  @PutMapping("/chats/{sessionId}")
  public ResponseEntity<ChatSessionResponse> renameSession(
      @PathVariable UUID sessionId, @Valid @RequestBody UpdateChatSessionRequest request) {
    return ResponseEntity.ok(
        toResponse(chatOrchestrator.renameSession(sessionId, request.getTitle())));
  }

  @DeleteMapping("/chats/{sessionId}")
  public ResponseEntity<Void> deleteSession(@PathVariable UUID sessionId) {
    chatOrchestrator.deleteSession(sessionId);
    return ResponseEntity.noContent().build();
  }

  /** Gets the messages of a session in conversation order. */
  @GetMapping("/chats/{sessionId}/messages")
  public ResponseEntity<List<ChatMessageResponse>> listMessages(@PathVariable UUID sessionId) {
    return ResponseEntity.ok(
        chatOrchestrator.listMessages(sessionId).stream()
            .map(ChatMessageResponse::fromEntity)
            .toList());
  }

  /** Posts a message and returns it together with the assistant reply. */
  @PostMapping("/chats/{sessionId}/messages")
  public ResponseEntity<ChatExchangeResponse> postMessage(
      @PathVariable UUID sessionId, @Valid @RequestBody ChatRequest request) {
    return ResponseEntity.ok(
        ChatExchangeResponse.from(chatOrchestrator.postMessage(sessionId, request.getMessage())));
  }

  /** Generates the reply of a user message whose earlier reply failed. */
  @PostMapping("/chats/{sessionId}/messages/{messageId}/retry")
  public ResponseEntity<ChatExchangeResponse> retryReply(
      @PathVariable UUID sessionId, @PathVariable UUID messageId) {
    return ResponseEntity.ok(
        ChatExchangeResponse.from(chatOrchestrator.retryReply(sessionId, messageId)));
  }

  private ChatSessionResponse toResponse(ChatSession session) {
    return ChatSessionResponse.fromEntity(
        session, chatMessageRepository.countBySessionId(session.getId()));
  }
}
