package com.flamingo.ai.notebook.service.chat;

import com.flamingo.ai.notebook.domain.entity.ChatMessage;
import com.flamingo.ai.notebook.domain.entity.ChatSession;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/** Chat sessions grounded in notebook content. */
public interface ChatOrchestrator {

  /**
   * Creates a session in the notebook.
   *
   * @param title optional; a dated default title is used when blank
   */
  ChatSession createSession(UUID notebookId, String title);

  /** Sessions of a notebook, most recently active first. */
  List<ChatSession> listSessions(UUID notebookId);

  ChatSession getSession(UUID sessionId);

  ChatSession renameSession(UUID sessionId, String title);

  /** Cancels any reply being generated, then deletes the session and its messages. */
  void deleteSession(UUID sessionId);

  /** Messages of a session in conversation order. */
  List<ChatMessage> listMessages(UUID sessionId);

  /**
   * Stores the user message, generates a reply grounded in the notebook and stores it directly
   * after the user message.
   *
   * <p>If generation fails the user message stays stored with its reply error recorded, and a
   * {@link com.flamingo.ai.notebook.exception.GenerationFailedException} carrying its id is thrown.
   */
  ChatExchange postMessage(UUID sessionId, String content);

  /** Same as {@link #postMessage(UUID, String)} with an explicit assistant timeout. */
  ChatExchange postMessage(UUID sessionId, String content, Duration timeout);

  /** Generates the missing reply of a user message whose earlier reply failed. */
  ChatExchange retryReply(UUID sessionId, UUID userMessageId);
}
