package com.flamingo.ai.notebook.exception;

import java.util.UUID;

/**
 * Raised when two messages claim the same order slot in a session. Signals a serialization bug and
 * is recovered from inside the chat orchestrator; it is never returned to callers.
 */
public class SessionOrderConflictException extends RuntimeException {

  private final UUID sessionId;
  private final long messageOrder;

  public SessionOrderConflictException(UUID sessionId, long messageOrder, Throwable cause) {
    super("Order " + messageOrder + " already taken in session " + sessionId, cause);
    this.sessionId = sessionId;
    this.messageOrder = messageOrder;
  }

  public UUID getSessionId() {
    return sessionId;
  }

  public long getMessageOrder() {
    return messageOrder;
  }
}
