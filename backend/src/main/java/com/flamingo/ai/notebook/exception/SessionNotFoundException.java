package com.flamingo.ai.notebook.exception;

import java.util.UUID;

/** Exception thrown when a chat session is not found. */
public class SessionNotFoundException extends ResourceNotFoundException {

  public SessionNotFoundException(UUID sessionId) {
    super("Session", sessionId);
  }

  public UUID getSessionId() {
    return getResourceId();
  }
}
