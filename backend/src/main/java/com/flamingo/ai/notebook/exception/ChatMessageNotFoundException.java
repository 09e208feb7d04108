package com.flamingo.ai.notebook.exception;

import java.util.UUID;

/** Exception thrown when a chat message is not found. */
public class ChatMessageNotFoundException extends ResourceNotFoundException {

  public ChatMessageNotFoundException(UUID id) {
    super("Chat message", id);
  }
}
