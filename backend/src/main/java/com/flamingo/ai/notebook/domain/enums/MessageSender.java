package com.flamingo.ai.notebook.domain.enums;

/** Defines who authored a chat message. */
public enum MessageSender {
  /** Message from the user. */
  USER,

  /** Message from the AI assistant. */
  ASSISTANT
}
