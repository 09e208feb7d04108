package com.flamingo.ai.notebook.exception;

import java.util.UUID;

/** Exception thrown when the assistant capability fails to produce text. */
public class GenerationFailedException extends RuntimeException {

  private final boolean transientFailure;
  private final String reason;
  private final UUID unansweredMessageId;

  public GenerationFailedException(boolean transientFailure, String reason) {
    this(transientFailure, reason, null, null);
  }

  public GenerationFailedException(boolean transientFailure, String reason, Throwable cause) {
    this(transientFailure, reason, null, cause);
  }

  private GenerationFailedException(
      boolean transientFailure, String reason, UUID unansweredMessageId, Throwable cause) {
    super(
        "Generation failed (" + (transientFailure ? "transient" : "permanent") + "): " + reason,
        cause);
    this.transientFailure = transientFailure;
    this.reason = reason;
    this.unansweredMessageId = unansweredMessageId;
  }

  /** Returns a copy bound to the user message that was left without a reply. */
  public GenerationFailedException forMessage(UUID messageId) {
    return new GenerationFailedException(transientFailure, reason, messageId, this);
  }

  public boolean isTransient() {
    return transientFailure;
  }

  public String getReason() {
    return reason;
  }

  public UUID getUnansweredMessageId() {
    return unansweredMessageId;
  }

  public String getUserMessage() {
    return transientFailure
        ? "AI service is temporarily unavailable. Please try again in a moment."
        : "The AI service could not produce a reply for this request.";
  }
}
