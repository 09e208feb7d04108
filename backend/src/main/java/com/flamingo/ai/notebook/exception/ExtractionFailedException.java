package com.flamingo.ai.notebook.exception;

/** Exception thrown when content extraction for a source fails. */
public class ExtractionFailedException extends RuntimeException {

  private final String reason;
  private final boolean transientFailure;

  public ExtractionFailedException(String reason, boolean transientFailure) {
    super("Content extraction failed: " + reason);
    this.reason = reason;
    this.transientFailure = transientFailure;
  }

  public ExtractionFailedException(String reason, boolean transientFailure, Throwable cause) {
    super("Content extraction failed: " + reason, cause);
    this.reason = reason;
    this.transientFailure = transientFailure;
  }

  /** Creates a failure that retrying cannot fix (missing file, unsupported type, no text). */
  public static ExtractionFailedException permanent(String reason) {
    return new ExtractionFailedException(reason, false);
  }

  /** Creates a failure that may succeed on retry (timeouts, rate limits, 5xx). */
  public static ExtractionFailedException transientFailure(String reason, Throwable cause) {
    return new ExtractionFailedException(reason, true, cause);
  }

  public String getReason() {
    return reason;
  }

  public boolean isTransient() {
    return transientFailure;
  }
}
