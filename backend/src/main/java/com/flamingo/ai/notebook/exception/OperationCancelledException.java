package com.flamingo.ai.notebook.exception;

/** Exception thrown when in-flight work was cancelled before it could complete. */
public class OperationCancelledException extends RuntimeException {

  public OperationCancelledException(String message) {
    super(message);
  }

  public OperationCancelledException(String message, Throwable cause) {
    super(message, cause);
  }
}
