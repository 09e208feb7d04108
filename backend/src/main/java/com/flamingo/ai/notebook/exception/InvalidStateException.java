package com.flamingo.ai.notebook.exception;

/** Exception thrown when an operation is not valid for the current status of an entity. */
public class InvalidStateException extends RuntimeException {

  public InvalidStateException(String message) {
    super(message);
  }
}
