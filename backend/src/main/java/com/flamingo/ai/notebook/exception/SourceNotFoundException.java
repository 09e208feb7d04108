package com.flamingo.ai.notebook.exception;

import java.util.UUID;

/** Exception thrown when a source is not found. */
public class SourceNotFoundException extends ResourceNotFoundException {

  public SourceNotFoundException(UUID id) {
    super("Source", id);
  }
}
