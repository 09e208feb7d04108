package com.flamingo.ai.notebook.exception;

import java.util.UUID;

/** Exception thrown when a notebook is not found. */
public class NotebookNotFoundException extends ResourceNotFoundException {

  public NotebookNotFoundException(UUID id) {
    super("Notebook", id);
  }
}
