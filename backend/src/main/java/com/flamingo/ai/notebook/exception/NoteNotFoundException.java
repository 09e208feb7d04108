package com.flamingo.ai.notebook.exception;

import java.util.UUID;

/** Exception thrown when a note is not found. */
public class NoteNotFoundException extends ResourceNotFoundException {

  public NoteNotFoundException(UUID id) {
    super("Note", id);
  }
}
