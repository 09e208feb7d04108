package com.flamingo.ai.notebook.exception;

import java.util.UUID;

/** Exception thrown when a task is not found. */
public class TaskNotFoundException extends ResourceNotFoundException {

  public TaskNotFoundException(UUID id) {
    super("Task", id);
  }
}
