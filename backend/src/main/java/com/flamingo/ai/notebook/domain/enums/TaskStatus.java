package com.flamingo.ai.notebook.domain.enums;

/** Caller-driven status of a notebook task. */
public enum TaskStatus {
  TODO,
  IN_PROGRESS,
  COMPLETED
}
