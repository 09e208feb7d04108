package com.flamingo.ai.notebook.domain.enums;

/** Who wrote a note. */
public enum NoteType {
  HUMAN,
  AI
}
