package com.flamingo.ai.notebook.domain.enums;

/** Shape of the value a transformation produces. */
public enum ArtifactKind {
  /** A single block of text. */
  TEXT,

  /** An ordered list of text items. */
  LIST
}
