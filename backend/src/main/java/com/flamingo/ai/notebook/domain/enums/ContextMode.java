package com.flamingo.ai.notebook.domain.enums;

/** How much of a source or note the chat context may use. */
public enum ContextMode {
  /** Never offered as chat context. */
  EXCLUDED,
  /** Only the short form: a source's artifacts, or the opening of a note. */
  INSIGHTS,
  FULL_CONTENT
}
