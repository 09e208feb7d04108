package com.flamingo.ai.notebook.domain.enums;

/** Ingestion health of a source. */
public enum SourceStatus {
  /** Source has been registered but ingestion has not started. */
  PENDING,

  /** Content extraction is in flight. */
  PROCESSING,

  /** Content has been extracted and cached on the source. */
  PROCESSED,

  /** The last extraction attempt failed. */
  ERROR;

  /** Returns whether the registry may move a source from this status to {@code target}. */
  public boolean canTransitionTo(SourceStatus target) {
    return switch (this) {
      case PENDING -> target == PROCESSING;
      case PROCESSING -> target == PROCESSED || target == ERROR;
      case ERROR -> target == PROCESSING;
      case PROCESSED -> false;
    };
  }
}
