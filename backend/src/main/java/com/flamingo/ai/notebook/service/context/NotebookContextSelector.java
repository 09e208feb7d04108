package com.flamingo.ai.notebook.service.context;

import java.util.UUID;

/** Chooses which notebook content grounds a chat reply. */
public interface NotebookContextSelector {

  /**
   * Selects excerpts of the notebook's extracted sources and notes relevant to {@code query}.
   * Identical inputs over identical notebook state yield the same result. A notebook without
   * content yields an empty set.
   */
  ContextSet select(UUID notebookId, String query, ContextBudget budget);
}
