package com.flamingo.ai.notebook.service.context;

import com.flamingo.ai.notebook.config.NotebookProperties;

/** Upper bounds on the context handed to the assistant. */
public record ContextBudget(int maxItems, int maxChars) {

  public ContextBudget {
    if (maxItems < 0 || maxChars < 0) {
      throw new IllegalArgumentException("Context budget must not be negative");
    }
  }

  public static ContextBudget from(NotebookProperties.Context settings) {
    return new ContextBudget(settings.getMaxItems(), settings.getMaxChars());
  }

  /** Rough token estimate for a character budget, four characters per token. */
  public int estimatedTokens() {
    return maxChars / 4;
  }
}
