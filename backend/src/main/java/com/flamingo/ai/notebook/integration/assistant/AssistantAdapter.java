package com.flamingo.ai.notebook.integration.assistant;

import com.flamingo.ai.notebook.exception.GenerationFailedException;

/** Text generation capability used by transformations and chat replies. */
public interface AssistantAdapter {

  /**
   * Generates text for {@code context}. Blocks until the model answers.
   *
   * @return non-blank generated text
   * @throws GenerationFailedException classified as transient or permanent
   */
  String generate(PromptContext context);
}
