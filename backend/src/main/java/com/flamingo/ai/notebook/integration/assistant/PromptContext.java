package com.flamingo.ai.notebook.integration.assistant;

import java.util.List;

/**
 * Everything the assistant needs for one generation.
 *
 * @param systemPrompt instructions, including any grounding context
 * @param history earlier conversation turns, oldest first; empty for transformations
 * @param userContent the text to answer or transform
 */
public record PromptContext(String systemPrompt, List<ConversationTurn> history, String userContent) {

  public PromptContext {
    history = history == null ? List.of() : List.copyOf(history);
  }

  public static PromptContext of(String systemPrompt, String userContent) {
    return new PromptContext(systemPrompt, List.of(), userContent);
  }
}
