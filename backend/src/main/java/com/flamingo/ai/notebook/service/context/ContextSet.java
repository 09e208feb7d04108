package com.flamingo.ai.notebook.service.context;

import java.util.List;

/** Ordered, budget-bounded grounding material for one chat turn. */
public record ContextSet(List<ContextItem> items) {

  private static final ContextSet EMPTY = new ContextSet(List.of());

  public ContextSet {
    items = items == null ? List.of() : List.copyOf(items);
  }

  public static ContextSet empty() {
    return EMPTY;
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }

  public int totalChars() {
    return items.stream().mapToInt(item -> item.excerpt().length()).sum();
  }

  /** Formats the items for inclusion in a system prompt. */
  public String render() {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < items.size(); i++) {
      ContextItem item = items.get(i);
      sb.append("[")
          .append(i + 1)
          .append("] ")
          .append(item.type() == ContextItemType.NOTE ? "Note" : "Source")
          .append(": ")
          .append(item.title())
          .append("\n")
          .append(item.excerpt())
          .append("\n\n");
    }
    return sb.toString().strip();
  }
}
