package com.flamingo.ai.notebook.domain.model;

import com.flamingo.ai.notebook.domain.enums.ArtifactKind;
import java.util.List;

/** Typed value of a source artifact. */
public sealed interface ArtifactValue permits ArtifactValue.Text, ArtifactValue.TextList {

  ArtifactKind kind();

  /** Whether the value carries any content worth persisting. */
  boolean isBlank();

  /** Free-form text, e.g. a summary. */
  record Text(String text) implements ArtifactValue {
    @Override
    public ArtifactKind kind() {
      return ArtifactKind.TEXT;
    }

    @Override
    public boolean isBlank() {
      return text == null || text.isBlank();
    }
  }

  /** Ordered items, e.g. key insights or reflection questions. */
  record TextList(List<String> items) implements ArtifactValue {
    public TextList {
      items = items == null ? List.of() : List.copyOf(items);
    }

    @Override
    public ArtifactKind kind() {
      return ArtifactKind.LIST;
    }

    @Override
    public boolean isBlank() {
      return items.stream().allMatch(String::isBlank);
    }
  }
}
