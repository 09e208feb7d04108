package com.flamingo.ai.notebook.service.transformation;

import com.flamingo.ai.notebook.domain.enums.ArtifactKind;
import dev.langchain4j.model.input.PromptTemplate;
import java.util.HashMap;
import java.util.Map;

/**
 * A named prompt applied to a source's extracted text.
 *
 * @param name identifier; also the name of the artifact it produces
 * @param description what the output is, for listings
 * @param promptTemplate instructions with optional {@code {{param}}} placeholders
 * @param outputKind shape of the artifact
 * @param defaultParams values used for placeholders the caller does not supply
 */
public record Transformation(
    String name,
    String description,
    String promptTemplate,
    ArtifactKind outputKind,
    Map<String, String> defaultParams) {

  public Transformation {
    defaultParams = defaultParams == null ? Map.of() : Map.copyOf(defaultParams);
  }

  /**
   * Renders the prompt with caller params layered over the defaults.
   *
   * @throws IllegalArgumentException if a placeholder has no value
   */
  public String render(Map<String, String> params) {
    Map<String, Object> values = new HashMap<>(defaultParams);
    if (params != null) {
      values.putAll(params);
    }
    return PromptTemplate.from(promptTemplate).apply(values).text();
  }
}
