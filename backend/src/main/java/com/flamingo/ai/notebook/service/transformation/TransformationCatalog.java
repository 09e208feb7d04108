package com.flamingo.ai.notebook.service.transformation;

import com.flamingo.ai.notebook.config.NotebookProperties;
import com.flamingo.ai.notebook.domain.enums.ArtifactKind;
import com.flamingo.ai.notebook.exception.UnknownTransformationException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Read-only set of transformations: the built-ins plus any declared under {@code
 * notebook.transformations}. A configured transformation with a built-in's name replaces it.
 */
@Component
@Slf4j
public class TransformationCatalog {

  private final Map<String, Transformation> transformations;

  public TransformationCatalog(NotebookProperties properties) {
    Map<String, Transformation> catalog = new LinkedHashMap<>();
    for (Transformation builtIn : builtIns()) {
      catalog.put(builtIn.name(), builtIn);
    }
    for (NotebookProperties.TransformationDefinition definition : properties.getTransformations()) {
      if (definition.getName() == null || definition.getName().isBlank()) {
        throw new IllegalStateException("Configured transformation is missing a name");
      }
      if (definition.getPrompt() == null || definition.getPrompt().isBlank()) {
        throw new IllegalStateException(
            "Configured transformation '" + definition.getName() + "' is missing a prompt");
      }
      Transformation previous =
          catalog.put(
              definition.getName(),
              new Transformation(
                  definition.getName(),
                  definition.getDescription(),
                  definition.getPrompt(),
                  definition.getKind(),
                  definition.getDefaultParams()));
      if (previous != null) {
        log.info("Transformation '{}' overridden by configuration", definition.getName());
      }
    }
    this.transformations = Map.copyOf(catalog);
    log.info("Transformation catalog loaded: {}", catalog.keySet());
  }

  public Optional<Transformation> find(String name) {
    return Optional.ofNullable(name).map(transformations::get);
  }

  /**
   * @throws UnknownTransformationException if no transformation has this name
   */
  public Transformation require(String name) {
    return find(name).orElseThrow(() -> new UnknownTransformationException(name));
  }

  /** All transformations sorted by name. */
  public List<Transformation> all() {
    List<Transformation> sorted = new ArrayList<>(transformations.values());
    sorted.sort((a, b) -> a.name().compareTo(b.name()));
    return sorted;
  }

  private static List<Transformation> builtIns() {
    return List.of(
        new Transformation(
            "summarize_text",
            "Summary of the content",
            "Summarize the content in {{length}}. Keep the key facts, figures and conclusions, and"
                + " do not add information that is not in the content.",
            ArtifactKind.TEXT,
            Map.of("length", "one or two paragraphs")),
        new Transformation(
            "simple_summary",
            "Short plain-language summary",
            "Write a short summary of the content in plain language that a newcomer to the topic"
                + " can follow. Use at most three sentences.",
            ArtifactKind.TEXT,
            Map.of()),
        new Transformation(
            "key_insights",
            "Most important insights",
            "List the {{count}} most important insights of the content. Write each insight as one"
                + " bullet point starting with \"- \".",
            ArtifactKind.LIST,
            Map.of("count", "5")),
        new Transformation(
            "reflection_questions",
            "Questions for reflection",
            "Write {{count}} questions that help the reader reflect on the content and connect it"
                + " to what they already know. Write each question as one bullet point starting"
                + " with \"- \".",
            ArtifactKind.LIST,
            Map.of("count", "5")),
        new Transformation(
            "extract_entities",
            "People, organizations, places and concepts mentioned",
            "List the named entities in the content: people, organizations, places, products and"
                + " key concepts. Write each entity as one bullet point in the form"
                + " \"- Name (type)\".",
            ArtifactKind.LIST,
            Map.of()),
        new Transformation(
            "generate_questions",
            "Questions the content answers",
            "Write {{count}} questions that the content answers, suitable for a study quiz. Write"
                + " each question as one bullet point starting with \"- \".",
            ArtifactKind.LIST,
            Map.of("count", "5")));
  }
}
