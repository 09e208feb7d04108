package com.flamingo.ai.notebook.service.transformation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.notebook.config.NotebookProperties;
import com.flamingo.ai.notebook.domain.enums.ArtifactKind;
import com.flamingo.ai.notebook.exception.UnknownTransformationException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TransformationCatalogTest {

  @Test
  void shouldListBuiltInsSortedByName() {
    TransformationCatalog catalog = new TransformationCatalog(new NotebookProperties());

    assertThat(catalog.all())
        .extracting(Transformation::name)
        .containsExactly(
            "extract_entities",
            "generate_questions",
            "key_insights",
            "reflection_questions",
            "simple_summary",
            "summarize_text");
  }

  @Test
  void shouldRenderDefaults_whenParamsOmitted() {
    TransformationCatalog catalog = new TransformationCatalog(new NotebookProperties());

    String prompt = catalog.require("key_insights").render(Map.of());

    assertThat(prompt).contains("List the 5 most important insights");
  }

  @Test
  void shouldPreferCallerParams_whenRendering() {
    TransformationCatalog catalog = new TransformationCatalog(new NotebookProperties());

    Transformation summary = catalog.require("summarize_text");

    assertThat(summary.render(Map.of("length", "one sentence")))
        .contains("in one sentence.")
        .doesNotContain("one or two paragraphs");
  }

  @Test
  void shouldOverrideBuiltIn_whenConfiguredWithSameName() {
    // Given
    NotebookProperties properties = new NotebookProperties();
    properties.setTransformations(
        List.of(
            definition("simple_summary", "Summarize for a {{audience}}.", ArtifactKind.TEXT),
            definition("open_problems", "List open problems.", ArtifactKind.LIST)));
    properties.getTransformations().get(0).setDefaultParams(Map.of("audience", "child"));

    // When
    TransformationCatalog catalog = new TransformationCatalog(properties);

    // Then
    assertThat(catalog.require("simple_summary").render(null)).isEqualTo("Summarize for a child.");
    assertThat(catalog.require("open_problems").outputKind()).isEqualTo(ArtifactKind.LIST);
    assertThat(catalog.all()).hasSize(7);
  }

  @Test
  void shouldThrowUnknownTransformation_whenNameNotInCatalog() {
    TransformationCatalog catalog = new TransformationCatalog(new NotebookProperties());

    assertThatThrownBy(() -> catalog.require("translate_to_klingon"))
        .isInstanceOf(UnknownTransformationException.class)
        .hasMessageContaining("translate_to_klingon");
    assertThat(catalog.find(null)).isEmpty();
  }

  @Test
  void shouldRejectConfiguration_whenPromptMissing() {
    NotebookProperties properties = new NotebookProperties();
    properties.setTransformations(List.of(definition("broken", " ", ArtifactKind.TEXT)));

    assertThatThrownBy(() -> new TransformationCatalog(properties))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("broken");
  }

  private static NotebookProperties.TransformationDefinition definition(
      String name, String prompt, ArtifactKind kind) {
    NotebookProperties.TransformationDefinition definition =
        new NotebookProperties.TransformationDefinition();
    definition.setName(name);
    definition.setPrompt(prompt);
    definition.setKind(kind);
    return definition;
  }
}
