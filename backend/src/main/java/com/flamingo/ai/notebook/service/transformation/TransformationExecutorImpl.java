package com.flamingo.ai.notebook.service.transformation;

import com.flamingo.ai.notebook.config.NotebookProperties;
import com.flamingo.ai.notebook.domain.entity.SourceArtifact;
import com.flamingo.ai.notebook.domain.model.ArtifactValue;
import com.flamingo.ai.notebook.exception.GenerationFailedException;
import com.flamingo.ai.notebook.integration.assistant.AssistantAdapter;
import com.flamingo.ai.notebook.integration.assistant.PromptContext;
import com.flamingo.ai.notebook.service.source.SourceRegistry;
import com.flamingo.ai.notebook.support.AdapterCallPolicy;
import com.flamingo.ai.notebook.support.AdapterInvoker;
import com.flamingo.ai.notebook.support.InFlightWork;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

/** Implementation of the TransformationExecutor. */
@Service
@Slf4j
public class TransformationExecutorImpl implements TransformationExecutor {

  static final String TRANSFORMATION_INSTRUCTIONS =
      "You transform source material for a research notebook. Work only from the input below,"
          + " answer in the language of the input and return only the requested output.";

  private final SourceRegistry sourceRegistry;
  private final SourceContentResolver contentResolver;
  private final TransformationCatalog catalog;
  private final AssistantAdapter assistantAdapter;
  private final AdapterInvoker adapterInvoker;
  private final InFlightWork inFlightWork;
  private final ThreadPoolTaskExecutor transformationTaskExecutor;
  private final MeterRegistry meterRegistry;
  private final AdapterCallPolicy generationPolicy;
  private final int maxInputChars;

  public TransformationExecutorImpl(
      SourceRegistry sourceRegistry,
      SourceContentResolver contentResolver,
      TransformationCatalog catalog,
      AssistantAdapter assistantAdapter,
      AdapterInvoker adapterInvoker,
      InFlightWork inFlightWork,
      @Qualifier("transformationExecutor") ThreadPoolTaskExecutor transformationTaskExecutor,
      MeterRegistry meterRegistry,
      NotebookProperties properties) {
    this.sourceRegistry = sourceRegistry;
    this.contentResolver = contentResolver;
    this.catalog = catalog;
    this.assistantAdapter = assistantAdapter;
    this.adapterInvoker = adapterInvoker;
    this.inFlightWork = inFlightWork;
    this.transformationTaskExecutor = transformationTaskExecutor;
    this.meterRegistry = meterRegistry;
    this.generationPolicy = AdapterCallPolicy.generation(properties.getGeneration());
    this.maxInputChars = properties.getGeneration().getMaxInputChars();
  }

  @Override
  @Timed(value = "transformation.run", description = "Time to run a transformation")
  public SourceArtifact run(UUID sourceId, String transformationName, Map<String, String> params) {
    return run(sourceId, transformationName, params, null, generationPolicy.timeout());
  }

  @Override
  @Timed(value = "transformation.run", description = "Time to run a transformation")
  public SourceArtifact run(
      UUID sourceId, String transformationName, Map<String, String> params, Duration timeout) {
    return run(sourceId, transformationName, params, timeout, timeout);
  }

  /** A null {@code extractionTimeout} uses the configured extraction timeout. */
  private SourceArtifact run(
      UUID sourceId,
      String transformationName,
      Map<String, String> params,
      Duration extractionTimeout,
      Duration timeout) {
    sourceRegistry.get(sourceId);
    Transformation transformation = catalog.require(transformationName);
    String systemPrompt = buildSystemPrompt(transformation, params);

    String content =
        extractionTimeout == null
            ? contentResolver.resolve(sourceId)
            : contentResolver.resolve(sourceId, extractionTimeout);

    log.info("Running transformation '{}' on source {}", transformation.name(), sourceId);
    String output;
    try {
      output =
          adapterInvoker.invoke(
              generationPolicy.withTimeout(timeout),
              sourceId,
              () -> assistantAdapter.generate(PromptContext.of(systemPrompt, truncate(content))));
    } catch (RuntimeException e) {
      meterRegistry
          .counter("transformation.failed", "transformation", transformation.name())
          .increment();
      throw e;
    }

    ArtifactValue value = ArtifactOutputParser.parse(output, transformation.outputKind());
    if (value.isBlank()) {
      meterRegistry
          .counter("transformation.failed", "transformation", transformation.name())
          .increment();
      throw new GenerationFailedException(
          false, "Transformation '" + transformation.name() + "' produced no output");
    }

    SourceArtifact artifact =
        sourceRegistry.upsertArtifact(sourceId, transformation.name(), value);
    meterRegistry
        .counter("transformation.completed", "transformation", transformation.name())
        .increment();
    log.info("Transformation '{}' stored on source {}", transformation.name(), sourceId);
    return artifact;
  }

  @Override
  public CompletableFuture<SourceArtifact> runAsync(
      UUID sourceId, String transformationName, Map<String, String> params) {
    CompletableFuture<SourceArtifact> result = new CompletableFuture<>();
    Future<?> task =
        transformationTaskExecutor.submit(
            () -> {
              try {
                result.complete(run(sourceId, transformationName, params));
              } catch (Throwable t) {
                result.completeExceptionally(t);
              }
            });
    InFlightWork.Registration registration = inFlightWork.track(sourceId, result);
    result.whenComplete(
        (artifact, error) -> {
          registration.close();
          if (result.isCancelled()) {
            task.cancel(true);
            log.info("Transformation '{}' on source {} cancelled", transformationName, sourceId);
          }
        });
    return result;
  }

  @Override
  public List<Transformation> listTransformations() {
    return catalog.all();
  }

  private static String buildSystemPrompt(
      Transformation transformation, Map<String, String> params) {
    return TRANSFORMATION_INSTRUCTIONS + "\n\n" + transformation.render(params) + "\n\n# INPUT";
  }

  private String truncate(String content) {
    if (content.length() <= maxInputChars) {
      return content;
    }
    log.debug("Truncating input from {} to {} chars", content.length(), maxInputChars);
    return content.substring(0, maxInputChars);
  }
}
