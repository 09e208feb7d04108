package com.flamingo.ai.notebook.service.transformation;

import com.flamingo.ai.notebook.domain.entity.SourceArtifact;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/** Runs named transformations against a source's extracted text. */
public interface TransformationExecutor {

  /**
   * Extracts the source if needed, runs the transformation and stores its output as the artifact of
   * the same name, replacing any previous value.
   */
  SourceArtifact run(UUID sourceId, String transformationName, Map<String, String> params);

  /**
   * Same as {@link #run(UUID, String, Map)} with an explicit per-call adapter timeout. The timeout
   * bounds the generation call and, when this call starts it, the extraction of the source.
   */
  SourceArtifact run(
      UUID sourceId, String transformationName, Map<String, String> params, Duration timeout);

  /**
   * Runs the transformation on the transformation executor. Cancelling the returned future
   * interrupts the work; no artifact is written after cancellation.
   */
  CompletableFuture<SourceArtifact> runAsync(
      UUID sourceId, String transformationName, Map<String, String> params);

  List<Transformation> listTransformations();
}
