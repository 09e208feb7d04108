package com.flamingo.ai.notebook.service.source;

import com.flamingo.ai.notebook.exception.ExtractionFailedException;
import com.flamingo.ai.notebook.exception.OperationCancelledException;
import com.flamingo.ai.notebook.exception.SourceNotFoundException;
import com.flamingo.ai.notebook.service.transformation.SourceContentResolver;
import com.flamingo.ai.notebook.service.transformation.TransformationExecutor;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Background ingestion of a newly registered (or retried) source: extraction, then the requested
 * transformations one after another. A failing transformation does not affect the source status
 * or the remaining transformations.
 */
@Service
@Slf4j
public class SourceIngestionService {

  private final SourceContentResolver contentResolver;
  private final TransformationExecutor transformationExecutor;

  public SourceIngestionService(
      SourceContentResolver contentResolver,
      @Lazy TransformationExecutor transformationExecutor) {
    this.contentResolver = contentResolver;
    this.transformationExecutor = transformationExecutor;
  }

  /**
   * Runs ingestion on the ingestion executor. Deleting the source cancels the adapter call in
   * progress, which ends the ingestion.
   */
  @Async("sourceIngestionExecutor")
  public void ingestAsync(UUID sourceId, List<String> transformations) {
    ingest(sourceId, transformations);
  }

  /** Runs ingestion on the calling thread. */
  public void ingest(UUID sourceId, List<String> transformations) {
    log.info("Starting ingestion of source {}", sourceId);
    try {
      contentResolver.resolve(sourceId);
    } catch (ExtractionFailedException e) {
      log.warn("Ingestion of source {} stopped: {}", sourceId, e.getReason());
      return;
    } catch (SourceNotFoundException | OperationCancelledException e) {
      log.info("Ingestion of source {} abandoned: {}", sourceId, e.getMessage());
      return;
    }

    for (String name : transformations) {
      if (Thread.currentThread().isInterrupted()) {
        log.info("Ingestion of source {} interrupted before '{}'", sourceId, name);
        return;
      }
      try {
        transformationExecutor.run(sourceId, name, Map.of());
      } catch (SourceNotFoundException | OperationCancelledException e) {
        log.info("Ingestion of source {} abandoned: {}", sourceId, e.getMessage());
        return;
      } catch (RuntimeException e) {
        log.warn(
            "Default transformation '{}' failed for source {}: {}", name, sourceId, e.getMessage());
      }
    }
    log.info("Ingestion of source {} complete", sourceId);
  }
}
