package com.flamingo.ai.notebook.service.transformation;

import com.flamingo.ai.notebook.config.NotebookProperties;
import com.flamingo.ai.notebook.domain.entity.Source;
import com.flamingo.ai.notebook.domain.model.SourceOrigin;
import com.flamingo.ai.notebook.exception.ExtractionFailedException;
import com.flamingo.ai.notebook.exception.OperationCancelledException;
import com.flamingo.ai.notebook.exception.SourceNotFoundException;
import com.flamingo.ai.notebook.integration.extraction.ContentExtractor;
import com.flamingo.ai.notebook.integration.extraction.ExtractedContent;
import com.flamingo.ai.notebook.service.source.SourceRegistry;
import com.flamingo.ai.notebook.support.AdapterCallPolicy;
import com.flamingo.ai.notebook.support.AdapterInvoker;
import com.flamingo.ai.notebook.support.InFlightWork;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Returns a source's extracted text, extracting it first when needed. Concurrent callers for the
 * same source share a single extraction; its outcome is reported to the registry once.
 *
 * <p>The extraction runs as its own task on the extraction executor and is tracked against the
 * source, so only deleting the source cancels it. A caller that is interrupted stops waiting; the
 * extraction carries on for the remaining callers.
 */
@Component
@Slf4j
public class SourceContentResolver {

  private final SourceRegistry sourceRegistry;
  private final ContentExtractor contentExtractor;
  private final AdapterInvoker adapterInvoker;
  private final InFlightWork inFlightWork;
  private final ThreadPoolTaskExecutor extractionExecutor;
  private final AdapterCallPolicy extractionPolicy;

  private final ConcurrentHashMap<UUID, SharedExtraction> extractions = new ConcurrentHashMap<>();

  public SourceContentResolver(
      SourceRegistry sourceRegistry,
      ContentExtractor contentExtractor,
      AdapterInvoker adapterInvoker,
      InFlightWork inFlightWork,
      @Qualifier("extractionExecutor") ThreadPoolTaskExecutor extractionExecutor,
      NotebookProperties properties) {
    this.sourceRegistry = sourceRegistry;
    this.contentExtractor = contentExtractor;
    this.adapterInvoker = adapterInvoker;
    this.inFlightWork = inFlightWork;
    this.extractionExecutor = extractionExecutor;
    this.extractionPolicy = AdapterCallPolicy.extraction(properties.getExtraction());
  }

  /** Resolves with the configured extraction timeout. */
  public String resolve(UUID sourceId) {
    return resolve(sourceId, extractionPolicy.timeout());
  }

  /**
   * Returns the extracted text of {@code sourceId}. When this call starts the extraction,
   * {@code timeout} bounds each extractor attempt; a caller joining a running extraction waits for
   * it to settle.
   *
   * @throws SourceNotFoundException if the source does not exist or is deleted meanwhile
   * @throws ExtractionFailedException if extraction fails; the source is then in ERROR
   * @throws OperationCancelledException if this caller was interrupted or the source was deleted
   */
  public String resolve(UUID sourceId, Duration timeout) {
    Source source = sourceRegistry.get(sourceId);
    if (source.hasExtractedContent()) {
      return source.getFullText();
    }

    SharedExtraction candidate =
        new SharedExtraction(sourceId, () -> extract(sourceId, timeout));
    SharedExtraction running = extractions.putIfAbsent(sourceId, candidate);
    if (running != null) {
      log.debug("Joining in-flight extraction of source {}", sourceId);
      return await(sourceId, running);
    }
    candidate.start();
    return await(sourceId, candidate);
  }

  private String extract(UUID sourceId, Duration timeout) {
    Source source = sourceRegistry.markProcessing(sourceId);
    if (source.hasExtractedContent()) {
      return source.getFullText();
    }
    SourceOrigin origin = source.getOrigin();
    log.info("Extracting content of {} source {}", origin.type(), sourceId);

    ExtractedContent content;
    try {
      content =
          adapterInvoker.invoke(
              extractionPolicy.withTimeout(timeout),
              sourceId,
              () -> contentExtractor.extract(origin));
    } catch (ExtractionFailedException e) {
      recordFailure(sourceId, e.getReason());
      throw e;
    } catch (OperationCancelledException e) {
      log.info("Extraction of source {} cancelled", sourceId);
      throw e;
    } catch (RuntimeException e) {
      log.error("Unexpected extraction error for source {}", sourceId, e);
      recordFailure(sourceId, e.getMessage());
      throw new ExtractionFailedException(String.valueOf(e.getMessage()), false, e);
    }

    sourceRegistry.markProcessed(sourceId, content);
    return content.text();
  }

  private void recordFailure(UUID sourceId, String reason) {
    try {
      sourceRegistry.markFailed(sourceId, reason);
    } catch (SourceNotFoundException e) {
      log.info("Source {} was deleted during extraction", sourceId);
    }
  }

  private static String await(UUID sourceId, Future<String> extraction) {
    try {
      return extraction.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new OperationCancelledException(
          "Interrupted while waiting for extraction of source " + sourceId, e);
    } catch (CancellationException e) {
      throw new OperationCancelledException("Extraction of source " + sourceId + " was cancelled");
    } catch (ExecutionException e) {
      if (e.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw new IllegalStateException(e.getCause());
    }
  }

  /** One extraction run, shared by every caller that asks for the source while it runs. */
  private final class SharedExtraction extends FutureTask<String> {

    private final UUID sourceId;
    private volatile InFlightWork.Registration registration;

    SharedExtraction(UUID sourceId, Callable<String> extraction) {
      super(extraction);
      this.sourceId = sourceId;
    }

    void start() {
      registration = inFlightWork.track(sourceId, this);
      try {
        extractionExecutor.execute(this);
      } catch (TaskRejectedException e) {
        cancel(false);
        throw e;
      }
    }

    @Override
    protected void done() {
      extractions.remove(sourceId, this);
      InFlightWork.Registration current = registration;
      if (current != null) {
        current.close();
      }
    }
  }
}
