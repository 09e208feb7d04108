package com.flamingo.ai.notebook.service.source;

import com.flamingo.ai.notebook.config.NotebookProperties;
import com.flamingo.ai.notebook.domain.entity.Notebook;
import com.flamingo.ai.notebook.domain.entity.Source;
import com.flamingo.ai.notebook.domain.entity.SourceArtifact;
import com.flamingo.ai.notebook.domain.enums.ContextMode;
import com.flamingo.ai.notebook.domain.enums.SourceStatus;
import com.flamingo.ai.notebook.domain.model.ArtifactValue;
import com.flamingo.ai.notebook.domain.model.SourceOrigin;
import com.flamingo.ai.notebook.domain.repository.NotebookRepository;
import com.flamingo.ai.notebook.domain.repository.SourceArtifactRepository;
import com.flamingo.ai.notebook.domain.repository.SourceRepository;
import com.flamingo.ai.notebook.exception.InvalidStateException;
import com.flamingo.ai.notebook.exception.NotebookNotFoundException;
import com.flamingo.ai.notebook.exception.OperationCancelledException;
import com.flamingo.ai.notebook.exception.SourceNotFoundException;
import com.flamingo.ai.notebook.integration.extraction.ExtractedContent;
import com.flamingo.ai.notebook.support.InFlightWork;
import com.flamingo.ai.notebook.support.SourceLocks;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.Hibernate;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

/** Implementation of the SourceRegistry. */
@Service
@Slf4j
public class SourceRegistryImpl implements SourceRegistry {

  private final SourceRepository sourceRepository;
  private final SourceArtifactRepository artifactRepository;
  private final NotebookRepository notebookRepository;
  private final SourceLocks sourceLocks;
  private final InFlightWork inFlightWork;
  private final TransactionTemplate transactionTemplate;
  private final MeterRegistry meterRegistry;
  private final NotebookProperties properties;
  private final SourceIngestionService ingestionService;

  public SourceRegistryImpl(
      SourceRepository sourceRepository,
      SourceArtifactRepository artifactRepository,
      NotebookRepository notebookRepository,
      SourceLocks sourceLocks,
      InFlightWork inFlightWork,
      TransactionTemplate transactionTemplate,
      MeterRegistry meterRegistry,
      NotebookProperties properties,
      @Lazy SourceIngestionService ingestionService) {
    this.sourceRepository = sourceRepository;
    this.artifactRepository = artifactRepository;
    this.notebookRepository = notebookRepository;
    this.sourceLocks = sourceLocks;
    this.inFlightWork = inFlightWork;
    this.transactionTemplate = transactionTemplate;
    this.meterRegistry = meterRegistry;
    this.properties = properties;
    this.ingestionService = ingestionService;
  }

  @Override
  @Transactional
  @Timed(value = "source.register", description = "Time to register a source")
  public Source register(UUID notebookId, SourceOrigin origin, String title) {
    return register(
        notebookId, origin, title, properties.getIngestion().getDefaultTransformations());
  }

  @Override
  @Transactional
  @Timed(value = "source.register", description = "Time to register a source")
  public Source register(
      UUID notebookId, SourceOrigin origin, String title, List<String> applyTransformations) {
    Notebook notebook =
        notebookRepository
            .findById(notebookId)
            .orElseThrow(() -> new NotebookNotFoundException(notebookId));

    Source source = Source.builder().notebook(notebook).title(blankToNull(title)).build();
    source.setOrigin(origin);
    Source saved = sourceRepository.save(source);
    meterRegistry
        .counter("source.registered", "origin", origin.type().name().toLowerCase())
        .increment();
    log.info("Registered {} source {} in notebook {}", origin.type(), saved.getId(), notebookId);

    List<String> transformations =
        applyTransformations == null ? List.of() : List.copyOf(applyTransformations);
    scheduleIngestion(saved.getId(), transformations);
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  public Source get(UUID sourceId) {
    return load(sourceId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<Source> list(UUID notebookId) {
    if (!notebookRepository.existsById(notebookId)) {
      throw new NotebookNotFoundException(notebookId);
    }
    List<Source> sources = sourceRepository.findByNotebookIdOrderByCreatedAtDesc(notebookId);
    sources.forEach(source -> Hibernate.initialize(source.getArtifacts()));
    return sources;
  }

  @Override
  public Source updateTitle(UUID sourceId, String title) {
    return sourceLocks.withLock(
        sourceId,
        () ->
            transactionTemplate.execute(
                status -> {
                  Source source = load(sourceId);
                  source.setTitle(blankToNull(title));
                  return sourceRepository.save(source);
                }));
  }

  @Override
  public Source updateContextMode(UUID sourceId, ContextMode mode) {
    if (mode == null) {
      throw new IllegalArgumentException("Context mode must not be null");
    }
    Source updated =
        sourceLocks.withLock(
            sourceId,
            () ->
                transactionTemplate.execute(
                    status -> {
                      Source source = load(sourceId);
                      source.setContextMode(mode);
                      return sourceRepository.save(source);
                    }));
    log.info("Source {} context mode set to {}", sourceId, mode);
    return updated;
  }

  @Override
  @Timed(value = "source.delete", description = "Time to delete a source")
  public void delete(UUID sourceId) {
    sourceLocks.withLock(
        sourceId,
        () -> {
          if (!sourceRepository.existsById(sourceId)) {
            throw new SourceNotFoundException(sourceId);
          }
          int cancelled = inFlightWork.cancelAll(sourceId);
          transactionTemplate.executeWithoutResult(
              status -> sourceRepository.delete(load(sourceId)));
          meterRegistry.counter("source.deleted").increment();
          log.info("Deleted source {} ({} in-flight operation(s) cancelled)", sourceId, cancelled);
        });
  }

  @Override
  public Source retry(UUID sourceId) {
    Source source =
        sourceLocks.withLock(
            sourceId,
            () ->
                transactionTemplate.execute(
                    status -> {
                      Source current = load(sourceId);
                      if (current.getStatus() != SourceStatus.ERROR) {
                        throw new InvalidStateException(
                            "Source "
                                + sourceId
                                + " can only be retried from ERROR, current status is "
                                + current.getStatus());
                      }
                      current.startProcessing();
                      return sourceRepository.save(current);
                    }));
    log.info("Retrying ingestion of source {}", sourceId);
    ingestionService.ingestAsync(sourceId, properties.getIngestion().getDefaultTransformations());
    return source;
  }

  @Override
  public Source markProcessing(UUID sourceId) {
    return sourceLocks.withLock(
        sourceId,
        () ->
            transactionTemplate.execute(
                status -> {
                  Source source = load(sourceId);
                  if (source.hasExtractedContent()
                      || source.getStatus() == SourceStatus.PROCESSING) {
                    return source;
                  }
                  requireTransition(source, SourceStatus.PROCESSING);
                  source.startProcessing();
                  log.debug("Source {} is now PROCESSING", sourceId);
                  return sourceRepository.save(source);
                }));
  }

  @Override
  public Source markProcessed(UUID sourceId, ExtractedContent content) {
    Source processed =
        sourceLocks.withLock(
            sourceId,
            () ->
                transactionTemplate.execute(
                    status -> {
                      Source source = load(sourceId);
                      requireTransition(source, SourceStatus.PROCESSED);
                      source.markProcessed(content.text());
                      if (source.getTitle() == null && content.detectedTitle() != null) {
                        source.setTitle(content.detectedTitle());
                      }
                      return sourceRepository.save(source);
                    }));
    meterRegistry.counter("source.processed").increment();
    log.info("Source {} processed ({} chars)", sourceId, content.text().length());
    return processed;
  }

  @Override
  public Source markFailed(UUID sourceId, String detail) {
    Source failed =
        sourceLocks.withLock(
            sourceId,
            () ->
                transactionTemplate.execute(
                    status -> {
                      Source source = load(sourceId);
                      requireTransition(source, SourceStatus.ERROR);
                      source.markFailed(detail);
                      return sourceRepository.save(source);
                    }));
    meterRegistry.counter("source.failed").increment();
    log.warn("Source {} failed: {}", sourceId, failed.getErrorDetail());
    return failed;
  }

  @Override
  public SourceArtifact upsertArtifact(UUID sourceId, String name, ArtifactValue value) {
    return sourceLocks.withLock(
        sourceId,
        () -> {
          if (Thread.currentThread().isInterrupted()) {
            throw new OperationCancelledException(
                "Transformation '" + name + "' on source " + sourceId + " was cancelled");
          }
          return transactionTemplate.execute(
              status -> {
                Source source = load(sourceId);
                if (!source.hasExtractedContent()) {
                  throw new InvalidStateException(
                      "Source " + sourceId + " has no extracted content");
                }
                source.upsertArtifact(name, value);
                Source saved = sourceRepository.saveAndFlush(source);
                log.debug("Stored artifact '{}' on source {}", name, sourceId);
                return saved.findArtifact(name).orElseThrow();
              });
        });
  }

  @Override
  @Transactional(readOnly = true)
  public List<SourceArtifact> listArtifacts(UUID sourceId) {
    if (!sourceRepository.existsById(sourceId)) {
      throw new SourceNotFoundException(sourceId);
    }
    return artifactRepository.findBySourceIdOrderByNameAsc(sourceId);
  }

  // Artifacts are initialized so callers can read them after the transaction ends
  private Source load(UUID sourceId) {
    Source source =
        sourceRepository.findById(sourceId).orElseThrow(() -> new SourceNotFoundException(sourceId));
    Hibernate.initialize(source.getArtifacts());
    return source;
  }

  private static void requireTransition(Source source, SourceStatus target) {
    if (!source.getStatus().canTransitionTo(target)) {
      throw new InvalidStateException(
          "Source "
              + source.getId()
              + " cannot move from "
              + source.getStatus()
              + " to "
              + target);
    }
  }

  private void scheduleIngestion(UUID sourceId, List<String> transformations) {
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      TransactionSynchronizationManager.registerSynchronization(
          new TransactionSynchronization() {
            @Override
            public void afterCommit() {
              log.debug("Transaction committed, starting ingestion for source: {}", sourceId);
              ingestionService.ingestAsync(sourceId, transformations);
            }
          });
    } else {
      log.debug("No active transaction, starting ingestion directly: {}", sourceId);
      ingestionService.ingestAsync(sourceId, transformations);
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.strip();
  }
}
