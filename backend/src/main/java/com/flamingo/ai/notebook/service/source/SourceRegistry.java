package com.flamingo.ai.notebook.service.source;

import com.flamingo.ai.notebook.domain.entity.Source;
import com.flamingo.ai.notebook.domain.entity.SourceArtifact;
import com.flamingo.ai.notebook.domain.enums.ContextMode;
import com.flamingo.ai.notebook.domain.model.ArtifactValue;
import com.flamingo.ai.notebook.domain.model.SourceOrigin;
import com.flamingo.ai.notebook.integration.extraction.ExtractedContent;
import java.util.List;
import java.util.UUID;

/**
 * Owns source records and their status. Status changes and artifact writes happen only here, each
 * under the source's lock and in its own transaction.
 */
public interface SourceRegistry {

  /**
   * Creates a PENDING source and schedules ingestion with the configured default transformations
   * once the record is committed.
   */
  Source register(UUID notebookId, SourceOrigin origin, String title);

  /**
   * Creates a PENDING source and schedules ingestion that applies {@code applyTransformations}
   * after a successful extraction.
   */
  Source register(
      UUID notebookId, SourceOrigin origin, String title, List<String> applyTransformations);

  Source get(UUID sourceId);

  /** Sources of a notebook, newest first. */
  List<Source> list(UUID notebookId);

  Source updateTitle(UUID sourceId, String title);

  /** Sets how the source takes part in chat context. */
  Source updateContextMode(UUID sourceId, ContextMode mode);

  /**
   * Cancels in-flight work on the source, then deletes it together with its artifacts. Work that
   * completes afterwards finds no record and writes nothing.
   */
  void delete(UUID sourceId);

  /** Moves an ERROR source back to PROCESSING and re-runs ingestion. */
  Source retry(UUID sourceId);

  /**
   * Moves the source to PROCESSING unless its content is already extracted or extraction is
   * already under way. Returns the source as stored afterwards.
   */
  Source markProcessing(UUID sourceId);

  /** PROCESSING to PROCESSED, caching the extracted text. */
  Source markProcessed(UUID sourceId, ExtractedContent content);

  /** PROCESSING to ERROR with a non-empty detail. */
  Source markFailed(UUID sourceId, String detail);

  /** Inserts the named artifact or replaces its value. Requires extracted content. */
  SourceArtifact upsertArtifact(UUID sourceId, String name, ArtifactValue value);

  List<SourceArtifact> listArtifacts(UUID sourceId);
}
