package com.flamingo.ai.notebook.domain.repository;

import com.flamingo.ai.notebook.domain.entity.Source;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for Source entities. */
@Repository
public interface SourceRepository extends JpaRepository<Source, UUID> {

  /** Finds all sources for a notebook, newest first. */
  List<Source> findByNotebookIdOrderByCreatedAtDesc(UUID notebookId);

  /** Counts sources by notebook. */
  long countByNotebookId(UUID notebookId);

  /** Finds sources of a notebook whose content has been extracted. */
  @Query(
      "SELECT s FROM Source s WHERE s.notebook.id = :notebookId AND s.fullText IS NOT NULL "
          + "ORDER BY s.createdAt DESC")
  List<Source> findExtractedByNotebookId(@Param("notebookId") UUID notebookId);
}
