package com.flamingo.ai.notebook.domain.repository;

import com.flamingo.ai.notebook.domain.entity.SourceArtifact;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for SourceArtifact entities. */
@Repository
public interface SourceArtifactRepository extends JpaRepository<SourceArtifact, UUID> {

  /** Finds all artifacts of a source ordered by name. */
  List<SourceArtifact> findBySourceIdOrderByNameAsc(UUID sourceId);

  /** Counts artifacts of a source. */
  long countBySourceId(UUID sourceId);
}
