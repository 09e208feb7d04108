package com.flamingo.ai.notebook.domain.repository;

import com.flamingo.ai.notebook.domain.entity.Notebook;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Notebook entities. */
@Repository
public interface NotebookRepository extends JpaRepository<Notebook, UUID> {

  /** Finds all notebooks, most recently updated first. */
  List<Notebook> findAllByOrderByUpdatedAtDesc();

  /** Finds notebooks filtered by archived flag. */
  List<Notebook> findByArchivedOrderByUpdatedAtDesc(boolean archived);
}
