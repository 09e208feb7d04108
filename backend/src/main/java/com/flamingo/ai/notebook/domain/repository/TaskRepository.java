package com.flamingo.ai.notebook.domain.repository;

import com.flamingo.ai.notebook.domain.entity.Task;
import com.flamingo.ai.notebook.domain.enums.TaskStatus;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for Task entities. */
@Repository
public interface TaskRepository extends JpaRepository<Task, UUID> {

  /** Finds tasks of a notebook in display order, then creation order. */
  @Query(
      "SELECT t FROM Task t WHERE t.notebook.id = :notebookId "
          + "ORDER BY CASE WHEN t.displayOrder IS NULL THEN 1 ELSE 0 END, "
          + "t.displayOrder ASC, t.createdAt ASC")
  List<Task> findByNotebookIdOrdered(@Param("notebookId") UUID notebookId);

  /** Counts tasks by notebook and status. */
  long countByNotebookIdAndStatus(UUID notebookId, TaskStatus status);
}
