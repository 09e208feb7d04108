package com.flamingo.ai.notebook.domain.repository;

import com.flamingo.ai.notebook.domain.entity.Note;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Note entities. */
@Repository
public interface NoteRepository extends JpaRepository<Note, UUID> {

  /** Finds all notes for a notebook, newest first. */
  List<Note> findByNotebookIdOrderByCreatedAtDesc(UUID notebookId);

  /** Counts notes by notebook. */
  long countByNotebookId(UUID notebookId);
}
