package com.flamingo.ai.notebook.domain.repository;

import com.flamingo.ai.notebook.domain.entity.ChatSession;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for ChatSession entities. */
@Repository
public interface ChatSessionRepository extends JpaRepository<ChatSession, UUID> {

  /** Finds all sessions of a notebook, most recently active first. */
  List<ChatSession> findByNotebookIdOrderByUpdatedAtDesc(UUID notebookId);

  /** Counts sessions by notebook. */
  long countByNotebookId(UUID notebookId);
}
