package com.flamingo.ai.notebook.domain.repository;

import com.flamingo.ai.notebook.domain.entity.ChatMessage;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for ChatMessage entities. */
@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessage, UUID> {

  /** Finds all messages for a session in conversation order. */
  @Query(
      "SELECT m FROM ChatMessage m WHERE m.session.id = :sessionId "
          + "ORDER BY m.messageOrder ASC, m.createdAt ASC, m.id ASC")
  List<ChatMessage> findConversation(@Param("sessionId") UUID sessionId);

  /** Finds messages ordered before {@code beforeOrder}, newest first. */
  @Query(
      "SELECT m FROM ChatMessage m WHERE m.session.id = :sessionId "
          + "AND m.messageOrder < :beforeOrder ORDER BY m.messageOrder DESC")
  List<ChatMessage> findHistoryBeforeQuery(
      @Param("sessionId") UUID sessionId,
      @Param("beforeOrder") long beforeOrder,
      Pageable pageable);

  /** Finds up to {@code limit} messages ordered before {@code beforeOrder}, newest first. */
  default List<ChatMessage> findHistoryBefore(UUID sessionId, long beforeOrder, int limit) {
    return findHistoryBeforeQuery(sessionId, beforeOrder, Pageable.ofSize(limit));
  }

  /** Highest order value actually stored for a session, or 0 when it has no messages. */
  @Query(
      "SELECT COALESCE(MAX(m.messageOrder), 0) FROM ChatMessage m "
          + "WHERE m.session.id = :sessionId")
  long findMaxOrder(@Param("sessionId") UUID sessionId);

  /** Finds the message occupying an order slot. */
  Optional<ChatMessage> findBySessionIdAndMessageOrder(UUID sessionId, long messageOrder);

  /** Counts messages by session. */
  long countBySessionId(UUID sessionId);
}
