package com.flamingo.ai.notebook.domain.entity;

import com.flamingo.ai.notebook.domain.enums.MessageSender;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Represents a single message in a chat session. */
@Entity
@Table(
    name = "chat_messages",
    uniqueConstraints = @UniqueConstraint(columnNames = {"session_id", "message_order"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatMessage {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "session_id", nullable = false)
  private ChatSession session;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private MessageSender sender;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String content;

  /** Position in the session; strictly increasing, unique per session. */
  @Column(name = "message_order", nullable = false)
  private long messageOrder;

  /** Why no assistant reply was produced for this user message, if generation failed. */
  @Column(columnDefinition = "TEXT")
  private String replyError;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = LocalDateTime.now();
    }
  }

  /** Order value of the reply slot reserved for this user message. */
  public long replyOrder() {
    return messageOrder + 1;
  }
}
