package com.flamingo.ai.notebook.api.dto.response;

import com.flamingo.ai.notebook.domain.entity.ChatSession;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for chat session data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatSessionResponse {

  private UUID id;
  private String title;
  private long messageCount;
  private LocalDateTime createdAt;
  private LocalDateTime updatedAt;

  /** Creates a ChatSessionResponse from a ChatSession entity. */
  public static ChatSessionResponse fromEntity(ChatSession session, long messageCount) {
    return ChatSessionResponse.builder()
        .id(session.getId())
        .title(session.getTitle())
        .messageCount(messageCount)
        .createdAt(session.getCreatedAt())
        .updatedAt(session.getUpdatedAt())
        .build();
  }
}
