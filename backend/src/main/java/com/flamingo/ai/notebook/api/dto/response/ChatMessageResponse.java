package com.flamingo.ai.notebook.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.notebook.domain.entity.ChatMessage;
import com.flamingo.ai.notebook.domain.enums.MessageSender;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for chat messages. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessageResponse {

  private UUID id;
  private MessageSender sender;
  private String content;
  private long order;

  @JsonInclude(JsonInclude.Include.NON_NULL)
  private String replyError;

  private LocalDateTime createdAt;

  /** Creates a ChatMessageResponse from a ChatMessage entity. */
  public static ChatMessageResponse fromEntity(ChatMessage message) {
    return ChatMessageResponse.builder()
        .id(message.getId())
        .sender(message.getSender())
        .content(message.getContent())
        .order(message.getMessageOrder())
        .replyError(message.getReplyError())
        .createdAt(message.getCreatedAt())
        .build();
  }
}
