package com.flamingo.ai.notebook.api.dto.response;

import com.flamingo.ai.notebook.service.chat.ChatExchange;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a posted message and its reply. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatExchangeResponse {

  private ChatMessageResponse userMessage;
  private ChatMessageResponse assistantMessage;

  /** Creates a ChatExchangeResponse from a completed exchange. */
  public static ChatExchangeResponse from(ChatExchange exchange) {
    return ChatExchangeResponse.builder()
        .userMessage(ChatMessageResponse.fromEntity(exchange.userMessage()))
        .assistantMessage(ChatMessageResponse.fromEntity(exchange.assistantMessage()))
        .build();
  }
}
