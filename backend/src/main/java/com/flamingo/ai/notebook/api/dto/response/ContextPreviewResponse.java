package com.flamingo.ai.notebook.api.dto.response;

import com.flamingo.ai.notebook.service.context.ContextItem;
import com.flamingo.ai.notebook.service.context.ContextSet;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO previewing the context a chat message would receive. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextPreviewResponse {

  private String query;
  private int totalChars;
  private int estimatedTokens;
  private List<ContextItem> items;

  /** Creates a ContextPreviewResponse for a selected context set. */
  public static ContextPreviewResponse from(String query, ContextSet context) {
    return ContextPreviewResponse.builder()
        .query(query)
        .totalChars(context.totalChars())
        .estimatedTokens(context.totalChars() / 4)
        .items(context.items())
        .build();
  }
}
