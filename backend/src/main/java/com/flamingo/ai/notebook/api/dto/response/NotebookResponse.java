package com.flamingo.ai.notebook.api.dto.response;

import com.flamingo.ai.notebook.domain.entity.Notebook;
import com.flamingo.ai.notebook.service.notebook.NotebookStats;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for notebook data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotebookResponse {

  private UUID id;
  private String name;
  private String description;
  private boolean archived;
  private long sourceCount;
  private long noteCount;
  private long chatSessionCount;
  private long openTaskCount;
  private LocalDateTime createdAt;
  private LocalDateTime updatedAt;

  /** Creates a NotebookResponse from a Notebook entity with its counts. */
  public static NotebookResponse fromEntity(Notebook notebook, NotebookStats stats) {
    return NotebookResponse.builder()
        .id(notebook.getId())
        .name(notebook.getName())
        .description(notebook.getDescription())
        .archived(notebook.isArchived())
        .sourceCount(stats.sourceCount())
        .noteCount(stats.noteCount())
        .chatSessionCount(stats.chatSessionCount())
        .openTaskCount(stats.openTaskCount())
        .createdAt(notebook.getCreatedAt())
        .updatedAt(notebook.getUpdatedAt())
        .build();
  }
}
