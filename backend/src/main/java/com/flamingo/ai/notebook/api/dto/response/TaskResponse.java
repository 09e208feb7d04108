package com.flamingo.ai.notebook.api.dto.response;

import com.flamingo.ai.notebook.domain.entity.Task;
import com.flamingo.ai.notebook.domain.enums.TaskStatus;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for task data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskResponse {

  private UUID id;
  private String description;
  private TaskStatus status;
  private LocalDateTime dueDate;
  private Integer displayOrder;
  private LocalDateTime createdAt;
  private LocalDateTime updatedAt;

  /** Creates a TaskResponse from a Task entity. */
  public static TaskResponse fromEntity(Task task) {
    return TaskResponse.builder()
        .id(task.getId())
        .description(task.getDescription())
        .status(task.getStatus())
        .dueDate(task.getDueDate())
        .displayOrder(task.getDisplayOrder())
        .createdAt(task.getCreatedAt())
        .updatedAt(task.getUpdatedAt())
        .build();
  }
}
