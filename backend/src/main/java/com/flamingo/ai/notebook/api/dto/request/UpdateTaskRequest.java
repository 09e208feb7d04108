package com.flamingo.ai.notebook.api.dto.request;

import com.flamingo.ai.notebook.domain.enums.TaskStatus;
import jakarta.validation.constraints.Size;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for updating a task. Null fields are left unchanged. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateTaskRequest {

  @Size(min = 1, message = "Description must not be empty")
  private String description;

  private TaskStatus status;

  private LocalDateTime dueDate;

  private Integer displayOrder;
}
