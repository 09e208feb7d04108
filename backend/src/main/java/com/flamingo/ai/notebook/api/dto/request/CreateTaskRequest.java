package com.flamingo.ai.notebook.api.dto.request;

import com.flamingo.ai.notebook.domain.enums.TaskStatus;
import jakarta.validation.constraints.NotBlank;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for creating a task. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateTaskRequest {

  @NotBlank(message = "Description is required")
  private String description;

  private TaskStatus status;

  private LocalDateTime dueDate;

  private Integer displayOrder;
}
