package com.flamingo.ai.notebook.api.dto.request;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for updating a notebook. Null fields are left unchanged. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateNotebookRequest {

  @Size(min = 1, max = 255, message = "Name must be between 1 and 255 characters")
  private String name;

  private String description;

  private Boolean archived;
}
