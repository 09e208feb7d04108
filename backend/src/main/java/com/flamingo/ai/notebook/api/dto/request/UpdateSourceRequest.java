package com.flamingo.ai.notebook.api.dto.request;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for renaming a source. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateSourceRequest {

  @Size(max = 255, message = "Title must be at most 255 characters")
  private String title;
}
