package com.flamingo.ai.notebook.api.dto.request;

import com.flamingo.ai.notebook.domain.enums.ContextMode;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for choosing how a source or note takes part in chat context. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateContextModeRequest {

  @NotNull(message = "Context mode is required")
  private ContextMode mode;
}
