package com.flamingo.ai.notebook.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for running a transformation on a source. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunTransformationRequest {

  @NotBlank(message = "Transformation name is required")
  private String name;

  private Map<String, String> params;
}
