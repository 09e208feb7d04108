package com.flamingo.ai.notebook.api.dto.response;

import com.flamingo.ai.notebook.domain.enums.ArtifactKind;
import com.flamingo.ai.notebook.service.transformation.Transformation;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a transformation in the catalog. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransformationResponse {

  private String name;
  private String description;
  private ArtifactKind outputKind;
  private Map<String, String> defaultParams;

  /** Creates a TransformationResponse from a catalog entry. */
  public static TransformationResponse from(Transformation transformation) {
    return TransformationResponse.builder()
        .name(transformation.name())
        .description(transformation.description())
        .outputKind(transformation.outputKind())
        .defaultParams(transformation.defaultParams())
        .build();
  }
}
