package com.flamingo.ai.notebook.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.notebook.domain.entity.SourceArtifact;
import com.flamingo.ai.notebook.domain.enums.ArtifactKind;
import com.flamingo.ai.notebook.domain.model.ArtifactValue;
import java.time.LocalDateTime;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a source artifact. Exactly one of text and items is set. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceArtifactResponse {

  private String name;
  private ArtifactKind kind;

  @JsonInclude(JsonInclude.Include.NON_NULL)
  private String text;

  @JsonInclude(JsonInclude.Include.NON_NULL)
  private List<String> items;

  private LocalDateTime updatedAt;

  /** Creates a SourceArtifactResponse from a SourceArtifact entity. */
  public static SourceArtifactResponse fromEntity(SourceArtifact artifact) {
    SourceArtifactResponseBuilder builder =
        SourceArtifactResponse.builder()
            .name(artifact.getName())
            .kind(artifact.getKind())
            .updatedAt(artifact.getUpdatedAt());
    ArtifactValue value = artifact.getValue();
    if (value instanceof ArtifactValue.Text text) {
      builder.text(text.text());
    } else if (value instanceof ArtifactValue.TextList list) {
      builder.items(list.items());
    }
    return builder.build();
  }
}
