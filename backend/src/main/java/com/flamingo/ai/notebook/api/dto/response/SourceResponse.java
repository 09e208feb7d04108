package com.flamingo.ai.notebook.api.dto.response;

import com.flamingo.ai.notebook.domain.entity.Source;
import com.flamingo.ai.notebook.domain.enums.ContextMode;
import com.flamingo.ai.notebook.domain.enums.SourceOriginType;
import com.flamingo.ai.notebook.domain.enums.SourceStatus;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for source data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceResponse {

  private UUID id;
  private UUID notebookId;
  private SourceOriginType type;
  private String url;
  private String filePath;
  private String title;
  private SourceStatus status;
  private String errorDetail;
  private ContextMode contextMode;
  private boolean contentExtracted;
  private int contentLength;
  private List<SourceArtifactResponse> artifacts;
  private LocalDateTime createdAt;
  private LocalDateTime updatedAt;
  private LocalDateTime processedAt;

  /** Creates a SourceResponse from a Source entity, artifacts included. */
  public static SourceResponse fromEntity(Source source) {
    return SourceResponse.builder()
        .id(source.getId())
        .notebookId(source.getNotebook() != null ? source.getNotebook().getId() : null)
        .type(source.getOriginType())
        .url(source.getOriginUrl())
        .filePath(source.getOriginFilePath())
        .title(source.getTitle())
        .status(source.getStatus())
        .errorDetail(source.getErrorDetail())
        .contextMode(source.getContextMode())
        .contentExtracted(source.hasExtractedContent())
        .contentLength(source.hasExtractedContent() ? source.getFullText().length() : 0)
        .artifacts(source.getArtifacts().stream().map(SourceArtifactResponse::fromEntity).toList())
        .createdAt(source.getCreatedAt())
        .updatedAt(source.getUpdatedAt())
        .processedAt(source.getProcessedAt())
        .build();
  }
}
