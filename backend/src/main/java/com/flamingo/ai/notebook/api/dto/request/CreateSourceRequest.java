package com.flamingo.ai.notebook.api.dto.request;

import com.flamingo.ai.notebook.domain.enums.SourceOriginType;
import com.flamingo.ai.notebook.domain.model.SourceOrigin;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for registering a source. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateSourceRequest {

  @NotNull(message = "Type is required")
  private SourceOriginType type;

  /** Pasted text for TEXT sources, Markdown for SCRAPED_PAGE sources. */
  private String content;

  /** Page address for URL sources, original page for SCRAPED_PAGE sources. */
  private String url;

  /** Server-side path for FILE sources. */
  private String filePath;

  private String title;

  /** Transformations applied after extraction; the configured defaults when null. */
  private List<String> applyTransformations;

  /**
   * Builds the typed origin.
   *
   * @throws IllegalArgumentException if the payload the type needs is missing
   */
  public SourceOrigin toOrigin() {
    return switch (type) {
      case URL -> new SourceOrigin.Url(url);
      case FILE -> new SourceOrigin.File(filePath);
      case TEXT -> new SourceOrigin.Text(requireContent());
      case SCRAPED_PAGE -> new SourceOrigin.ScrapedPage(requireContent(), url);
    };
  }

  private String requireContent() {
    if (content == null || content.isBlank()) {
      throw new IllegalArgumentException("content is required for " + type + " sources");
    }
    return content;
  }
}
