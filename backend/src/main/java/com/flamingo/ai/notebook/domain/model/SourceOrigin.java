package com.flamingo.ai.notebook.domain.model;

import com.flamingo.ai.notebook.domain.enums.SourceOriginType;
import java.util.Objects;

/**
 * Where the material of a source comes from. One record per origin type, each carrying only the
 * payload that type needs.
 */
public sealed interface SourceOrigin
    permits SourceOrigin.Url, SourceOrigin.File, SourceOrigin.Text, SourceOrigin.ScrapedPage {

  /** Returns the persisted discriminator for this origin. */
  SourceOriginType type();

  /** Remote page or document to fetch. */
  record Url(String url) implements SourceOrigin {
    public Url {
      requireText(url, "url");
    }

    @Override
    public SourceOriginType type() {
      return SourceOriginType.URL;
    }
  }

  /** File stored on the server's filesystem. */
  record File(String path) implements SourceOrigin {
    public File {
      requireText(path, "path");
    }

    @Override
    public SourceOriginType type() {
      return SourceOriginType.FILE;
    }
  }

  /** Text pasted directly by the user. */
  record Text(String text) implements SourceOrigin {
    public Text {
      Objects.requireNonNull(text, "text must not be null");
    }

    @Override
    public SourceOriginType type() {
      return SourceOriginType.TEXT;
    }
  }

  /** Markdown produced by an earlier scrape, with the page it was scraped from. */
  record ScrapedPage(String markdown, String sourceUrl) implements SourceOrigin {
    public ScrapedPage {
      Objects.requireNonNull(markdown, "markdown must not be null");
    }

    @Override
    public SourceOriginType type() {
      return SourceOriginType.SCRAPED_PAGE;
    }
  }

  private static void requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(field + " must not be blank");
    }
  }
}
