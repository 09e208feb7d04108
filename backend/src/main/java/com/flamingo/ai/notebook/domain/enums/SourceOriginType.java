package com.flamingo.ai.notebook.domain.enums;

/** Discriminator for the origin columns of a source. */
public enum SourceOriginType {
  URL,
  FILE,
  TEXT,
  SCRAPED_PAGE
}
