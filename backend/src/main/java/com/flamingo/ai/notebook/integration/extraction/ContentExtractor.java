package com.flamingo.ai.notebook.integration.extraction;

import com.flamingo.ai.notebook.domain.model.SourceOrigin;
import com.flamingo.ai.notebook.exception.ExtractionFailedException;

/** Turns a source origin into plain text. */
public interface ContentExtractor {

  /**
   * Extracts the text of {@code origin}. Implementations block and are expected to honour thread
   * interruption.
   *
   * @throws ExtractionFailedException with {@code transient} set when retrying may succeed
   */
  ExtractedContent extract(SourceOrigin origin);
}
