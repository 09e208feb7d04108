package com.flamingo.ai.notebook.integration.extraction;

/**
 * Plain text recovered from a source origin.
 *
 * @param text normalized text, never blank
 * @param detectedTitle title found in the document metadata, or {@code null}
 */
public record ExtractedContent(String text, String detectedTitle) {

  public static ExtractedContent of(String text) {
    return new ExtractedContent(text, null);
  }
}
