package com.flamingo.ai.notebook.service.transformation;

import com.flamingo.ai.notebook.domain.enums.ArtifactKind;
import com.flamingo.ai.notebook.domain.model.ArtifactValue;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Converts raw model output into an artifact value of the transformation's kind. */
final class ArtifactOutputParser {

  private static final Pattern LIST_ITEM =
      Pattern.compile("^\\s*(?:[-*•+]|\\d+[.)])\\s+(.*\\S)\\s*$");

  private ArtifactOutputParser() {}

  static ArtifactValue parse(String output, ArtifactKind kind) {
    String text = output == null ? "" : output.strip();
    if (kind == ArtifactKind.LIST) {
      return new ArtifactValue.TextList(parseItems(text));
    }
    return new ArtifactValue.Text(text);
  }

  /**
   * Bullet or numbered lines become items. Output without any such line falls back to one item per
   * non-blank line.
   */
  static List<String> parseItems(String text) {
    List<String> bullets = new ArrayList<>();
    List<String> lines = new ArrayList<>();
    for (String line : text.split("\\R")) {
      if (line.isBlank()) {
        continue;
      }
      lines.add(line.strip());
      Matcher matcher = LIST_ITEM.matcher(line);
      if (matcher.matches()) {
        bullets.add(matcher.group(1).strip());
      }
    }
    return bullets.isEmpty() ? lines : bullets;
  }
}
