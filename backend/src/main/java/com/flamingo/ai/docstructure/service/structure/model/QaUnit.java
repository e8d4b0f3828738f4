package com.flamingo.ai.docstructure.service.structure.model;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * A reconstructed question/answer unit.
 *
 * @param headingPath open headings from root to leaf
 * @param answerText body text collected under the leaf heading
 * @param answerImage pictures collected under the leaf heading, stacked vertically; may be null
 */
public record QaUnit(List<String> headingPath, String answerText, BufferedImage answerImage) {

  /** The heading path joined root first, one heading per line. */
  public String question() {
    return String.join("\n", headingPath);
  }

  /** Question and answer as indexed: the heading path followed by the answer. */
  public String content() {
    return question() + "\n" + answerText;
  }
}
