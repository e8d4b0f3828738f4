package com.flamingo.ai.docstructure.service.structure.model;

import java.awt.image.BufferedImage;

/**
 * One paragraph of a hierarchical (Word) source.
 *
 * @param text paragraph text
 * @param headingLevel heading level from the paragraph style, 0 for body text
 * @param image first picture embedded in the paragraph, or {@code null}
 * @param pageBreaks number of runs that end a page inside this paragraph
 */
public record DocParagraph(String text, int headingLevel, BufferedImage image, int pageBreaks) {

  public static DocParagraph body(String text) {
    return new DocParagraph(text, 0, null, 0);
  }

  public static DocParagraph heading(String text, int level) {
    return new DocParagraph(text, level, null, 0);
  }
}
