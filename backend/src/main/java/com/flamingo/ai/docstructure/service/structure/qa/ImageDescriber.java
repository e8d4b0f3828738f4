package com.flamingo.ai.docstructure.service.structure.qa;

import java.awt.image.BufferedImage;

/** Turns an embedded picture into text for the answer it belongs to. */
@FunctionalInterface
public interface ImageDescriber {

  /**
   * Describes the image.
   *
   * @param image picture embedded in a paragraph
   * @return extracted text
   * @throws RuntimeException on any collaborator failure; callers fall back to keeping the image
   */
  String describe(BufferedImage image);
}
