package com.flamingo.ai.docstructure.service.structure.qa;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

/** Stacks pictures vertically so an answer carries a single image. */
public final class ImageConcatenator {

  private ImageConcatenator() {}

  /**
   * Places {@code bottom} below {@code top} on a canvas as wide as the wider image.
   *
   * @return the stacked image, the non-null argument if only one is present, or null
   */
  public static BufferedImage concat(BufferedImage top, BufferedImage bottom) {
    if (top == null) {
      return bottom;
    }
    if (bottom == null) {
      return top;
    }
    int width = Math.max(top.getWidth(), bottom.getWidth());
    int height = top.getHeight() + bottom.getHeight();
    BufferedImage canvas = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    Graphics2D graphics = canvas.createGraphics();
    try {
      graphics.drawImage(top, 0, 0, null);
      graphics.drawImage(bottom, 0, top.getHeight(), null);
    } finally {
      graphics.dispose();
    }
    return canvas;
  }
}
