package com.flamingo.ai.docstructure.service.structure.qa;

import static org.assertj.core.api.Assertions.assertThat;

import java.awt.Color;
import java.awt.image.BufferedImage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ImageConcatenator Tests")
class ImageConcatenatorTest {

  private static BufferedImage filled(int width, int height, Color color) {
    BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    for (int x = 0; x < width; x++) {
      for (int y = 0; y < height; y++) {
        image.setRGB(x, y, color.getRGB());
      }
    }
    return image;
  }

  @Test
  @DisplayName("should stack images on a canvas as wide as the wider one")
  void shouldStackImages() {
    BufferedImage top = filled(10, 5, Color.RED);
    BufferedImage bottom = filled(20, 7, Color.BLUE);

    BufferedImage result = ImageConcatenator.concat(top, bottom);

    assertThat(result.getWidth()).isEqualTo(20);
    assertThat(result.getHeight()).isEqualTo(12);
    assertThat(result.getRGB(0, 0)).isEqualTo(Color.RED.getRGB());
    assertThat(result.getRGB(0, 5)).isEqualTo(Color.BLUE.getRGB());
    assertThat(result.getRGB(15, 0)).isEqualTo(Color.BLACK.getRGB());
  }

  @Test
  @DisplayName("should return the present image when the other is missing")
  void shouldHandleMissingImages() {
    BufferedImage image = filled(3, 3, Color.GREEN);

    assertThat(ImageConcatenator.concat(null, image)).isSameAs(image);
    assertThat(ImageConcatenator.concat(image, null)).isSameAs(image);
    assertThat(ImageConcatenator.concat(null, null)).isNull();
  }
}
