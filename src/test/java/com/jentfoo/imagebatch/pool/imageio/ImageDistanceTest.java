package com.jentfoo.imagebatch.pool.imageio;

import static org.junit.jupiter.api.Assertions.*;

import java.awt.image.BufferedImage;

import org.junit.jupiter.api.Test;

class ImageDistanceTest {
  @Test
  void identicalImagesHaveNoDistance() {
    assertEquals(0, ImageDistance.distance(ImageIoTestUtils.makeGradient(10, 10),
                                           ImageIoTestUtils.makeGradient(10, 10)), 0);
  }

  @Test
  void differentImagesHavePositiveDistance() {
    BufferedImage black = new BufferedImage(4, 4, BufferedImage.TYPE_INT_RGB);

    assertTrue(ImageDistance.distance(ImageIoTestUtils.makeGradient(4, 4), black) > 0);
  }

  @Test
  void sizeMismatchFails() {
    assertThrows(IllegalArgumentException.class, () -> {
      ImageDistance.distance(ImageIoTestUtils.makeGradient(4, 4), ImageIoTestUtils.makeGradient(4, 5));
    });
  }
}
