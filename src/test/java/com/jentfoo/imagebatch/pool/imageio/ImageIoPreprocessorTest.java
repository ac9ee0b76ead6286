package com.jentfoo.imagebatch.pool.imageio;

import static org.junit.jupiter.api.Assertions.*;

import java.awt.image.BufferedImage;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.jentfoo.imagebatch.codec.StructuredLiteral;

class ImageIoPreprocessorTest {
  @Test
  void resizeKeepsAspectRatio() {
    BufferedImage image = ImageIoTestUtils.makeGradient(40, 20);

    BufferedImage byWidth = ImageIoPreprocessor.resize(image, StructuredLiteral.parse("{width: 10}"));
    BufferedImage byHeight = ImageIoPreprocessor.resize(image, StructuredLiteral.parse("{height: 10}"));

    assertEquals(10, byWidth.getWidth());
    assertEquals(5, byWidth.getHeight());
    assertEquals(20, byHeight.getWidth());
    assertEquals(10, byHeight.getHeight());
  }

  @Test
  void resizeToExactDimensions() {
    BufferedImage image = ImageIoTestUtils.makeGradient(40, 20);

    BufferedImage result = ImageIoPreprocessor.resize(image,
                                                      StructuredLiteral.parse("{width: 7, height: 9, method: 'triangle'}"));

    assertEquals(7, result.getWidth());
    assertEquals(9, result.getHeight());
  }

  @Test
  void resizeWithoutDimensionsIsNoop() {
    BufferedImage image = ImageIoTestUtils.makeGradient(4, 4);

    assertSame(image, ImageIoPreprocessor.resize(image, StructuredLiteral.parse("{}")));
  }

  @Test
  void rotateClockwise() {
    BufferedImage image = new BufferedImage(3, 2, BufferedImage.TYPE_INT_RGB);
    image.setRGB(0, 0, 0xFF0000);

    BufferedImage once = ImageIoPreprocessor.rotate(image, StructuredLiteral.parse("{numRotations: 1}"));
    BufferedImage twice = ImageIoPreprocessor.rotate(image, StructuredLiteral.parse("{numRotations: 2}"));
    BufferedImage thrice = ImageIoPreprocessor.rotate(image, StructuredLiteral.parse("{numRotations: 3}"));

    assertEquals(2, once.getWidth());
    assertEquals(3, once.getHeight());
    // top left moves to top right after a quarter turn
    assertEquals(0xFF0000, once.getRGB(1, 0) & 0xFFFFFF);
    assertEquals(0xFF0000, twice.getRGB(2, 1) & 0xFFFFFF);
    assertEquals(0xFF0000, thrice.getRGB(0, 2) & 0xFFFFFF);
    assertSame(image, ImageIoPreprocessor.rotate(image, StructuredLiteral.parse("{numRotations: 4}")));
  }

  @Test
  void quantizeLimitsChannelLevels() {
    BufferedImage image = ImageIoTestUtils.makeGradient(64, 1);

    // cube root of 8 gives two levels per channel
    BufferedImage result = ImageIoPreprocessor.quantize(image, StructuredLiteral.parse("{numColors: 8}"));

    for (int x = 0; x < result.getWidth(); x++) {
      int red = (result.getRGB(x, 0) >> 16) & 0xFF;
      assertTrue(red == 0 || red == 255, "unexpected level " + red);
    }
  }

  @Test
  void appliesInTableOrder() {
    Map<String, JsonNode> options = new LinkedHashMap<String, JsonNode>();
    // rotate listed first but resize runs first
    options.put("rotate", StructuredLiteral.parse("{numRotations: 1}"));
    options.put("resize", StructuredLiteral.parse("{width: 10}"));

    BufferedImage result = ImageIoPreprocessor.apply(ImageIoTestUtils.makeGradient(40, 20), options);

    assertEquals(5, result.getWidth());
    assertEquals(10, result.getHeight());
  }

  @Test
  void unknownPreprocessorFails() {
    Map<String, JsonNode> options =
        Collections.singletonMap("sharpen", StructuredLiteral.parse("{}"));

    assertThrows(IllegalArgumentException.class, () -> {
      ImageIoPreprocessor.apply(ImageIoTestUtils.makeGradient(2, 2), options);
    });
  }
}
