package com.jentfoo.imagebatch.pool.imageio;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.jentfoo.imagebatch.codec.CodecDescriptor;
import com.jentfoo.imagebatch.codec.CodecRegistry;

class ImageIoPreprocessor {
  private static final int DEFAULT_COLORS = 255;

  protected static BufferedImage apply(BufferedImage image, Map<String, JsonNode> optionsByName) {
    for (String name : optionsByName.keySet()) {
      CodecRegistry.getPreprocessor(name);  // throws for unknown names
    }

    BufferedImage result = image;
    for (CodecDescriptor descriptor : CodecRegistry.getPreprocessors()) {
      JsonNode options = optionsByName.get(descriptor.getName());
      if (options == null) {
        continue;
      }

      if ("resize".equals(descriptor.getName())) {
        result = resize(result, options);
      } else if ("quant".equals(descriptor.getName())) {
        result = quantize(result, options);
      } else if ("rotate".equals(descriptor.getName())) {
        result = rotate(result, options);
      } else {
        throw new UnsupportedOperationException("Unhandled preprocessor: " + descriptor.getName());
      }
    }

    return result;
  }

  protected static BufferedImage resize(BufferedImage image, JsonNode options) {
    int width = options.path("width").asInt(0);
    int height = options.path("height").asInt(0);
    if (width <= 0 && height <= 0) {
      return image;
    } else if (width <= 0) {
      width = Math.max(1, (int)Math.round(height * image.getWidth() / (double)image.getHeight()));
    } else if (height <= 0) {
      height = Math.max(1, (int)Math.round(width * image.getHeight() / (double)image.getWidth()));
    }

    Object interpolation;
    String method = options.path("method").asText("lanczos3");
    if ("triangle".equalsIgnoreCase(method)) {
      interpolation = RenderingHints.VALUE_INTERPOLATION_BILINEAR;
    } else if ("nearestNeighbor".equalsIgnoreCase(method)) {
      interpolation = RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR;
    } else {
      interpolation = RenderingHints.VALUE_INTERPOLATION_BICUBIC;
    }

    BufferedImage result = new BufferedImage(width, height, targetType(image));
    Graphics2D g = result.createGraphics();
    try {
      g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, interpolation);
      g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
      g.drawImage(image, 0, 0, width, height, null);
    } finally {
      g.dispose();
    }

    return result;
  }

  protected static BufferedImage quantize(BufferedImage image, JsonNode options) {
    int numColors = Math.max(2, Math.min(256, options.path("numColors").asInt(DEFAULT_COLORS)));
    int levels = Math.max(2, (int)Math.round(Math.cbrt(numColors)));
    double step = 255d / (levels - 1);

    BufferedImage result = new BufferedImage(image.getWidth(), image.getHeight(), targetType(image));
    for (int y = 0; y < image.getHeight(); y++) {
      for (int x = 0; x < image.getWidth(); x++) {
        int argb = image.getRGB(x, y);
        int a = (argb >>> 24) & 0xFF;
        int r = posterize((argb >> 16) & 0xFF, step);
        int g = posterize((argb >> 8) & 0xFF, step);
        int b = posterize(argb & 0xFF, step);
        result.setRGB(x, y, (a << 24) | (r << 16) | (g << 8) | b);
      }
    }

    return result;
  }

  private static int posterize(int channel, double step) {
    return Math.min(255, (int)Math.round(Math.round(channel / step) * step));
  }

  protected static BufferedImage rotate(BufferedImage image, JsonNode options) {
    int turns = ((options.path("numRotations").asInt(0) % 4) + 4) % 4;
    if (turns == 0) {
      return image;
    }

    int width = image.getWidth();
    int height = image.getHeight();
    BufferedImage result;
    if (turns % 2 == 0) {
      result = new BufferedImage(width, height, targetType(image));
    } else {
      result = new BufferedImage(height, width, targetType(image));
    }
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        int argb = image.getRGB(x, y);
        switch (turns) {
          case 1:
            result.setRGB(height - 1 - y, x, argb);
            break;
          case 2:
            result.setRGB(width - 1 - x, height - 1 - y, argb);
            break;
          case 3:
            result.setRGB(y, width - 1 - x, argb);
            break;
          default:
            throw new IllegalStateException("Unexpected rotation: " + turns);
        }
      }
    }

    return result;
  }

  private static int targetType(BufferedImage image) {
    return image.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
  }
}
