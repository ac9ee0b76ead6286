package com.jentfoo.imagebatch.pool.imageio;

import java.awt.image.BufferedImage;

class ImageDistance {
  private static final int MAX_SAMPLES = 250000;

  protected static double distance(BufferedImage a, BufferedImage b) {
    if (a.getWidth() != b.getWidth() || a.getHeight() != b.getHeight()) {
      throw new IllegalArgumentException("Images differ in size: " +
                                           a.getWidth() + "x" + a.getHeight() + " vs " +
                                           b.getWidth() + "x" + b.getHeight());
    }

    long pixels = (long)a.getWidth() * a.getHeight();
    int stride = (int)Math.max(1, Math.ceil(Math.sqrt(pixels / (double)MAX_SAMPLES)));
    double sumSquares = 0;
    long samples = 0;
    for (int y = 0; y < a.getHeight(); y += stride) {
      for (int x = 0; x < a.getWidth(); x += stride) {
        int pa = a.getRGB(x, y);
        int pb = b.getRGB(x, y);
        for (int shift = 0; shift <= 16; shift += 8) {
          int diff = ((pa >> shift) & 0xFF) - ((pb >> shift) & 0xFF);
          sumSquares += diff * diff;
          samples++;
        }
      }
    }
    if (samples == 0) {
      return 0;
    }

    return Math.sqrt(sumSquares / samples) / 255d * 100d;
  }
}
