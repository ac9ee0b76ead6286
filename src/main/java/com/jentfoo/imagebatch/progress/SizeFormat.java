package com.jentfoo.imagebatch.progress;

import java.util.Locale;

public class SizeFormat {
  private static final String[] SUFFIX = { "B", "KB", "MB" };

  public static String prettyPrintSize(long size) {
    int index = 0;
    if (size > 0) {
      index = Math.min(SUFFIX.length - 1, (63 - Long.numberOfLeadingZeros(size)) / 10);
    }

    return String.format(Locale.ROOT, "%.2f", size / Math.pow(2, 10 * index)) + SUFFIX[index];
  }

  public static String percentOf(long outputSize, long originalSize) {
    if (originalSize <= 0) {
      return "n/a";
    }

    return String.format(Locale.ROOT, "%.3g", (outputSize / (double)originalSize) * 100);
  }
}
