package com.jentfoo.imagebatch.pool;

public class DecodedImage {
  private final long size;
  private final int width;
  private final int height;

  public DecodedImage(long size, int width, int height) {
    this.size = size;
    this.width = width;
    this.height = height;
  }

  public long getSize() {
    return size;
  }

  public int getWidth() {
    return width;
  }

  public int getHeight() {
    return height;
  }
}
