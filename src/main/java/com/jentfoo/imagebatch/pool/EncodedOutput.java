package com.jentfoo.imagebatch.pool;

public class EncodedOutput {
  private final byte[] binary;
  private final String extension;
  private final String infoText;

  public EncodedOutput(byte[] binary, String extension, String infoText) {
    this.binary = binary;
    this.extension = extension;
    this.infoText = infoText;
  }

  public byte[] getBinary() {
    return binary;
  }

  public String getExtension() {
    return extension;
  }

  public long getSize() {
    return binary.length;
  }

  // may be null
  public String getInfoText() {
    return infoText;
  }
}
