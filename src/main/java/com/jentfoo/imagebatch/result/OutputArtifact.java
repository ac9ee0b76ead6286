package com.jentfoo.imagebatch.result;

import java.io.File;

public class OutputArtifact {
  private final byte[] binary;
  private final String extension;
  private final String infoText;
  private final File outputFile;

  public OutputArtifact(byte[] binary, String extension, String infoText, File outputFile) {
    this.binary = binary;
    this.extension = extension;
    this.infoText = infoText;
    this.outputFile = outputFile;
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

  public String getInfoText() {
    return infoText;
  }

  public File getOutputFile() {
    return outputFile;
  }
}
