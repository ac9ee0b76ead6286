package com.jentfoo.imagebatch.result;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class FileResultRecord {
  private final File file;
  private final List<OutputArtifact> outputs;
  private final long size;
  private volatile String failedStage;
  private volatile String failureMessage;

  public FileResultRecord(File file, long size) {
    this.file = file;
    this.size = size;
    this.outputs = new ArrayList<OutputArtifact>(2);
    this.failedStage = null;
    this.failureMessage = null;
  }

  public File getFile() {
    return file;
  }

  public long getSize() {
    return size;
  }

  public void addOutput(OutputArtifact output) {
    synchronized (outputs) {
      outputs.add(output);
    }
  }

  public List<OutputArtifact> getOutputs() {
    synchronized (outputs) {
      return Collections.unmodifiableList(new ArrayList<OutputArtifact>(outputs));
    }
  }

  public boolean isFailed() {
    return failedStage != null;
  }

  public String getFailedStage() {
    return failedStage;
  }

  public String getFailureMessage() {
    return failureMessage;
  }

  protected void markFailed(String stage, String message) {
    this.failedStage = stage;
    this.failureMessage = message;
  }
}
