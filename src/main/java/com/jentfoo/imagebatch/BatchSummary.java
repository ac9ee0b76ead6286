package com.jentfoo.imagebatch;

import java.util.Collection;

import com.jentfoo.imagebatch.progress.SizeFormat;
import com.jentfoo.imagebatch.result.FileResultRecord;
import com.jentfoo.imagebatch.result.OutputArtifact;

public class BatchSummary {
  private int chunkCount;
  private int fileCount;
  private int outputCount;
  private int failedCount;
  private long inputBytes;
  private long outputBytes;
  private long elapsedMillis;

  public BatchSummary() {
    chunkCount = 0;
    fileCount = 0;
    outputCount = 0;
    failedCount = 0;
    inputBytes = 0;
    outputBytes = 0;
    elapsedMillis = 0;
  }

  public void addChunk(Collection<FileResultRecord> records) {
    chunkCount++;
    for (FileResultRecord record : records) {
      fileCount++;
      inputBytes += record.getSize();
      if (record.isFailed()) {
        failedCount++;
      }
      for (OutputArtifact output : record.getOutputs()) {
        outputCount++;
        outputBytes += output.getSize();
      }
    }
  }

  public int getChunkCount() {
    return chunkCount;
  }

  public int getFileCount() {
    return fileCount;
  }

  public int getOutputCount() {
    return outputCount;
  }

  public int getFailedCount() {
    return failedCount;
  }

  public long getInputBytes() {
    return inputBytes;
  }

  public long getOutputBytes() {
    return outputBytes;
  }

  protected void setElapsedMillis(long elapsedMillis) {
    this.elapsedMillis = elapsedMillis;
  }

  @Override
  public String toString() {
    return "Converted " + fileCount + " files into " + outputCount + " outputs" +
             (failedCount > 0 ? " (" + failedCount + " failed)" : "") + ": " +
             SizeFormat.prettyPrintSize(inputBytes) + " → " + SizeFormat.prettyPrintSize(outputBytes) +
             " in " + (elapsedMillis / 1000) + "." + ((elapsedMillis % 1000) / 100) + "s";
  }
}
