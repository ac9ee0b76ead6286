package com.jentfoo.imagebatch.result;

import java.io.File;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

public class ResultAggregator {
  private final Map<Integer, FileResultRecord> records = new TreeMap<Integer, FileResultRecord>();

  public synchronized FileResultRecord create(int index, File file, long size) {
    FileResultRecord record = records.get(index);
    if (record != null) {
      throw new IllegalStateException("Result already recorded for image " + index + ": " + record.getFile());
    }

    record = new FileResultRecord(file, size);
    records.put(index, record);

    return record;
  }

  public synchronized FileResultRecord get(int index) {
    return records.get(index);
  }

  public void appendOutput(int index, OutputArtifact output) {
    FileResultRecord record = get(index);
    if (record == null) {
      throw new IllegalStateException("No decoded image for index: " + index);
    }

    record.addOutput(output);
  }

  public synchronized void recordFailure(int index, File file, String stage, String message) {
    FileResultRecord record = records.get(index);
    if (record == null) {
      record = new FileResultRecord(file, file.length());
      records.put(index, record);
    }

    record.markFailed(stage, message);
  }

  public synchronized Collection<FileResultRecord> getRecords() {
    return Collections.unmodifiableList(new ArrayList<FileResultRecord>(records.values()));
  }

  public synchronized int size() {
    return records.size();
  }

  public synchronized boolean isEmpty() {
    return records.isEmpty();
  }

  public synchronized void clear() {
    records.clear();
  }
}
