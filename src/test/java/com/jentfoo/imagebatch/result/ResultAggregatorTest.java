package com.jentfoo.imagebatch.result;

import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ResultAggregatorTest {
  private ResultAggregator results;

  @BeforeEach
  void setup() {
    results = new ResultAggregator();
  }

  private static OutputArtifact artifact(String name, int size) {
    return new OutputArtifact(new byte[size], "webp", null, new File(name));
  }

  @Test
  void recordsAreOrderedByIndex() {
    results.create(2, new File("c"), 30);
    results.create(0, new File("a"), 10);
    results.create(1, new File("b"), 20);

    List<FileResultRecord> records = new ArrayList<FileResultRecord>(results.getRecords());

    assertEquals(3, records.size());
    assertEquals(new File("a"), records.get(0).getFile());
    assertEquals(new File("c"), records.get(2).getFile());
    assertEquals(20, records.get(1).getSize());
  }

  @Test
  void duplicateCreateFails() {
    results.create(0, new File("a"), 10);

    assertThrows(IllegalStateException.class, () -> results.create(0, new File("b"), 10));
  }

  @Test
  void outputsAppendInOrder() {
    results.create(0, new File("a"), 10);

    results.appendOutput(0, artifact("a.webp", 4));
    results.appendOutput(0, artifact("a.avif", 3));

    List<OutputArtifact> outputs = results.get(0).getOutputs();
    assertEquals(2, outputs.size());
    assertEquals(new File("a.webp"), outputs.get(0).getOutputFile());
    assertEquals(3, outputs.get(1).getSize());
  }

  @Test
  void appendWithoutRecordFails() {
    assertThrows(IllegalStateException.class, () -> results.appendOutput(5, artifact("x", 1)));
  }

  @Test
  void failureCreatesMissingRecord() {
    results.recordFailure(3, new File("does-not-exist"), "decode", "corrupt");

    FileResultRecord record = results.get(3);
    assertTrue(record.isFailed());
    assertEquals("decode", record.getFailedStage());
    assertEquals("corrupt", record.getFailureMessage());
    assertEquals(0, record.getSize());
  }

  @Test
  void failureMarksExistingRecord() {
    results.create(0, new File("a"), 10);
    results.appendOutput(0, artifact("a.webp", 4));

    results.recordFailure(0, new File("a"), "encode", "broken");

    assertEquals(1, results.size());
    assertTrue(results.get(0).isFailed());
    assertEquals(1, results.get(0).getOutputs().size());
  }

  @Test
  void clearDropsEverything() {
    results.create(0, new File("a"), 10);
    results.create(1, new File("b"), 10);

    results.clear();

    assertTrue(results.isEmpty());
    assertNull(results.get(0));
    // indexes are reusable by the next chunk
    results.create(0, new File("c"), 10);
  }

  @Test
  void snapshotIsNotLive() {
    results.create(0, new File("a"), 10);
    int before = results.getRecords().size();

    results.create(1, new File("b"), 10);

    assertEquals(1, before);
    assertEquals(2, results.getRecords().size());
  }
}
