package com.jentfoo.imagebatch;

import java.io.File;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.threadly.util.Clock;

import com.jentfoo.imagebatch.pool.WorkerPoolFactory;
import com.jentfoo.imagebatch.progress.ConsoleStyle;
import com.jentfoo.imagebatch.progress.InteractiveProgressReporter;
import com.jentfoo.imagebatch.progress.PlainProgressReporter;
import com.jentfoo.imagebatch.progress.ProgressReporter;
import com.jentfoo.imagebatch.result.ResultAggregator;

public class BatchScheduler {
  private static final Logger log = LoggerFactory.getLogger(BatchScheduler.class);
  // above this the redrawing display glitches and becomes unreadable
  public static final int PRETTY_LOG_LIMIT = 16;

  private final ConversionSettings settings;
  private final WorkerPoolFactory poolFactory;
  private final PrintStream out;
  private final ConsoleStyle style;

  public BatchScheduler(ConversionSettings settings, WorkerPoolFactory poolFactory,
                        PrintStream out, ConsoleStyle style) {
    this.settings = settings;
    this.poolFactory = poolFactory;
    this.out = out;
    this.style = style;
  }

  public static boolean useInteractiveReporter(int fileCount, int maxConcurrentFiles) {
    return fileCount < PRETTY_LOG_LIMIT && fileCount < maxConcurrentFiles;
  }

  public static List<List<File>> partition(List<File> files, int chunkSize) {
    if (chunkSize < 1) {
      throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
    }

    int iterations = (files.size() + chunkSize - 1) / chunkSize;
    List<List<File>> result = new ArrayList<List<File>>(iterations);
    for (int i = 0; i < iterations; i++) {
      int offsetStart = i * chunkSize;
      int offsetEnd = Math.min(files.size(), offsetStart + chunkSize);
      result.add(new ArrayList<File>(files.subList(offsetStart, offsetEnd)));
    }

    return result;
  }

  protected ProgressReporter makeReporter(int fileCount, ResultAggregator results) {
    if (useInteractiveReporter(fileCount, settings.getMaxConcurrentFiles())) {
      return new InteractiveProgressReporter(out, style, results);
    } else {
      return new PlainProgressReporter(out, style, results);
    }
  }

  public BatchSummary processAllFiles(List<File> allFiles) {
    long startTime = Clock.accurateForwardProgressingMillis();
    BatchSummary summary = new BatchSummary();
    if (allFiles.isEmpty()) {
      log.info("No input files to process");

      return summary;
    }

    int maxConcurrentFiles = settings.getMaxConcurrentFiles();
    ResultAggregator results = new ResultAggregator();
    PipelineCoordinator coordinator = new PipelineCoordinator(poolFactory, settings);
    ProgressReporter progress = makeReporter(allFiles.size(), results);

    if (progress instanceof InteractiveProgressReporter) {
      // interactive only ever covers a single chunk
      runChunk(coordinator, allFiles, progress, results, summary);
    } else {
      out.println(style.bold("Will process at most " + maxConcurrentFiles + " files at a time"));

      List<List<File>> chunks = partition(allFiles, maxConcurrentFiles);
      int offsetStart = 0;
      for (int i = 0; i < chunks.size(); i++) {
        List<File> fileBatch = chunks.get(i);
        out.println("Processing batch " + (i + 1) + " of " + chunks.size() + " " +
                      "(images " + (offsetStart + 1) + " through " + (offsetStart + fileBatch.size()) + ")");
        runChunk(coordinator, fileBatch, progress, results, summary);
        out.println();

        offsetStart += fileBatch.size();
      }
    }

    summary.setElapsedMillis(Clock.accurateForwardProgressingMillis() - startTime);
    out.println(style.bold(summary.toString()));

    return summary;
  }

  private static void runChunk(PipelineCoordinator coordinator, List<File> files,
                               ProgressReporter progress, ResultAggregator results,
                               BatchSummary summary) {
    coordinator.processChunk(files, progress, results);

    // results have been reported by the finish call, fold them into the totals before clearing
    summary.addChunk(results.getRecords());
    results.clear();
  }
}
