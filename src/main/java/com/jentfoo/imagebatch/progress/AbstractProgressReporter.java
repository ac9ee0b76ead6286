package com.jentfoo.imagebatch.progress;

import java.io.PrintStream;

import com.jentfoo.imagebatch.result.FileResultRecord;
import com.jentfoo.imagebatch.result.ResultAggregator;

abstract class AbstractProgressReporter implements ProgressReporter {
  protected final PrintStream out;
  protected final ConsoleStyle style;
  protected final ResultAggregator results;
  protected final ProgressState progressState;

  protected AbstractProgressReporter(PrintStream out, ConsoleStyle style, ResultAggregator results) {
    this.out = out;
    this.style = style;
    this.results = results;
    this.progressState = new ProgressState();
  }

  @Override
  public ProgressState getProgressState() {
    return progressState;
  }

  protected String failureText(FileResultRecord record) {
    return "failed during " + record.getFailedStage() + ": " + record.getFailureMessage();
  }
}
