package com.jentfoo.imagebatch.progress;

import java.io.File;
import java.io.PrintStream;

import com.jentfoo.imagebatch.result.FileResultRecord;
import com.jentfoo.imagebatch.result.ResultAggregator;

public class PlainProgressReporter extends AbstractProgressReporter {
  public PlainProgressReporter(PrintStream out, ConsoleStyle style, ResultAggregator results) {
    super(out, style, results);
  }

  @Override
  public synchronized void setStatus(String text) {
    out.println(style.bold("Status:") + " " + (text == null ? "" : text));
  }

  @Override
  public synchronized void setProgress(int done, int total, File currentFile) {
    if (currentFile != null) {
      out.println("Progress: " + done + "/" + total + " (" + currentFile.getPath() + ")");
    } else {
      out.println("Working...");
    }
  }

  @Override
  public synchronized void finish(String summaryText) {
    for (FileResultRecord record : results.getRecords()) {
      if (record.isFailed()) {
        out.println(style.red("Failed: " + record.getFile().getPath() + " " + failureText(record)));
      }
    }
    out.println("Processing complete.");
  }
}
