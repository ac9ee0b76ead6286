package com.jentfoo.imagebatch.progress;

import java.io.File;
import java.io.PrintStream;

import org.threadly.concurrent.SingleThreadScheduler;

import com.jentfoo.imagebatch.result.FileResultRecord;
import com.jentfoo.imagebatch.result.OutputArtifact;
import com.jentfoo.imagebatch.result.ResultAggregator;

public class InteractiveProgressReporter extends AbstractProgressReporter {
  private static final String ERASE_LINE = "\r\u001B[2K";
  private static final String[] SPINNER_FRAMES = { "⠋", "⠙", "⠹", "⠸", "⠼", "⠴", "⠦", "⠧", "⠇", "⠏" };
  private static final int BAR_WIDTH = 10;
  private static final int SPINNER_INTERVAL_MILLIS = 80;

  private int frame;
  private String status;
  private String counter;
  private String progress;
  private double lastCompleteness;
  private SingleThreadScheduler ticker;  // only while the line is live

  public InteractiveProgressReporter(PrintStream out, ConsoleStyle style, ResultAggregator results) {
    super(out, style, results);

    frame = 0;
    status = "";
    counter = "";
    progress = "";
    lastCompleteness = 0;
  }

  @Override
  public synchronized void setStatus(String text) {
    status = text == null ? "" : text;
    redraw();
  }

  @Override
  public synchronized void setProgress(int done, int total, File currentFile) {
    counter = style.dim(done + "/" + total);
    lastCompleteness = progressState.completeness(done, total);
    progress = style.cyan(makeBar(lastCompleteness)) + " ";
    redraw();
  }

  public synchronized double getLastCompleteness() {
    return lastCompleteness;
  }

  protected static String makeBar(double completeness) {
    int filled = Math.max(0, Math.min(BAR_WIDTH, (int)(completeness * BAR_WIDTH)));
    StringBuilder sb = new StringBuilder(BAR_WIDTH + 2);
    sb.append('▐');
    for (int i = 0; i < BAR_WIDTH; i++) {
      sb.append(i < filled ? '▨' : '╌');
    }
    sb.append('▌');

    return sb.toString();
  }

  // without ansi support nothing is shown until finish
  private void redraw() {
    if (! style.isEnabled()) {
      return;
    }

    if (ticker == null) {
      ticker = new SingleThreadScheduler(true);
      ticker.scheduleWithFixedDelay(new Runnable() {
        @Override
        public void run() {
          tick();
        }
      }, SPINNER_INTERVAL_MILLIS, SPINNER_INTERVAL_MILLIS);
    }
    update();
  }

  private synchronized void tick() {
    if (ticker != null) {
      update();
    }
  }

  private void update() {
    frame = (frame + 1) % SPINNER_FRAMES.length;
    out.print(ERASE_LINE + style.cyan(SPINNER_FRAMES[frame]) + " " +
                (counter.isEmpty() ? "" : counter + " ") + progress + style.bold(status));
    out.flush();
  }

  @Override
  public synchronized void finish(String summaryText) {
    if (ticker != null) {
      ticker.shutdownNow();
      ticker = null;
    }
    if (style.isEnabled()) {
      out.print(ERASE_LINE);
    }
    out.println(style.green("✔") + " " + style.bold(summaryText) + getResultsText());
    out.flush();
  }

  private String getResultsText() {
    StringBuilder sb = new StringBuilder();
    for (FileResultRecord record : results.getRecords()) {
      sb.append("\n ").append(style.cyan(record.getFile().getPath()))
        .append(": ").append(SizeFormat.prettyPrintSize(record.getSize()));
      for (OutputArtifact output : record.getOutputs()) {
        String percent = SizeFormat.percentOf(output.getSize(), record.getSize()) + "%";
        sb.append("\n  ").append(style.dim("└")).append(' ')
          .append(style.cyan(padEnd(output.getOutputFile().getPath(), 5)))
          .append(" → ").append(SizeFormat.prettyPrintSize(output.getSize()))
          .append(" (")
          .append(output.getSize() > record.getSize() ? style.red(percent) : style.green(percent))
          .append(')');
        if (output.getInfoText() != null) {
          sb.append(style.yellow(output.getInfoText()));
        }
      }
      if (record.isFailed()) {
        sb.append("\n  ").append(style.dim("└")).append(' ').append(style.red(failureText(record)));
      }
    }

    return sb.toString();
  }

  private static String padEnd(String text, int length) {
    StringBuilder sb = new StringBuilder(text);
    while (sb.length() < length) {
      sb.append(' ');
    }

    return sb.toString();
  }
}
