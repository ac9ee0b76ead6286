package com.jentfoo.imagebatch.progress;

import java.io.File;

/**
 * Receives the status and progress of a running chunk.  Implementations may be driven by several
 * chunks in sequence, and may be invoked from pool threads.
 */
public interface ProgressReporter {
  /**
   * Offsets that let the decode and encode phases of a chunk share one completeness fraction.
   *
   * @return mutable progress offsets for this reporter
   */
  public ProgressState getProgressState();

  public void setStatus(String text);

  /**
   * Reports progress within the current phase.
   *
   * @param done number of completed items in the phase
   * @param total number of items in the phase known so far
   * @param currentFile file which just completed, or {@code null} if none
   */
  public void setProgress(int done, int total, File currentFile);

  /**
   * Invoked once a chunk has completed, while the chunk's results are still available.
   *
   * @param summaryText heading for the results
   */
  public void finish(String summaryText);
}
