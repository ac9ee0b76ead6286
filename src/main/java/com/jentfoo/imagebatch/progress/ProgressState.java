package com.jentfoo.imagebatch.progress;

public class ProgressState {
  private volatile int progressOffset;
  private volatile int totalOffset;

  public ProgressState() {
    reset();
  }

  public void reset() {
    progressOffset = 0;
    totalOffset = 0;
  }

  public int getProgressOffset() {
    return progressOffset;
  }

  public void setProgressOffset(int progressOffset) {
    this.progressOffset = progressOffset;
  }

  public int getTotalOffset() {
    return totalOffset;
  }

  public void setTotalOffset(int totalOffset) {
    this.totalOffset = totalOffset;
  }

  public double completeness(int done, int total) {
    int denominator = totalOffset + total;
    if (denominator <= 0) {
      return 0;
    }

    double result = (progressOffset + done) / (double)denominator;
    if (result < 0) {
      return 0;
    } else if (result > 1) {
      return 1;
    } else {
      return result;
    }
  }
}
