package com.jentfoo.imagebatch;

import java.io.File;

public class StageFailedException extends RuntimeException {
  private static final long serialVersionUID = -4372110826935087361L;

  private final PipelineStage stage;
  private final File file;

  public StageFailedException(PipelineStage stage, File file, Throwable cause) {
    super(stage.getDisplayName() + " failed" + (file == null ? "" : " for " + file.getPath()) +
            (cause == null ? "" : ": " + cause.getMessage()),
          cause);

    this.stage = stage;
    this.file = file;
  }

  public PipelineStage getStage() {
    return stage;
  }

  // null if the failing file could not be identified
  public File getFile() {
    return file;
  }
}
