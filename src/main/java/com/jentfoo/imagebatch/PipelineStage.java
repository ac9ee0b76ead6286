package com.jentfoo.imagebatch;

public enum PipelineStage {
  Decode, Preprocess, Encode;

  public String getDisplayName() {
    return name().toLowerCase();
  }
}
