package com.jentfoo.imagebatch.codec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class EncodeJob {
  private final int maxOptimizerRounds;
  private final double optimizerButteraugliTarget;
  private final Map<String, CodecOption> encoderOptions;

  public EncodeJob(int maxOptimizerRounds, double optimizerButteraugliTarget,
                   Map<String, CodecOption> encoderOptions) {
    this.maxOptimizerRounds = maxOptimizerRounds;
    this.optimizerButteraugliTarget = optimizerButteraugliTarget;
    this.encoderOptions = Collections.unmodifiableMap(new LinkedHashMap<String, CodecOption>(encoderOptions));
  }

  public int getMaxOptimizerRounds() {
    return maxOptimizerRounds;
  }

  public double getOptimizerButteraugliTarget() {
    return optimizerButteraugliTarget;
  }

  public Map<String, CodecOption> getEncoderOptions() {
    return encoderOptions;
  }
}
