package com.jentfoo.imagebatch;

import java.io.File;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

public class ConversionSettings {
  public static final int DEFAULT_MAX_OPTIMIZER_ROUNDS = 6;
  public static final double DEFAULT_BUTTERAUGLI_TARGET = 1.4;

  private final File outputDir;
  private final String suffix;
  private final int maxConcurrentFiles;
  private final int maxOptimizerRounds;
  private final double optimizerButteraugliTarget;
  private final FailurePolicy failurePolicy;
  private final Map<String, String> preprocessorConfigs;
  private final Map<String, String> encoderConfigs;

  public ConversionSettings(File outputDir, String suffix, int maxConcurrentFiles,
                            int maxOptimizerRounds, double optimizerButteraugliTarget,
                            FailurePolicy failurePolicy,
                            Map<String, String> preprocessorConfigs,
                            Map<String, String> encoderConfigs) {
    if (maxConcurrentFiles < 1) {
      throw new IllegalArgumentException("Max concurrent files must be positive: " + maxConcurrentFiles);
    }

    this.outputDir = outputDir;
    this.suffix = suffix == null ? "" : suffix;
    this.maxConcurrentFiles = maxConcurrentFiles;
    this.maxOptimizerRounds = maxOptimizerRounds;
    this.optimizerButteraugliTarget = optimizerButteraugliTarget;
    this.failurePolicy = failurePolicy;
    this.preprocessorConfigs = Collections.unmodifiableMap(new HashMap<String, String>(preprocessorConfigs));
    this.encoderConfigs = Collections.unmodifiableMap(new HashMap<String, String>(encoderConfigs));
  }

  public File getOutputDir() {
    return outputDir;
  }

  public String getSuffix() {
    return suffix;
  }

  public int getMaxConcurrentFiles() {
    return maxConcurrentFiles;
  }

  public int getMaxOptimizerRounds() {
    return maxOptimizerRounds;
  }

  public double getOptimizerButteraugliTarget() {
    return optimizerButteraugliTarget;
  }

  public FailurePolicy getFailurePolicy() {
    return failurePolicy;
  }

  // null when the preprocessor is not enabled
  public String getPreprocessorConfig(String name) {
    return preprocessorConfigs.get(name);
  }

  // null when the encoder is not enabled
  public String getEncoderConfig(String name) {
    return encoderConfigs.get(name);
  }
}
