package com.jentfoo.imagebatch.codec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class CodecRegistry {
  // order here is the order preprocessors are applied and outputs are written
  private static final List<CodecDescriptor> PREPROCESSORS;
  private static final List<CodecDescriptor> ENCODERS;

  static {
    List<CodecDescriptor> preprocessors = new ArrayList<CodecDescriptor>(3);
    preprocessors.add(CodecDescriptor.preprocessor("resize", "Resize the image before compressing"));
    preprocessors.add(CodecDescriptor.preprocessor("quant", "Reduce the number of colors used (aka. paletting)"));
    preprocessors.add(CodecDescriptor.preprocessor("rotate", "Rotate image"));
    PREPROCESSORS = Collections.unmodifiableList(preprocessors);

    List<CodecDescriptor> encoders = new ArrayList<CodecDescriptor>(6);
    encoders.add(CodecDescriptor.encoder("mozjpeg", "MozJPEG", "jpg"));
    encoders.add(CodecDescriptor.encoder("webp", "WebP", "webp"));
    encoders.add(CodecDescriptor.encoder("avif", "AVIF", "avif"));
    encoders.add(CodecDescriptor.encoder("jxl", "JPEG-XL", "jxl"));
    encoders.add(CodecDescriptor.encoder("wp2", "WebP2", "wp2"));
    encoders.add(CodecDescriptor.encoder("oxipng", "OxiPNG", "png"));
    ENCODERS = Collections.unmodifiableList(encoders);
  }

  public static List<CodecDescriptor> getPreprocessors() {
    return PREPROCESSORS;
  }

  public static List<CodecDescriptor> getEncoders() {
    return ENCODERS;
  }

  public static CodecDescriptor getPreprocessor(String name) {
    return find(PREPROCESSORS, name);
  }

  public static CodecDescriptor getEncoder(String name) {
    return find(ENCODERS, name);
  }

  private static CodecDescriptor find(List<CodecDescriptor> descriptors, String name) {
    for (CodecDescriptor descriptor : descriptors) {
      if (descriptor.getName().equals(name)) {
        return descriptor;
      }
    }

    throw new IllegalArgumentException("Unknown codec: " + name);
  }
}
