package com.jentfoo.imagebatch.codec;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

class CodecRegistryTest {
  private static List<String> names(List<CodecDescriptor> descriptors) {
    List<String> result = new ArrayList<String>(descriptors.size());
    for (CodecDescriptor descriptor : descriptors) {
      result.add(descriptor.getName());
    }

    return result;
  }

  @Test
  void tableOrder() {
    assertEquals(Arrays.asList("resize", "quant", "rotate"), names(CodecRegistry.getPreprocessors()));
    assertEquals(Arrays.asList("mozjpeg", "webp", "avif", "jxl", "wp2", "oxipng"),
                 names(CodecRegistry.getEncoders()));
  }

  @Test
  void encoderExtensions() {
    assertEquals("jpg", CodecRegistry.getEncoder("mozjpeg").getExtension());
    assertEquals("png", CodecRegistry.getEncoder("oxipng").getExtension());
    assertEquals("webp", CodecRegistry.getEncoder("webp").getExtension());
    assertNull(CodecRegistry.getPreprocessor("resize").getExtension());
  }

  @Test
  void extensionAliasOnlyWhenNameDiffers() {
    assertEquals("jpg", CodecRegistry.getEncoder("mozjpeg").getExtensionAlias());
    assertEquals("png", CodecRegistry.getEncoder("oxipng").getExtensionAlias());
    assertNull(CodecRegistry.getEncoder("avif").getExtensionAlias());
    assertNull(CodecRegistry.getPreprocessor("quant").getExtensionAlias());
  }

  @Test
  void encoderDescription() {
    assertEquals("Use MozJPEG to generate a .jpg file with the given configuration",
                 CodecRegistry.getEncoder("mozjpeg").getDescription());
  }

  @Test
  void unknownCodecFails() {
    assertThrows(IllegalArgumentException.class, () -> CodecRegistry.getEncoder("gif"));
    assertThrows(IllegalArgumentException.class, () -> CodecRegistry.getPreprocessor("mozjpeg"));
  }

  @Test
  void tablesAreUnmodifiable() {
    assertThrows(UnsupportedOperationException.class, () -> CodecRegistry.getEncoders().clear());
  }
}
