package com.jentfoo.imagebatch.codec;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class CodecOptionTest {
  @Test
  void autoLiteralIsSentinel() {
    assertSame(CodecOption.AUTO, CodecOption.parse("auto"));
    assertSame(CodecOption.AUTO, CodecOption.parse(" AUTO "));
    assertTrue(CodecOption.AUTO.isAuto());
    assertTrue(CodecOption.AUTO.getConfig().isObject());
    assertEquals(0, CodecOption.AUTO.getConfig().size());
    assertEquals("auto", CodecOption.AUTO.toString());
  }

  @Test
  void quotedAutoIsAStructuredValue() {
    CodecOption option = CodecOption.parse("'auto'");

    assertFalse(option.isAuto());
    assertEquals("auto", option.getConfig().asText());
  }

  @Test
  void structuredLiteral() {
    CodecOption option = CodecOption.parse("{quality: 75}");

    assertFalse(option.isAuto());
    assertEquals(75, option.getConfig().get("quality").asInt());
  }

  @Test
  void invalidLiteralFails() {
    assertThrows(IllegalArgumentException.class, () -> CodecOption.parse("{quality"));
  }
}
