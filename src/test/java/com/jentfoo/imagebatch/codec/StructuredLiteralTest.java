package com.jentfoo.imagebatch.codec;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;

class StructuredLiteralTest {
  @Test
  void parsesRelaxedSyntax() {
    JsonNode node = StructuredLiteral.parse("{width: 1200, 'method': 'lanczos3', premultiply: true,}");

    assertEquals(1200, node.get("width").asInt());
    assertEquals("lanczos3", node.get("method").asText());
    assertTrue(node.get("premultiply").asBoolean());
  }

  @Test
  void parsesStrictJson() {
    JsonNode node = StructuredLiteral.parse("{\"quality\": 60, \"nested\": {\"a\": [1, 2]}}");

    assertEquals(60, node.get("quality").asInt());
    assertEquals(2, node.get("nested").get("a").size());
  }

  @Test
  void parsesEmptyObject() {
    JsonNode node = StructuredLiteral.parse("{}");

    assertTrue(node.isObject());
    assertEquals(0, node.size());
  }

  @Test
  void rejectsMalformedLiteral() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> {
      StructuredLiteral.parse("{width: ");
    });

    assertTrue(e.getMessage().startsWith("Invalid configuration"), e.getMessage());
  }

  @Test
  void rejectsTrailingContent() {
    assertThrows(IllegalArgumentException.class, () -> StructuredLiteral.parse("{width: 100}} garbage"));
    assertThrows(IllegalArgumentException.class, () -> StructuredLiteral.parse("{width: 100} {height: 5}"));
  }

  @Test
  void rejectsEmptyLiteral() {
    assertThrows(IllegalArgumentException.class, () -> StructuredLiteral.parse("  "));
  }
}
