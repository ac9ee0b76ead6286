package com.jentfoo.imagebatch.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

public class CodecOption {
  public static final String AUTO_LITERAL = "auto";
  public static final CodecOption AUTO = new CodecOption(null);

  private final JsonNode config;

  public static CodecOption parse(String value) {
    if (value.trim().equalsIgnoreCase(AUTO_LITERAL)) {
      return AUTO;
    }

    return new CodecOption(StructuredLiteral.parse(value));
  }

  private CodecOption(JsonNode config) {
    this.config = config;
  }

  public boolean isAuto() {
    return config == null;
  }

  public JsonNode getConfig() {
    if (config == null) {
      return JsonNodeFactory.instance.objectNode();
    }

    return config;
  }

  @Override
  public String toString() {
    return isAuto() ? AUTO_LITERAL : config.toString();
  }
}
