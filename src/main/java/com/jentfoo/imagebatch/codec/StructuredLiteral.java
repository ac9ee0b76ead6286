package com.jentfoo.imagebatch.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class StructuredLiteral {
  private static final JsonMapper MAPPER =
      JsonMapper.builder()
                .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
                .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
                .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
                .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
                .enable(JsonReadFeature.ALLOW_LEADING_DECIMAL_POINT_FOR_NUMBERS)
                .enable(JsonReadFeature.ALLOW_TRAILING_DECIMAL_POINT_FOR_NUMBERS)
                .enable(JsonReadFeature.ALLOW_LEADING_PLUS_SIGN_FOR_NUMBERS)
                .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
                .enable(JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS)
                // one value per option, anything after it is an error
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .build();

  public static JsonNode parse(String literal) {
    if (literal == null || literal.trim().isEmpty()) {
      throw new IllegalArgumentException("Empty configuration literal");
    }

    try {
      return MAPPER.readTree(literal);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid configuration '" + literal + "': " +
                                           e.getOriginalMessage(), e);
    }
  }
}
