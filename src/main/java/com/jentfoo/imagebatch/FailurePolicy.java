package com.jentfoo.imagebatch;

public enum FailurePolicy {
  AbortChunk("abort"),
  SkipFile("skip");

  private final String optionValue;

  private FailurePolicy(String optionValue) {
    this.optionValue = optionValue;
  }

  public static FailurePolicy parse(String value) {
    for (FailurePolicy policy : values()) {
      if (policy.optionValue.equalsIgnoreCase(value) || policy.name().equalsIgnoreCase(value)) {
        return policy;
      }
    }

    throw new IllegalArgumentException("Unknown failure policy: " + value);
  }
}
