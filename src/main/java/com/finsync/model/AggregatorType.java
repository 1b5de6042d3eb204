package com.finsync.model;

import java.util.Arrays;
import java.util.Locale;

public enum AggregatorType {
  PLAID("plaid"),
  FINICITY("finicity"),
  YODLEE("yodlee"),
  MX("mx"),
  AKOYA("akoya");

  private final String tag;

  AggregatorType(String tag) {
    this.tag = tag;
  }

  public String getTag() {
    return tag;
  }

  public static AggregatorType fromTag(String tag) {
    if (tag == null || tag.isBlank()) {
      throw new IllegalArgumentException("Provider tag is required");
    }
    String normalized = tag.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(type -> type.tag.equals(normalized))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown provider: " + tag));
  }
}
