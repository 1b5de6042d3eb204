package com.finsync.model;

import java.util.Locale;

public enum AccountKind {
  DEPOSITORY,
  CREDIT,
  LOAN,
  INVESTMENT,
  OTHER;

  public static AccountKind from(String type) {
    if (type == null || type.isBlank()) {
      return OTHER;
    }
    try {
      return valueOf(type.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      return OTHER;
    }
  }
}
