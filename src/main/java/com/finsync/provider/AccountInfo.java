package com.finsync.provider;

import java.math.BigDecimal;

public record AccountInfo(
    String providerAccountId,
    String name,
    String accountType,
    String accountSubtype,
    String mask,
    BigDecimal currentBalance,
    BigDecimal availableBalance,
    BigDecimal creditLimit,
    boolean asset,
    String currency
) {
  /** Current balance, else available balance, else zero. */
  public BigDecimal effectiveBalance() {
    if (currentBalance != null) {
      return currentBalance;
    }
    if (availableBalance != null) {
      return availableBalance;
    }
    return BigDecimal.ZERO;
  }
}
