package com.finsync.provider;

import java.math.BigDecimal;
import java.time.LocalDate;

public record SecurityInfo(
    String providerSecurityId,
    String name,
    String tickerSymbol,
    String securityType,
    BigDecimal closePrice,
    LocalDate closePriceAsOf,
    boolean cashEquivalent,
    String currency
) {}
