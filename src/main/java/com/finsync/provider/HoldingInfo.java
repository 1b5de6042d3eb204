package com.finsync.provider;

import java.math.BigDecimal;
import java.time.LocalDate;

public record HoldingInfo(
    String providerAccountId,
    String providerSecurityId,
    String securityName,
    String tickerSymbol,
    BigDecimal quantity,
    BigDecimal institutionPrice,
    LocalDate institutionPriceAsOf,
    BigDecimal institutionValue,
    BigDecimal costBasis,
    String currency
) {}
