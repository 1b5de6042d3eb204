package com.finsync.provider;

import java.math.BigDecimal;
import java.time.LocalDate;

public record TransactionInfo(
    String providerTransactionId,
    String providerAccountId,
    BigDecimal amount,
    String currency,
    LocalDate date,
    LocalDate authorizedDate,
    String name,
    String merchantName,
    String categoryPrimary,
    String categoryDetailed,
    String paymentChannel,
    boolean pending,
    String locationCity,
    String locationRegion,
    String locationCountry
) {}
