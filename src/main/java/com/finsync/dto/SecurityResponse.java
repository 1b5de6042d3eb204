package com.finsync.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SecurityResponse {
  private UUID id;
  private String providerSecurityId;
  private String name;
  private String tickerSymbol;
  private String securityType;
  private boolean cashEquivalent;
  private BigDecimal closePrice;
  private LocalDate closePriceAsOf;
  private String currency;
}
