package com.finsync.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class HoldingResponse {
  private UUID id;
  private UUID accountId;
  private SecurityResponse security;
  private BigDecimal quantity;
  private BigDecimal institutionPrice;
  private LocalDate institutionPriceAsOf;
  private BigDecimal institutionValue;
  private BigDecimal costBasis;
  private String currency;
  private Instant createdAt;
}
