package com.finsync.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class TransactionResponse {
  private UUID id;
  private UUID accountId;
  private String providerTransactionId;
  private BigDecimal amount;
  private String currency;
  private LocalDate date;
  private LocalDate authorizedDate;
  private String name;
  private String merchantName;
  private String categoryPrimary;
  private String categoryDetailed;
  private String paymentChannel;
  private boolean pending;
  private String userCategory;
  private String userNotes;
  private boolean hidden;
}
