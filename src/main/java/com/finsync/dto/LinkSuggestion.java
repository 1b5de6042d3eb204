package com.finsync.dto;

import java.math.BigDecimal;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

/** A discovered account with the category it would map to, or none when it cannot be mapped. */
@Getter
@AllArgsConstructor
public class LinkSuggestion {
  private UUID accountId;
  private String name;
  private String type;
  private String subtype;
  private String mask;
  private String suggestedCategory;
  private Boolean asset;
  private BigDecimal currentBalance;
}
