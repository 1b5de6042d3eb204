package com.finsync.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SyncStage {
  BALANCE_SYNC("balance_sync"),
  TRANSACTION_SYNC("transaction_sync"),
  HOLDINGS_SYNC("holdings_sync"),
  GENERAL("general"),
  USER_SYNC("user_sync");

  private final String tag;

  SyncStage(String tag) {
    this.tag = tag;
  }

  @JsonValue
  public String getTag() {
    return tag;
  }
}
