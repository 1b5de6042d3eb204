package com.finsync.dto;

import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class BatchSyncReport {
  private Instant startedAt;
  private Instant completedAt;
  private int usersTotal;
  private int usersSynced;
  private int usersFailed;
  private int totalAccountsSynced;
  private int totalAccountsFailed;
  private int totalTransactionsAdded;
  private int totalTransactionsModified;
  private int totalTransactionsRemoved;
  private int totalHoldingsSynced;
  private int totalSecuritiesSynced;
  private List<UserErrorReport> userErrors;
  private boolean success;
  private boolean cancelled;
}
