package com.finsync.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class BatchStatusResponse {
  private int usersWithAccounts;
  private long totalActiveAccounts;
  private boolean batchSyncConfigured;
}
