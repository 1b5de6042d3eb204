package com.finsync.dto;

import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class UserSyncReport {
  private UUID userId;
  private int accountsSynced;
  private int accountsFailed;
  private int transactionsAdded;
  private int transactionsModified;
  private int transactionsRemoved;
  private int holdingsSynced;
  private int securitiesSynced;
  private List<SyncErrorEntry> errors;

  public boolean hasErrors() {
    return errors != null && !errors.isEmpty();
  }
}
