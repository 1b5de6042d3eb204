package com.finsync.dto;

import com.finsync.model.SyncStage;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SyncErrorEntry {
  private UUID accountId;
  private String accountName;
  private SyncStage stage;
  private String message;
}
