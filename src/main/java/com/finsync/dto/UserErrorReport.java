package com.finsync.dto;

import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class UserErrorReport {
  private UUID userId;
  private List<SyncErrorEntry> errors;
}
