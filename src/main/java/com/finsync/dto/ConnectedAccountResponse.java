package com.finsync.dto;

import com.finsync.model.AggregatorType;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ConnectedAccountResponse {
  private UUID id;
  private AggregatorType provider;
  private String institutionName;
  private String accountName;
  private String accountType;
  private String accountSubtype;
  private String mask;
  private boolean active;
  private Instant lastSyncedAt;
  private String lastSyncError;
  private Instant createdAt;
}
