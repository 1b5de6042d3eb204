package com.finsync.dto;

import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

/** User overrides on a synced transaction. Fields left null are not changed. */
@Getter
@Setter
public class UpdateTransactionRequest {
  @Size(max = 100)
  private String userCategory;

  @Size(max = 2000)
  private String userNotes;

  private Boolean hidden;
}
