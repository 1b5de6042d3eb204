package com.finsync.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class LinkResult {
  private String status;
  private String message;
  private String syncError;

  public static LinkResult ok() {
    return new LinkResult("ok", "Account linked and synced successfully", null);
  }

  public static LinkResult partial(String syncError) {
    return new LinkResult("partial", "Account linked but sync failed: " + syncError, syncError);
  }
}
