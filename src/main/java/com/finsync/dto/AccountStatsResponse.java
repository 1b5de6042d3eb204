package com.finsync.dto;

import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class AccountStatsResponse {
  private int total;
  private Map<String, Long> byProvider;
  private List<String> providersUsed;
}
