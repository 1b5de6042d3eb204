package com.finsync.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ProviderInfoResponse {
  private String provider;
  private boolean available;
}
