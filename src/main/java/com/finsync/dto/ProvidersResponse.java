package com.finsync.dto;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ProvidersResponse {
  private List<String> providers;
  private String defaultProvider;
}
