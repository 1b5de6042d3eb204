package com.finsync.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class ExchangeTokenRequest {
  @NotBlank
  private String publicToken;

  private String provider;
}
