package com.finsync.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class LinkAccountRequest {
  @NotBlank
  private String entityType;

  @NotNull
  private UUID entityId;
}
