package com.finsync.dto;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class LinkTokenRequest {
  private String institutionName;
}
