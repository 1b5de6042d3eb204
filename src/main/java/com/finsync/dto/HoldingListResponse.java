package com.finsync.dto;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class HoldingListResponse {
  private List<HoldingResponse> holdings;
  private int total;
}
