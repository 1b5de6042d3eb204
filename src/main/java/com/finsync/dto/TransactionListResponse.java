package com.finsync.dto;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class TransactionListResponse {
  private List<TransactionResponse> transactions;
  private long total;
  private int page;
  private int size;
}
