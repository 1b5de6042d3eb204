package com.finsync.provider;

import java.util.List;

/** Full current holdings of a connection. There is no cursor and no change-event model. */
public record HoldingsSnapshot(List<HoldingInfo> holdings, List<SecurityInfo> securities) {
  public HoldingsSnapshot {
    holdings = holdings == null ? List.of() : List.copyOf(holdings);
    securities = securities == null ? List.of() : List.copyOf(securities);
  }
}
