package com.finsync.provider;

import com.finsync.model.AggregatorType;
import java.util.List;

/**
 * Outcome of a public token exchange. {@code credential} is the plaintext access credential and
 * must go through the credential vault before it is stored.
 */
public record ExchangeTokenResult(
    AggregatorType provider,
    String credential,
    String connectionId,
    List<AccountInfo> accounts,
    String institutionId,
    String institutionName
) {
  public ExchangeTokenResult {
    accounts = accounts == null ? List.of() : List.copyOf(accounts);
  }
}
