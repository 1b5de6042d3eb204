package com.finsync.provider;

import com.finsync.model.AggregatorType;
import java.util.List;

/**
 * One external financial data aggregator, normalized to canonical types. Implementations do not
 * retry; retry policy belongs to the caller. Failures surface as
 * {@link com.finsync.exception.ProviderException}.
 */
public interface AggregatorProvider {
  AggregatorType getType();

  LinkTokenResult createLinkSession(String userId, LinkOptions options);

  ExchangeTokenResult exchangePublicToken(String publicToken);

  List<AccountInfo> getAccounts(String credential);

  /** May trigger a live balance refresh at the institution. */
  List<AccountInfo> getAccountsWithBalances(String credential);

  /**
   * Fetches the page of changes after {@code cursor}; a {@code null} cursor starts from the
   * beginning of the connection's history.
   */
  TransactionSyncPage syncTransactions(String credential, String cursor);

  HoldingsSnapshot getHoldings(String credential);

  boolean disconnect(String credential);

  default boolean supportsInstitution(String institutionId) {
    return true;
  }

  default String getInstitutionName(String institutionId) {
    return null;
  }
}
