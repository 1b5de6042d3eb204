package com.finsync.provider;

import java.util.List;

/**
 * One page of an incremental change stream. {@code removed} holds provider transaction ids.
 */
public record TransactionSyncPage(
    List<TransactionInfo> added,
    List<TransactionInfo> modified,
    List<String> removed,
    String nextCursor,
    boolean hasMore
) {
  public TransactionSyncPage {
    added = added == null ? List.of() : List.copyOf(added);
    modified = modified == null ? List.of() : List.copyOf(modified);
    removed = removed == null ? List.of() : List.copyOf(removed);
  }
}
