package com.finsync.service;

import com.finsync.exception.ProviderException;
import com.finsync.model.AccountTransaction;
import com.finsync.model.ConnectedAccount;
import com.finsync.provider.AggregatorProvider;
import com.finsync.provider.ProviderRegistry;
import com.finsync.provider.TransactionInfo;
import com.finsync.provider.TransactionSyncPage;
import com.finsync.repository.AccountTransactionRepository;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Cursor-based incremental transaction sync for one connected account.
 *
 * <p>Pages are applied in delivery order. Added and modified entries are upserted by provider
 * transaction id, removed ids are deleted. The cursor is persisted only after the last page of
 * the run has been applied, so an interrupted run is replayed from the previous cursor on the
 * next attempt. Replays are safe because every write is keyed by provider transaction id.
 */
@Service
public class TransactionSyncService {
  private static final Logger log = LoggerFactory.getLogger(TransactionSyncService.class);
  private static final String STAGE = "Transaction sync";

  private final ProviderRegistry providerRegistry;
  private final CryptoService cryptoService;
  private final AccountTransactionRepository transactionRepository;
  private final SyncStatusService syncStatusService;

  public TransactionSyncService(ProviderRegistry providerRegistry,
                                CryptoService cryptoService,
                                AccountTransactionRepository transactionRepository,
                                SyncStatusService syncStatusService) {
    this.providerRegistry = providerRegistry;
    this.cryptoService = cryptoService;
    this.transactionRepository = transactionRepository;
    this.syncStatusService = syncStatusService;
  }

  public TransactionSyncResult syncAccount(ConnectedAccount account) {
    if (!account.isActive()) {
      return TransactionSyncResult.failed("Account is not active");
    }
    int added = 0;
    int modified = 0;
    int removed = 0;
    int pages = 0;
    String cursor = account.getSyncCursor();
    try {
      String credential = cryptoService.decrypt(account.getEncryptedCredential());
      AggregatorProvider provider = providerRegistry.getProvider(account.getProvider());
      boolean hasMore;
      do {
        TransactionSyncPage page = provider.syncTransactions(credential, cursor);
        added += upsertAll(account, page.added());
        modified += upsertAll(account, page.modified());
        for (String providerTransactionId : page.removed()) {
          removed += transactionRepository.deleteByProviderTransactionId(providerTransactionId);
        }
        hasMore = page.hasMore();
        if (hasMore && Objects.equals(cursor, page.nextCursor())) {
          throw new ProviderException("cursor did not advance");
        }
        cursor = page.nextCursor();
        pages++;
        log.debug("Applied transaction page {} for connected account {} (hasMore={})",
            pages, account.getId(), hasMore);
      } while (hasMore);

      syncStatusService.markSynced(account, Instant.now(), cursor);
      log.info("Transaction sync for connected account {}: {} added, {} modified, {} removed over {} page(s)",
          account.getId(), added, modified, removed, pages);
      return new TransactionSyncResult(true, added, modified, removed, null);
    } catch (RuntimeException ex) {
      String message = SyncStatusService.describe("Transaction sync failed", ex);
      return TransactionSyncResult.failed(syncStatusService.markFailed(account, STAGE, message));
    }
  }

  private int upsertAll(ConnectedAccount account, List<TransactionInfo> transactions) {
    int applied = 0;
    for (TransactionInfo info : transactions) {
      // entries for sibling accounts of the same connection are synced by their own account
      if (!account.getProviderAccountId().equals(info.providerAccountId())) {
        continue;
      }
      upsert(account, info);
      applied++;
    }
    return applied;
  }

  private void upsert(ConnectedAccount account, TransactionInfo info) {
    AccountTransaction tx = transactionRepository.findByProviderTransactionId(info.providerTransactionId())
        .orElseGet(AccountTransaction::new);
    if (tx.getId() == null) {
      tx.setProviderTransactionId(info.providerTransactionId());
    }
    tx.setUserId(account.getUserId());
    tx.setAccount(account);
    tx.setProviderAccountId(info.providerAccountId());
    tx.setAmount(info.amount());
    tx.setCurrency(info.currency());
    tx.setDate(info.date());
    tx.setAuthorizedDate(info.authorizedDate());
    tx.setName(info.name());
    tx.setMerchantName(info.merchantName());
    tx.setCategoryPrimary(info.categoryPrimary());
    tx.setCategoryDetailed(info.categoryDetailed());
    tx.setPaymentChannel(info.paymentChannel());
    tx.setPending(info.pending());
    tx.setLocationCity(info.locationCity());
    tx.setLocationRegion(info.locationRegion());
    tx.setLocationCountry(info.locationCountry());
    transactionRepository.save(tx);
  }

  public record TransactionSyncResult(boolean success, int added, int modified, int removed, String error) {
    static TransactionSyncResult failed(String error) {
      return new TransactionSyncResult(false, 0, 0, 0, error);
    }
  }
}
