package com.finsync.service;

import com.finsync.dto.BatchStatusResponse;
import com.finsync.dto.BatchSyncReport;
import com.finsync.dto.SyncErrorEntry;
import com.finsync.dto.UserErrorReport;
import com.finsync.dto.UserSyncReport;
import com.finsync.model.AccountKind;
import com.finsync.model.ConnectedAccount;
import com.finsync.model.SyncStage;
import com.finsync.repository.ConnectedAccountRepository;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drives the per-account sync pipeline for every user with active connected accounts.
 *
 * <p>Each account runs a balance sync first. When it fails the dependent step is skipped for
 * that account only. Investment accounts then refresh holdings, every other kind pulls
 * transactions. Failures are collected into the report and never abort other accounts or users.
 * An unexpected exception for one account is recorded under the general stage.
 */
@Service
public class BatchSyncService {
  private static final Logger log = LoggerFactory.getLogger(BatchSyncService.class);

  private final ConnectedAccountRepository accountRepository;
  private final AccountSyncService accountSyncService;
  private final TransactionSyncService transactionSyncService;
  private final HoldingSyncService holdingSyncService;

  public BatchSyncService(ConnectedAccountRepository accountRepository,
                          AccountSyncService accountSyncService,
                          TransactionSyncService transactionSyncService,
                          HoldingSyncService holdingSyncService) {
    this.accountRepository = accountRepository;
    this.accountSyncService = accountSyncService;
    this.transactionSyncService = transactionSyncService;
    this.holdingSyncService = holdingSyncService;
  }

  public List<UUID> getAllUserIds() {
    return accountRepository.findDistinctUserIdsWithActiveAccounts();
  }

  public BatchStatusResponse getStatus(boolean batchSyncConfigured) {
    return new BatchStatusResponse(getAllUserIds().size(), accountRepository.countByActiveTrue(), batchSyncConfigured);
  }

  public UserSyncReport syncUser(UUID userId) {
    return syncAccounts(userId, accountRepository.findByUserIdAndActiveTrueOrderByCreatedAtAsc(userId));
  }

  public UserSyncReport syncAccounts(UUID userId, List<ConnectedAccount> accounts) {
    UserTally tally = new UserTally();
    for (ConnectedAccount account : accounts) {
      syncAccount(account, tally);
    }
    return tally.toReport(userId);
  }

  public BatchSyncReport syncAllUsers() {
    Instant startedAt = Instant.now();
    List<UUID> userIds = getAllUserIds();
    log.info("Batch sync started for {} user(s)", userIds.size());

    BatchTally batch = new BatchTally();
    boolean cancelled = false;
    for (UUID userId : userIds) {
      if (Thread.currentThread().isInterrupted()) {
        log.warn("Batch sync cancelled after {} of {} user(s)", batch.processed(), userIds.size());
        cancelled = true;
        break;
      }
      try {
        batch.add(syncUser(userId));
      } catch (RuntimeException ex) {
        log.warn("Sync of user {} failed unexpectedly: {}", userId, ex.getMessage(), ex);
        batch.addFailure(userId, ex);
      }
    }

    BatchSyncReport report = batch.toReport(startedAt, Instant.now(), userIds.size(), cancelled);
    log.info("Batch sync finished: {} synced, {} failed, {} account(s) failed, {} transaction(s) added",
        report.getUsersSynced(), report.getUsersFailed(), report.getTotalAccountsFailed(),
        report.getTotalTransactionsAdded());
    return report;
  }

  private void syncAccount(ConnectedAccount account, UserTally tally) {
    int syncedBefore = tally.accountsSynced;
    try {
      runPipeline(account, tally);
    } catch (RuntimeException ex) {
      log.warn("Sync of connected account {} failed unexpectedly: {}", account.getId(), ex.getMessage(), ex);
      if (tally.accountsSynced == syncedBefore) {
        tally.accountsFailed++;
      }
      tally.error(account, SyncStage.GENERAL, messageOf(ex));
    }
  }

  private void runPipeline(ConnectedAccount account, UserTally tally) {
    AccountSyncService.BalanceSyncResult balance = accountSyncService.syncAccount(account);
    if (!balance.success()) {
      tally.accountsFailed++;
      tally.error(account, SyncStage.BALANCE_SYNC, balance.error());
      return;
    }
    tally.accountsSynced++;

    if (account.getKind() == AccountKind.INVESTMENT) {
      HoldingSyncService.HoldingSyncResult holdings = holdingSyncService.syncAccount(account);
      if (holdings.success()) {
        tally.holdingsSynced += holdings.holdingsAdded();
        tally.securitiesSynced += holdings.securitiesSynced();
      } else {
        tally.error(account, SyncStage.HOLDINGS_SYNC, holdings.error());
      }
    } else {
      TransactionSyncService.TransactionSyncResult transactions = transactionSyncService.syncAccount(account);
      if (transactions.success()) {
        tally.transactionsAdded += transactions.added();
        tally.transactionsModified += transactions.modified();
        tally.transactionsRemoved += transactions.removed();
      } else {
        tally.error(account, SyncStage.TRANSACTION_SYNC, transactions.error());
      }
    }
  }

  private static String messageOf(RuntimeException ex) {
    return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
  }

  private static final class UserTally {
    private int accountsSynced;
    private int accountsFailed;
    private int transactionsAdded;
    private int transactionsModified;
    private int transactionsRemoved;
    private int holdingsSynced;
    private int securitiesSynced;
    private final List<SyncErrorEntry> errors = new ArrayList<>();

    void error(ConnectedAccount account, SyncStage stage, String message) {
      errors.add(new SyncErrorEntry(account.getId(), account.getAccountName(), stage, message));
    }

    UserSyncReport toReport(UUID userId) {
      return new UserSyncReport(userId, accountsSynced, accountsFailed, transactionsAdded,
          transactionsModified, transactionsRemoved, holdingsSynced, securitiesSynced, List.copyOf(errors));
    }
  }

  private static final class BatchTally {
    private int usersSynced;
    private int usersFailed;
    private int accountsSynced;
    private int accountsFailed;
    private int transactionsAdded;
    private int transactionsModified;
    private int transactionsRemoved;
    private int holdingsSynced;
    private int securitiesSynced;
    private final List<UserErrorReport> userErrors = new ArrayList<>();

    void add(UserSyncReport user) {
      accountsSynced += user.getAccountsSynced();
      accountsFailed += user.getAccountsFailed();
      transactionsAdded += user.getTransactionsAdded();
      transactionsModified += user.getTransactionsModified();
      transactionsRemoved += user.getTransactionsRemoved();
      holdingsSynced += user.getHoldingsSynced();
      securitiesSynced += user.getSecuritiesSynced();
      if (user.hasErrors()) {
        usersFailed++;
        userErrors.add(new UserErrorReport(user.getUserId(), user.getErrors()));
      } else {
        usersSynced++;
      }
    }

    void addFailure(UUID userId, RuntimeException ex) {
      usersFailed++;
      userErrors.add(new UserErrorReport(userId,
          List.of(new SyncErrorEntry(null, null, SyncStage.USER_SYNC, messageOf(ex)))));
    }

    int processed() {
      return usersSynced + usersFailed;
    }

    BatchSyncReport toReport(Instant startedAt, Instant completedAt, int usersTotal, boolean cancelled) {
      return new BatchSyncReport(startedAt, completedAt, usersTotal, usersSynced, usersFailed,
          accountsSynced, accountsFailed, transactionsAdded, transactionsModified, transactionsRemoved,
          holdingsSynced, securitiesSynced, List.copyOf(userErrors), usersFailed == 0, cancelled);
    }
  }
}
