package com.finsync.service;

import com.finsync.exception.CredentialException;
import com.finsync.exception.MappingException;
import com.finsync.exception.StorageException;
import com.finsync.model.ConnectedAccount;
import com.finsync.repository.ConnectedAccountRepository;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/** Persists per-account sync outcomes: synced timestamp, last error and cursor. */
@Service
public class SyncStatusService {
  private static final Logger log = LoggerFactory.getLogger(SyncStatusService.class);

  private final ConnectedAccountRepository accountRepository;

  public SyncStatusService(ConnectedAccountRepository accountRepository) {
    this.accountRepository = accountRepository;
  }

  public void markSynced(ConnectedAccount account, Instant syncedAt) {
    markSynced(account, syncedAt, account.getSyncCursor());
  }

  /**
   * Cursor, synced timestamp and cleared error are written in one row update. When the write
   * fails the in-memory cursor and timestamp are restored so a later error update cannot persist them.
   */
  public void markSynced(ConnectedAccount account, Instant syncedAt, String cursor) {
    String previousCursor = account.getSyncCursor();
    Instant previousSyncedAt = account.getLastSyncedAt();
    account.setSyncCursor(cursor);
    account.setLastSyncedAt(syncedAt);
    account.setLastSyncError(null);
    try {
      accountRepository.save(account);
    } catch (DataAccessException ex) {
      account.setSyncCursor(previousCursor);
      account.setLastSyncedAt(previousSyncedAt);
      throw new StorageException("Failed to update connected account " + account.getId(), ex);
    }
  }

  public String markFailed(ConnectedAccount account, String stage, String message) {
    log.warn("{} failed for connected account {}: {}", stage, account.getId(), message);
    account.setLastSyncError(message);
    try {
      accountRepository.save(account);
    } catch (DataAccessException ex) {
      log.warn("Could not record sync error for connected account {}: {}", account.getId(), ex.getMessage());
    }
    return message;
  }

  /**
   * Message for a failure caught at a per-account sync boundary. Credential and mapping failures
   * already name their cause and are kept as is; everything else carries the stage prefix.
   */
  public static String describe(String prefix, RuntimeException ex) {
    if (ex instanceof CredentialException || ex instanceof MappingException) {
      return ex.getMessage();
    }
    if (ex instanceof DataAccessException dataAccess) {
      return prefix + ": storage failure: " + dataAccess.getMostSpecificCause().getMessage();
    }
    if (ex instanceof StorageException && ex.getCause() instanceof DataAccessException dataAccess) {
      return prefix + ": " + ex.getMessage() + ": " + dataAccess.getMostSpecificCause().getMessage();
    }
    return prefix + ": " + ex.getMessage();
  }
}
