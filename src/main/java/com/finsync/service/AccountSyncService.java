package com.finsync.service;

import com.finsync.exception.ProviderException;
import com.finsync.model.Asset;
import com.finsync.model.ConnectedAccount;
import com.finsync.model.Liability;
import com.finsync.provider.AccountInfo;
import com.finsync.provider.AggregatorProvider;
import com.finsync.provider.ProviderRegistry;
import com.finsync.repository.AssetRepository;
import com.finsync.repository.LiabilityRepository;
import java.math.BigDecimal;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Refreshes the balance of one connected account and writes it to the asset or liability
 * created for that account. Never throws: every failure is recorded on the account and
 * returned as a failed {@link BalanceSyncResult}.
 */
@Service
public class AccountSyncService {
  private static final Logger log = LoggerFactory.getLogger(AccountSyncService.class);
  private static final String STAGE = "Balance sync";

  private final ProviderRegistry providerRegistry;
  private final CryptoService cryptoService;
  private final AccountCategoryMapper categoryMapper;
  private final AssetRepository assetRepository;
  private final LiabilityRepository liabilityRepository;
  private final SyncStatusService syncStatusService;

  public AccountSyncService(ProviderRegistry providerRegistry,
                            CryptoService cryptoService,
                            AccountCategoryMapper categoryMapper,
                            AssetRepository assetRepository,
                            LiabilityRepository liabilityRepository,
                            SyncStatusService syncStatusService) {
    this.providerRegistry = providerRegistry;
    this.cryptoService = cryptoService;
    this.categoryMapper = categoryMapper;
    this.assetRepository = assetRepository;
    this.liabilityRepository = liabilityRepository;
    this.syncStatusService = syncStatusService;
  }

  public BalanceSyncResult syncAccount(ConnectedAccount account) {
    if (!account.isActive()) {
      return BalanceSyncResult.failed("Account is not active");
    }
    try {
      String credential = cryptoService.decrypt(account.getEncryptedCredential());
      AggregatorProvider provider = providerRegistry.getProvider(account.getProvider());
      AccountInfo info = provider.getAccountsWithBalances(credential).stream()
          .filter(candidate -> account.getProviderAccountId().equals(candidate.providerAccountId()))
          .findFirst()
          .orElseThrow(() -> new ProviderException(
              "Failed to fetch balance: account " + account.getProviderAccountId() + " not returned by provider"));

      AccountCategoryMapper.CategoryMapping mapping =
          categoryMapper.map(account.getAccountType(), account.getAccountSubtype());
      BigDecimal balance = info.effectiveBalance();
      Instant now = Instant.now();
      if (mapping.asset()) {
        upsertAsset(account, mapping.category(), balance, now);
      } else {
        upsertLiability(account, mapping.category(), balance.abs(), now);
      }
      syncStatusService.markSynced(account, now);
      log.debug("Balance synced for connected account {}: {} {}", account.getId(), mapping.category(), balance);
      return BalanceSyncResult.succeeded(mapping.asset() ? balance : balance.abs());
    } catch (RuntimeException ex) {
      String message = SyncStatusService.describe("Error syncing account", ex);
      return BalanceSyncResult.failed(syncStatusService.markFailed(account, STAGE, message));
    }
  }

  private void upsertAsset(ConnectedAccount account, String category, BigDecimal value, Instant syncedAt) {
    Asset asset = assetRepository.findFirstByConnectedAccountIdOrderByCreatedAtAsc(account.getId())
        .orElseGet(() -> newAsset(account, category));
    asset.setValue(value);
    asset.setLastSyncedAt(syncedAt);
    assetRepository.save(asset);
  }

  private void upsertLiability(ConnectedAccount account, String category, BigDecimal balance, Instant syncedAt) {
    Liability liability = liabilityRepository.findFirstByConnectedAccountIdOrderByCreatedAtAsc(account.getId())
        .orElseGet(() -> newLiability(account, category));
    liability.setBalance(balance);
    liability.setLastSyncedAt(syncedAt);
    liabilityRepository.save(liability);
  }

  private Asset newAsset(ConnectedAccount account, String category) {
    Asset asset = new Asset();
    asset.setUserId(account.getUserId());
    asset.setCategory(category);
    asset.setName(displayName(account));
    asset.setConnectedAccount(account);
    asset.setConnected(true);
    return asset;
  }

  private Liability newLiability(ConnectedAccount account, String category) {
    Liability liability = new Liability();
    liability.setUserId(account.getUserId());
    liability.setCategory(category);
    liability.setName(displayName(account));
    liability.setConnectedAccount(account);
    liability.setConnected(true);
    return liability;
  }

  private static String displayName(ConnectedAccount account) {
    String institution = account.getInstitutionName();
    if (institution == null || institution.isBlank()) {
      return account.getAccountName();
    }
    return institution + " " + account.getAccountName();
  }

  public record BalanceSyncResult(boolean success, BigDecimal balance, String error) {
    static BalanceSyncResult succeeded(BigDecimal balance) {
      return new BalanceSyncResult(true, balance, null);
    }

    static BalanceSyncResult failed(String error) {
      return new BalanceSyncResult(false, null, error);
    }
  }
}
