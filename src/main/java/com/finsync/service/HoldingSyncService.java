package com.finsync.service;

import com.finsync.model.ConnectedAccount;
import com.finsync.model.Holding;
import com.finsync.model.Security;
import com.finsync.provider.AggregatorProvider;
import com.finsync.provider.HoldingInfo;
import com.finsync.provider.HoldingsSnapshot;
import com.finsync.provider.ProviderRegistry;
import com.finsync.provider.SecurityInfo;
import com.finsync.repository.HoldingRepository;
import com.finsync.repository.SecurityRepository;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Full-refresh holdings sync. Securities are upserted into the global catalog, then every holding
 * of the account is deleted and recreated from the snapshot.
 */
@Service
public class HoldingSyncService {
  private static final Logger log = LoggerFactory.getLogger(HoldingSyncService.class);
  private static final String STAGE = "Holdings sync";

  private final ProviderRegistry providerRegistry;
  private final CryptoService cryptoService;
  private final SecurityRepository securityRepository;
  private final HoldingRepository holdingRepository;
  private final SyncStatusService syncStatusService;

  public HoldingSyncService(ProviderRegistry providerRegistry,
                            CryptoService cryptoService,
                            SecurityRepository securityRepository,
                            HoldingRepository holdingRepository,
                            SyncStatusService syncStatusService) {
    this.providerRegistry = providerRegistry;
    this.cryptoService = cryptoService;
    this.securityRepository = securityRepository;
    this.holdingRepository = holdingRepository;
    this.syncStatusService = syncStatusService;
  }

  public HoldingSyncResult syncAccount(ConnectedAccount account) {
    if (!account.isActive()) {
      return HoldingSyncResult.failed("Account is not active");
    }
    try {
      String credential = cryptoService.decrypt(account.getEncryptedCredential());
      AggregatorProvider provider = providerRegistry.getProvider(account.getProvider());
      HoldingsSnapshot snapshot = provider.getHoldings(credential);

      Map<String, Security> resolved = new HashMap<>();
      for (SecurityInfo info : snapshot.securities()) {
        try {
          resolved.put(info.providerSecurityId(), upsertSecurity(info));
        } catch (DataAccessException ex) {
          log.warn("Security {} could not be stored: {}", info.providerSecurityId(), ex.getMessage());
        }
      }

      holdingRepository.deleteByAccountId(account.getId());

      int added = 0;
      int skipped = 0;
      for (HoldingInfo info : snapshot.holdings()) {
        if (!account.getProviderAccountId().equals(info.providerAccountId())) {
          continue;
        }
        Security security = resolved.get(info.providerSecurityId());
        if (security == null) {
          skipped++;
          continue;
        }
        holdingRepository.save(toHolding(account, security, info));
        added++;
      }
      if (skipped > 0) {
        log.warn("Dropped {} holding(s) with unresolved securities for connected account {}", skipped, account.getId());
      }

      syncStatusService.markSynced(account, Instant.now());
      log.info("Holdings sync for connected account {}: {} holding(s), {} securities",
          account.getId(), added, resolved.size());
      return new HoldingSyncResult(true, added, resolved.size(), skipped, null);
    } catch (RuntimeException ex) {
      String message = SyncStatusService.describe("Holdings sync failed", ex);
      return HoldingSyncResult.failed(syncStatusService.markFailed(account, STAGE, message));
    }
  }

  private Security upsertSecurity(SecurityInfo info) {
    Security security = securityRepository.findByProviderSecurityId(info.providerSecurityId())
        .orElseGet(Security::new);
    if (security.getId() == null) {
      security.setProviderSecurityId(info.providerSecurityId());
    }
    security.setName(info.name());
    security.setTickerSymbol(info.tickerSymbol());
    security.setSecurityType(info.securityType());
    security.setCashEquivalent(info.cashEquivalent());
    security.setClosePrice(info.closePrice());
    security.setClosePriceAsOf(info.closePriceAsOf());
    security.setCurrency(info.currency());
    return securityRepository.save(security);
  }

  private Holding toHolding(ConnectedAccount account, Security security, HoldingInfo info) {
    Holding holding = new Holding();
    holding.setUserId(account.getUserId());
    holding.setAccount(account);
    holding.setSecurity(security);
    holding.setQuantity(info.quantity());
    holding.setInstitutionPrice(info.institutionPrice());
    holding.setInstitutionPriceAsOf(info.institutionPriceAsOf());
    holding.setInstitutionValue(info.institutionValue());
    holding.setCostBasis(info.costBasis());
    holding.setCurrency(info.currency());
    return holding;
  }

  public record HoldingSyncResult(boolean success, int holdingsAdded, int securitiesSynced, int holdingsSkipped,
                                  String error) {
    static HoldingSyncResult failed(String error) {
      return new HoldingSyncResult(false, 0, 0, 0, error);
    }
  }
}
