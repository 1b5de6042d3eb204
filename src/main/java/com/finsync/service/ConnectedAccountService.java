package com.finsync.service;

import com.finsync.dto.AccountStatsResponse;
import com.finsync.dto.ConnectedAccountResponse;
import com.finsync.dto.LinkResult;
import com.finsync.dto.LinkSuggestion;
import com.finsync.dto.UserSyncReport;
import com.finsync.exception.MappingException;
import com.finsync.exception.ProviderNotImplementedException;
import com.finsync.exception.SyncException;
import com.finsync.model.AggregatorType;
import com.finsync.model.Asset;
import com.finsync.model.ConnectedAccount;
import com.finsync.model.Liability;
import com.finsync.provider.AccountInfo;
import com.finsync.provider.AggregatorProvider;
import com.finsync.provider.ExchangeTokenResult;
import com.finsync.provider.LinkOptions;
import com.finsync.provider.LinkTokenResult;
import com.finsync.provider.ProviderRegistry;
import com.finsync.repository.AccountTransactionRepository;
import com.finsync.repository.AssetRepository;
import com.finsync.repository.ConnectedAccountRepository;
import com.finsync.repository.HoldingRepository;
import com.finsync.repository.LiabilityRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

/** Interactive lifecycle of connected accounts: link, exchange, attach, on-demand sync, disconnect. */
@Service
public class ConnectedAccountService {
  private static final Logger log = LoggerFactory.getLogger(ConnectedAccountService.class);
  private static final String UNKNOWN_INSTITUTION = "Unknown institution";

  private final ConnectedAccountRepository accountRepository;
  private final AssetRepository assetRepository;
  private final LiabilityRepository liabilityRepository;
  private final AccountTransactionRepository transactionRepository;
  private final HoldingRepository holdingRepository;
  private final ProviderRegistry providerRegistry;
  private final CryptoService cryptoService;
  private final AccountCategoryMapper categoryMapper;
  private final AccountSyncService accountSyncService;
  private final BatchSyncService batchSyncService;

  public ConnectedAccountService(ConnectedAccountRepository accountRepository,
                                 AssetRepository assetRepository,
                                 LiabilityRepository liabilityRepository,
                                 AccountTransactionRepository transactionRepository,
                                 HoldingRepository holdingRepository,
                                 ProviderRegistry providerRegistry,
                                 CryptoService cryptoService,
                                 AccountCategoryMapper categoryMapper,
                                 AccountSyncService accountSyncService,
                                 BatchSyncService batchSyncService) {
    this.accountRepository = accountRepository;
    this.assetRepository = assetRepository;
    this.liabilityRepository = liabilityRepository;
    this.transactionRepository = transactionRepository;
    this.holdingRepository = holdingRepository;
    this.providerRegistry = providerRegistry;
    this.cryptoService = cryptoService;
    this.categoryMapper = categoryMapper;
    this.accountSyncService = accountSyncService;
    this.batchSyncService = batchSyncService;
  }

  public LinkTokenResult createLinkToken(UUID userId, String institutionName) {
    try {
      AggregatorProvider provider = institutionName == null || institutionName.isBlank()
          ? providerRegistry.getDefaultProvider()
          : providerRegistry.getProviderForInstitution(institutionName);
      return provider.createLinkSession(userId.toString(), LinkOptions.defaults());
    } catch (SyncException ex) {
      throw toResponseStatus("Failed to create link token", ex);
    }
  }

  public List<LinkSuggestion> exchangePublicToken(UUID userId, String publicToken, String providerTag) {
    if (publicToken == null || publicToken.isBlank()) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "publicToken is required");
    }
    AggregatorProvider provider = resolveProvider(providerTag);
    ExchangeTokenResult exchange;
    try {
      exchange = provider.exchangePublicToken(publicToken);
    } catch (SyncException ex) {
      throw toResponseStatus("Failed to exchange token", ex);
    }

    List<ConnectedAccount> resolved = new ArrayList<>();
    for (AccountInfo info : exchange.accounts()) {
      ConnectedAccount account = accountRepository.findByProviderAccountId(info.providerAccountId())
          .orElseGet(ConnectedAccount::new);
      if (account.getId() != null && !userId.equals(account.getUserId())) {
        log.warn("Provider account {} is already connected by another user", info.providerAccountId());
        revokeCredential(provider, exchange);
        throw new ResponseStatusException(HttpStatus.CONFLICT, "Account is already connected");
      }
      resolved.add(account);
    }

    String encrypted = cryptoService.encrypt(exchange.credential());
    String institutionName = exchange.institutionName() == null ? UNKNOWN_INSTITUTION : exchange.institutionName();
    List<LinkSuggestion> suggestions = new ArrayList<>();
    for (int i = 0; i < resolved.size(); i++) {
      AccountInfo info = exchange.accounts().get(i);
      ConnectedAccount account = resolved.get(i);
      account.setUserId(userId);
      account.setProvider(exchange.provider());
      account.setProviderConnectionId(exchange.connectionId());
      account.setEncryptedCredential(encrypted);
      account.setProviderAccountId(info.providerAccountId());
      account.setInstitutionId(exchange.institutionId());
      account.setInstitutionName(institutionName);
      account.setAccountName(info.name());
      account.setAccountType(info.accountType());
      account.setAccountSubtype(info.accountSubtype());
      account.setMask(info.mask());
      account.setActive(true);
      account.setLastSyncError(null);
      ConnectedAccount saved = accountRepository.save(account);
      suggestions.add(suggest(saved, info));
    }
    log.info("Connected {} account(s) from {} for user {}", suggestions.size(), institutionName, userId);
    return suggestions;
  }

  public List<ConnectedAccountResponse> listAccounts(UUID userId) {
    return accountRepository.findByUserIdAndActiveTrueOrderByCreatedAtAsc(userId).stream()
        .map(this::toResponse)
        .toList();
  }

  public AccountStatsResponse accountStats(UUID userId) {
    List<ConnectedAccount> accounts = accountRepository.findByUserIdAndActiveTrueOrderByCreatedAtAsc(userId);
    Map<String, Long> byProvider = accounts.stream()
        .collect(Collectors.groupingBy(account -> account.getProvider().getTag(), TreeMap::new, Collectors.counting()));
    return new AccountStatsResponse(accounts.size(), byProvider, List.copyOf(byProvider.keySet()));
  }

  public LinkResult linkToEntity(UUID userId, UUID accountId, String entityType, UUID entityId) {
    ConnectedAccount account = requireAccount(userId, accountId);
    if ("asset".equalsIgnoreCase(entityType)) {
      Asset asset = assetRepository.findByIdAndUserId(entityId, userId)
          .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Asset not found"));
      asset.setConnectedAccount(account);
      asset.setConnected(true);
      assetRepository.save(asset);
    } else if ("liability".equalsIgnoreCase(entityType)) {
      Liability liability = liabilityRepository.findByIdAndUserId(entityId, userId)
          .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Liability not found"));
      liability.setConnectedAccount(account);
      liability.setConnected(true);
      liabilityRepository.save(liability);
    } else {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
          "Invalid entityType. Must be 'asset' or 'liability'");
    }

    AccountSyncService.BalanceSyncResult result = accountSyncService.syncAccount(account);
    if (!result.success()) {
      log.warn("Connected account {} linked but balance sync failed: {}", accountId, result.error());
      return LinkResult.partial(result.error());
    }
    return LinkResult.ok();
  }

  public UserSyncReport syncAccount(UUID userId, UUID accountId) {
    ConnectedAccount account = requireAccount(userId, accountId);
    if (!account.isActive()) {
      throw new ResponseStatusException(HttpStatus.CONFLICT, "Account is not active");
    }
    return batchSyncService.syncAccounts(userId, List.of(account));
  }

  public void disconnect(UUID userId, UUID accountId) {
    ConnectedAccount account = requireAccount(userId, accountId);
    long siblings = accountRepository.countByProviderConnectionIdAndActiveTrueAndIdNot(
        account.getProviderConnectionId(), account.getId());
    if (account.isActive() && siblings == 0) {
      revokeConnection(account);
    }

    account.setActive(false);
    account.setSyncCursor(null);
    accountRepository.save(account);

    for (Asset asset : assetRepository.findByConnectedAccountId(account.getId())) {
      asset.setConnectedAccount(null);
      asset.setConnected(false);
      assetRepository.save(asset);
    }
    for (Liability liability : liabilityRepository.findByConnectedAccountId(account.getId())) {
      liability.setConnectedAccount(null);
      liability.setConnected(false);
      liabilityRepository.save(liability);
    }
    int transactions = transactionRepository.deleteByAccountId(account.getId());
    int holdings = holdingRepository.deleteByAccountId(account.getId());
    log.info("Disconnected account {} for user {}: removed {} transaction(s), {} holding(s)",
        accountId, userId, transactions, holdings);
  }

  private void revokeConnection(ConnectedAccount account) {
    try {
      String credential = cryptoService.decrypt(account.getEncryptedCredential());
      if (!providerRegistry.getProvider(account.getProvider()).disconnect(credential)) {
        log.warn("Provider did not confirm removal of connection {}", account.getProviderConnectionId());
      }
    } catch (SyncException ex) {
      log.warn("Error removing connection {} at provider: {}", account.getProviderConnectionId(), ex.getMessage());
    }
  }

  private void revokeCredential(AggregatorProvider provider, ExchangeTokenResult exchange) {
    try {
      provider.disconnect(exchange.credential());
    } catch (SyncException ex) {
      log.warn("Error removing rejected connection {} at provider: {}", exchange.connectionId(), ex.getMessage());
    }
  }

  private LinkSuggestion suggest(ConnectedAccount account, AccountInfo info) {
    String category = null;
    Boolean asset = null;
    try {
      AccountCategoryMapper.CategoryMapping mapping = categoryMapper.map(info.accountType(), info.accountSubtype());
      category = mapping.category();
      asset = mapping.asset();
    } catch (MappingException ex) {
      log.debug("No category suggestion for account {}: {}", account.getId(), ex.getMessage());
    }
    return new LinkSuggestion(account.getId(), info.name(), info.accountType(), info.accountSubtype(),
        info.mask(), category, asset, info.currentBalance());
  }

  private AggregatorProvider resolveProvider(String providerTag) {
    try {
      if (providerTag == null || providerTag.isBlank()) {
        return providerRegistry.getDefaultProvider();
      }
      return providerRegistry.getProvider(AggregatorType.fromTag(providerTag));
    } catch (IllegalArgumentException ex) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage());
    } catch (ProviderNotImplementedException ex) {
      throw new ResponseStatusException(HttpStatus.NOT_IMPLEMENTED, ex.getMessage());
    }
  }

  private ConnectedAccount requireAccount(UUID userId, UUID accountId) {
    return accountRepository.findByIdAndUserId(accountId, userId)
        .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Connected account not found"));
  }

  private ConnectedAccountResponse toResponse(ConnectedAccount account) {
    return new ConnectedAccountResponse(account.getId(), account.getProvider(), account.getInstitutionName(),
        account.getAccountName(), account.getAccountType(), account.getAccountSubtype(), account.getMask(),
        account.isActive(), account.getLastSyncedAt(), account.getLastSyncError(), account.getCreatedAt());
  }

  private static ResponseStatusException toResponseStatus(String prefix, SyncException ex) {
    HttpStatus status = ex instanceof ProviderNotImplementedException
        ? HttpStatus.NOT_IMPLEMENTED
        : HttpStatus.BAD_GATEWAY;
    return new ResponseStatusException(status, prefix + ": " + ex.getMessage(), ex);
  }
}
