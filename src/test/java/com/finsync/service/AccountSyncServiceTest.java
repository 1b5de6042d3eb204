package com.finsync.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.finsync.TestData;
import com.finsync.exception.CredentialException;
import com.finsync.model.AggregatorType;
import com.finsync.model.Asset;
import com.finsync.model.ConnectedAccount;
import com.finsync.model.Liability;
import com.finsync.provider.AccountInfo;
import com.finsync.provider.AggregatorProvider;
import com.finsync.provider.ProviderRegistry;
import com.finsync.repository.AssetRepository;
import com.finsync.repository.ConnectedAccountRepository;
import com.finsync.repository.LiabilityRepository;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

@DataJpaTest
class AccountSyncServiceTest {
  @Autowired
  private ConnectedAccountRepository accountRepository;

  @Autowired
  private AssetRepository assetRepository;

  @Autowired
  private LiabilityRepository liabilityRepository;

  private AggregatorProvider provider;
  private CryptoService cryptoService;
  private AccountSyncService service;

  @BeforeEach
  void setUp() {
    provider = mock(AggregatorProvider.class);
    cryptoService = mock(CryptoService.class);
    when(cryptoService.decrypt(anyString())).thenReturn("access-token");
    ProviderRegistry registry = new ProviderRegistry(Map.of(AggregatorType.PLAID, () -> provider), AggregatorType.PLAID);
    service = new AccountSyncService(registry, cryptoService, new AccountCategoryMapper(), assetRepository,
        liabilityRepository, new SyncStatusService(accountRepository));
  }

  @Test
  @DisplayName("A checking account balance creates a cash asset once and updates it afterwards")
  void depositoryBalanceUpsertsAsset() {
    ConnectedAccount account = accountRepository.save(
        TestData.account(UUID.randomUUID(), "chk-1", "depository", "checking"));
    when(provider.getAccountsWithBalances("access-token"))
        .thenReturn(List.of(info("chk-1", "depository", "1200.50", null)))
        .thenReturn(List.of(info("chk-1", "depository", "980.00", null)));

    assertThat(service.syncAccount(account).success()).isTrue();
    AccountSyncService.BalanceSyncResult second = service.syncAccount(account);

    assertThat(second.balance()).isEqualByComparingTo("980.00");
    List<Asset> assets = assetRepository.findByConnectedAccountId(account.getId());
    assertThat(assets).hasSize(1);
    assertThat(assets.get(0).getCategory()).isEqualTo("cash");
    assertThat(assets.get(0).getValue()).isEqualByComparingTo("980.00");
    assertThat(assets.get(0).getName()).isEqualTo("First Platypus Bank chk-1 account");
    assertThat(assets.get(0).isConnected()).isTrue();
    assertThat(accountRepository.findById(account.getId()).orElseThrow().getLastSyncedAt()).isNotNull();
  }

  @Test
  @DisplayName("A negative credit card balance is stored as a positive amount owed")
  void creditBalanceIsNormalized() {
    ConnectedAccount account = accountRepository.save(
        TestData.account(UUID.randomUUID(), "cc-1", "credit", "credit card"));
    when(provider.getAccountsWithBalances("access-token"))
        .thenReturn(List.of(info("cc-1", "credit", "-350.25", null)));

    AccountSyncService.BalanceSyncResult result = service.syncAccount(account);

    assertThat(result.success()).isTrue();
    List<Liability> liabilities = liabilityRepository.findByConnectedAccountId(account.getId());
    assertThat(liabilities).hasSize(1);
    assertThat(liabilities.get(0).getCategory()).isEqualTo("credit_card");
    assertThat(liabilities.get(0).getBalance()).isEqualByComparingTo("350.25");
  }

  @Test
  @DisplayName("The available balance is used when the current balance is missing")
  void availableBalanceFallback() {
    ConnectedAccount account = accountRepository.save(
        TestData.account(UUID.randomUUID(), "sav-1", "depository", "savings"));
    when(provider.getAccountsWithBalances("access-token"))
        .thenReturn(List.of(info("sav-1", "depository", null, "75.00")));

    assertThat(service.syncAccount(account).balance()).isEqualByComparingTo("75.00");
  }

  @Test
  @DisplayName("An unmappable account type fails without touching assets or liabilities")
  void unmappableTypeFails() {
    ConnectedAccount account = accountRepository.save(
        TestData.account(UUID.randomUUID(), "ex-1", "exotic", "foo"));
    when(provider.getAccountsWithBalances("access-token"))
        .thenReturn(List.of(info("ex-1", "exotic", "10.00", null)));

    AccountSyncService.BalanceSyncResult result = service.syncAccount(account);

    assertThat(result.success()).isFalse();
    assertThat(result.error()).isEqualTo("Unable to map account type exotic/foo");
    assertThat(assetRepository.findByConnectedAccountId(account.getId())).isEmpty();
    assertThat(liabilityRepository.findByConnectedAccountId(account.getId())).isEmpty();
    assertThat(accountRepository.findById(account.getId()).orElseThrow().getLastSyncError())
        .isEqualTo("Unable to map account type exotic/foo");
  }

  @Test
  @DisplayName("A missing account in the provider response is reported as a failure")
  void accountMissingFromProvider() {
    ConnectedAccount account = accountRepository.save(
        TestData.account(UUID.randomUUID(), "chk-2", "depository", "checking"));
    when(provider.getAccountsWithBalances("access-token"))
        .thenReturn(List.of(info("other", "depository", "1.00", null)));

    AccountSyncService.BalanceSyncResult result = service.syncAccount(account);

    assertThat(result.success()).isFalse();
    assertThat(result.error()).contains("chk-2");
  }

  @Test
  @DisplayName("A credential that cannot be decrypted is recorded and returned")
  void decryptFailure() {
    ConnectedAccount account = accountRepository.save(
        TestData.account(UUID.randomUUID(), "chk-3", "depository", "checking"));
    when(cryptoService.decrypt(anyString()))
        .thenThrow(new CredentialException("Failed to decrypt access token: AEADBadTagException", null));

    AccountSyncService.BalanceSyncResult result = service.syncAccount(account);

    assertThat(result.success()).isFalse();
    assertThat(result.error()).startsWith("Failed to decrypt access token");
  }

  private static AccountInfo info(String id, String type, String current, String available) {
    return new AccountInfo(id, id, type, null, "0000",
        current == null ? null : new BigDecimal(current),
        available == null ? null : new BigDecimal(available),
        null, !"credit".equals(type), "USD");
  }
}
