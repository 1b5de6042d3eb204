package com.finsync.provider.plaid;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withBadRequest;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.finsync.config.PlaidProperties;
import com.finsync.exception.ProviderException;
import com.finsync.provider.AccountInfo;
import com.finsync.provider.ExchangeTokenResult;
import com.finsync.provider.HoldingsSnapshot;
import com.finsync.provider.TransactionInfo;
import com.finsync.provider.TransactionSyncPage;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class PlaidProviderTest {
  private static final String BASE_URL = "https://sandbox.plaid.test";

  private MockRestServiceServer server;
  private PlaidProvider provider;

  @BeforeEach
  void setUp() {
    RestClient.Builder builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    PlaidProperties properties = new PlaidProperties("sandbox", BASE_URL, "client-1", "secret-1", "FinSync",
        List.of("US"), List.of("transactions"), "en", null, null, "2020-09-14", false);
    provider = new PlaidProvider(new PlaidClient(properties, builder, new ObjectMapper()));
  }

  @Test
  @DisplayName("Balances are normalized with asset classification and currency")
  void accountsWithBalances() {
    server.expect(requestTo(BASE_URL + "/accounts/balance/get"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(header("PLAID-CLIENT-ID", "client-1"))
        .andExpect(header("PLAID-SECRET", "secret-1"))
        .andExpect(jsonPath("$.access_token").value("access-1"))
        .andRespond(withSuccess("""
            {"accounts": [
              {"account_id": "chk", "name": "Checking", "type": "depository", "subtype": "checking",
               "mask": "0000", "balances": {"current": 110.5, "available": 100, "iso_currency_code": "USD"}},
              {"account_id": "cc", "name": "Card", "type": "credit", "subtype": "credit card",
               "balances": {"current": 410.25, "limit": 2000}}
            ]}
            """, MediaType.APPLICATION_JSON));

    List<AccountInfo> accounts = provider.getAccountsWithBalances("access-1");

    assertThat(accounts).hasSize(2);
    assertThat(accounts.get(0).asset()).isTrue();
    assertThat(accounts.get(0).currentBalance()).isEqualByComparingTo("110.5");
    assertThat(accounts.get(1).asset()).isFalse();
    assertThat(accounts.get(1).creditLimit()).isEqualByComparingTo("2000");
    assertThat(accounts.get(1).currency()).isEqualTo("USD");
    server.verify();
  }

  @Test
  @DisplayName("Transaction pages carry normalized entries, removed ids and the next cursor")
  void transactionPage() {
    server.expect(requestTo(BASE_URL + "/transactions/sync"))
        .andExpect(jsonPath("$.cursor").value("c0"))
        .andExpect(jsonPath("$.count").value(500))
        .andRespond(withSuccess("""
            {"added": [
              {"transaction_id": "t1", "account_id": "chk", "amount": 12.5, "date": "2024-03-01",
               "name": "Coffee", "merchant_name": "Beanery", "pending": false, "payment_channel": "in store",
               "personal_finance_category": {"primary": "FOOD_AND_DRINK", "detailed": "FOOD_AND_DRINK_COFFEE"},
               "location": {"city": "Austin", "region": "TX", "country": "US"}},
              {"transaction_id": "t2", "account_id": "chk", "amount": 3, "date": "2024-03-02",
               "name": "Bus", "category": ["Travel", "Public Transit"]}
            ],
             "modified": [],
             "removed": [{"transaction_id": "t0"}],
             "next_cursor": "c1",
             "has_more": true}
            """, MediaType.APPLICATION_JSON));

    TransactionSyncPage page = provider.syncTransactions("access-1", "c0");

    assertThat(page.nextCursor()).isEqualTo("c1");
    assertThat(page.hasMore()).isTrue();
    assertThat(page.removed()).containsExactly("t0");
    TransactionInfo coffee = page.added().get(0);
    assertThat(coffee.date()).isEqualTo(LocalDate.of(2024, 3, 1));
    assertThat(coffee.categoryDetailed()).isEqualTo("FOOD_AND_DRINK_COFFEE");
    assertThat(coffee.locationCity()).isEqualTo("Austin");
    TransactionInfo bus = page.added().get(1);
    assertThat(bus.categoryPrimary()).isEqualTo("Travel");
    assertThat(bus.categoryDetailed()).isEqualTo("Public Transit");
    server.verify();
  }

  @Test
  @DisplayName("Holdings are joined to their securities")
  void holdingsSnapshot() {
    server.expect(requestTo(BASE_URL + "/investments/holdings/get"))
        .andRespond(withSuccess("""
            {"holdings": [
              {"account_id": "inv", "security_id": "s1", "quantity": 10, "institution_price": 15.5,
               "institution_value": 155, "cost_basis": 120},
              {"account_id": "inv", "security_id": "missing", "quantity": 1}
            ],
             "securities": [
              {"security_id": "s1", "name": "Acme Corp", "ticker_symbol": "ACME", "type": "equity",
               "close_price": 15.5, "is_cash_equivalent": false}
            ]}
            """, MediaType.APPLICATION_JSON));

    HoldingsSnapshot snapshot = provider.getHoldings("access-1");

    assertThat(snapshot.securities()).hasSize(1);
    assertThat(snapshot.holdings()).hasSize(2);
    assertThat(snapshot.holdings().get(0).tickerSymbol()).isEqualTo("ACME");
    assertThat(snapshot.holdings().get(1).securityName()).isEqualTo("Unknown");
    server.verify();
  }

  @Test
  @DisplayName("Token exchange collects accounts and the institution name")
  void exchangePublicToken() {
    server.expect(requestTo(BASE_URL + "/item/public_token/exchange"))
        .andExpect(jsonPath("$.public_token").value("public-1"))
        .andRespond(withSuccess("{\"access_token\": \"access-1\", \"item_id\": \"item-1\"}",
            MediaType.APPLICATION_JSON));
    server.expect(requestTo(BASE_URL + "/accounts/balance/get"))
        .andRespond(withSuccess("{\"accounts\": [{\"account_id\": \"chk\", \"name\": \"Checking\","
            + " \"type\": \"depository\", \"balances\": {\"current\": 5}}]}", MediaType.APPLICATION_JSON));
    server.expect(requestTo(BASE_URL + "/accounts/get"))
        .andRespond(withSuccess("{\"accounts\": [], \"item\": {\"institution_id\": \"ins_3\"}}",
            MediaType.APPLICATION_JSON));
    server.expect(requestTo(BASE_URL + "/institutions/get_by_id"))
        .andExpect(jsonPath("$.institution_id").value("ins_3"))
        .andRespond(withSuccess("{\"institution\": {\"name\": \"Chase\"}}", MediaType.APPLICATION_JSON));

    ExchangeTokenResult result = provider.exchangePublicToken("public-1");

    assertThat(result.credential()).isEqualTo("access-1");
    assertThat(result.connectionId()).isEqualTo("item-1");
    assertThat(result.accounts()).extracting(AccountInfo::providerAccountId).containsExactly("chk");
    assertThat(result.institutionId()).isEqualTo("ins_3");
    assertThat(result.institutionName()).isEqualTo("Chase");
    server.verify();
  }

  @Test
  @DisplayName("Plaid error bodies become provider exceptions carrying the error code")
  void errorBodyIsParsed() {
    server.expect(requestTo(BASE_URL + "/transactions/sync"))
        .andRespond(withBadRequest().contentType(MediaType.APPLICATION_JSON).body(
            "{\"error_code\": \"ITEM_LOGIN_REQUIRED\", \"error_message\": \"the login details have changed\"}"));

    assertThatThrownBy(() -> provider.syncTransactions("access-1", null))
        .isInstanceOfSatisfying(ProviderException.class, ex -> {
          assertThat(ex.getErrorCode()).isEqualTo("ITEM_LOGIN_REQUIRED");
          assertThat(ex.getMessage()).isEqualTo("Plaid error (ITEM_LOGIN_REQUIRED): the login details have changed");
        });
  }

  @Test
  @DisplayName("A page without a next cursor is rejected")
  void missingCursorIsRejected() {
    server.expect(requestTo(BASE_URL + "/transactions/sync"))
        .andRespond(withSuccess("{\"added\": [], \"modified\": [], \"removed\": [], \"has_more\": false}",
            MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> provider.syncTransactions("access-1", null))
        .isInstanceOf(ProviderException.class)
        .hasMessageContaining("next_cursor");
  }

  @Test
  @DisplayName("Item removal failures are reported as false")
  void disconnectFailureReturnsFalse() {
    server.expect(requestTo(BASE_URL + "/item/remove"))
        .andRespond(withBadRequest().contentType(MediaType.APPLICATION_JSON).body(
            "{\"error_code\": \"ITEM_NOT_FOUND\", \"error_message\": \"gone\"}"));

    assertThat(provider.disconnect("access-1")).isFalse();
  }

  @Test
  @DisplayName("Missing client credentials fail before any request is sent")
  void missingConfiguration() {
    RestClient.Builder builder = RestClient.builder();
    MockRestServiceServer unused = MockRestServiceServer.bindTo(builder).build();
    PlaidProperties properties = new PlaidProperties("sandbox", BASE_URL, null, null, null, null, null, null,
        null, null, null, null);
    PlaidProvider unconfigured = new PlaidProvider(new PlaidClient(properties, builder, new ObjectMapper()));

    assertThatThrownBy(() -> unconfigured.getAccounts("access-1"))
        .isInstanceOf(ProviderException.class)
        .hasMessage("Missing Plaid configuration: clientId");
    unused.verify();
  }

  @Test
  @DisplayName("Institutions with limited support are declined")
  void limitedInstitutionSupport() {
    assertThat(provider.supportsInstitution("ins_fidelity")).isFalse();
    assertThat(provider.supportsInstitution("ins_3")).isTrue();
  }
}
