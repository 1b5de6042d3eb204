package com.finsync.provider.plaid;

import com.fasterxml.jackson.databind.JsonNode;
import com.finsync.exception.ProviderException;
import com.finsync.model.AggregatorType;
import com.finsync.provider.AccountInfo;
import com.finsync.provider.AggregatorProvider;
import com.finsync.provider.ExchangeTokenResult;
import com.finsync.provider.HoldingInfo;
import com.finsync.provider.HoldingsSnapshot;
import com.finsync.provider.LinkOptions;
import com.finsync.provider.LinkTokenResult;
import com.finsync.provider.SecurityInfo;
import com.finsync.provider.TransactionInfo;
import com.finsync.provider.TransactionSyncPage;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

@Component
@Lazy
public class PlaidProvider implements AggregatorProvider {
  private static final Logger log = LoggerFactory.getLogger(PlaidProvider.class);

  private static final Set<String> ASSET_TYPES = Set.of("depository", "investment");
  private static final Set<String> LIMITED_SUPPORT = Set.of("ins_fidelity");
  private static final String DEFAULT_CURRENCY = "USD";

  private final PlaidClient client;

  public PlaidProvider(PlaidClient client) {
    this.client = client;
  }

  @Override
  public AggregatorType getType() {
    return AggregatorType.PLAID;
  }

  @Override
  public LinkTokenResult createLinkSession(String userId, LinkOptions options) {
    JsonNode response = client.createLinkToken(userId, options);
    String linkToken = text(response, "link_token");
    if (linkToken == null) {
      throw new ProviderException("Plaid did not return a link token");
    }
    return new LinkTokenResult(AggregatorType.PLAID, linkToken, null, parseInstant(text(response, "expiration")));
  }

  @Override
  public ExchangeTokenResult exchangePublicToken(String publicToken) {
    JsonNode exchange = client.exchangePublicToken(publicToken);
    String accessToken = text(exchange, "access_token");
    String itemId = text(exchange, "item_id");
    if (accessToken == null || itemId == null) {
      throw new ProviderException("Plaid token exchange returned no access token");
    }

    List<AccountInfo> accounts = getAccountsWithBalances(accessToken);

    String institutionId = null;
    String institutionName = null;
    try {
      institutionId = text(client.getAccounts(accessToken), "item.institution_id");
      if (institutionId != null) {
        institutionName = getInstitutionName(institutionId);
      }
    } catch (ProviderException ex) {
      log.warn("Plaid institution lookup failed for item {}: {}", itemId, ex.getMessage());
    }

    return new ExchangeTokenResult(AggregatorType.PLAID, accessToken, itemId, accounts, institutionId, institutionName);
  }

  @Override
  public List<AccountInfo> getAccounts(String credential) {
    return normalizeAccounts(client.getAccounts(credential));
  }

  @Override
  public List<AccountInfo> getAccountsWithBalances(String credential) {
    return normalizeAccounts(client.getBalances(credential));
  }

  @Override
  public TransactionSyncPage syncTransactions(String credential, String cursor) {
    JsonNode response = client.syncTransactions(credential, cursor);
    List<TransactionInfo> added = new ArrayList<>();
    for (JsonNode node : response.path("added")) {
      added.add(normalizeTransaction(node));
    }
    List<TransactionInfo> modified = new ArrayList<>();
    for (JsonNode node : response.path("modified")) {
      modified.add(normalizeTransaction(node));
    }
    List<String> removed = new ArrayList<>();
    for (JsonNode node : response.path("removed")) {
      String id = node.isTextual() ? node.asText() : text(node, "transaction_id");
      if (id != null) {
        removed.add(id);
      }
    }
    String nextCursor = text(response, "next_cursor");
    if (nextCursor == null) {
      throw new ProviderException("Plaid transaction sync returned no next_cursor");
    }
    return new TransactionSyncPage(added, modified, removed, nextCursor, response.path("has_more").asBoolean(false));
  }

  @Override
  public HoldingsSnapshot getHoldings(String credential) {
    JsonNode response = client.getHoldings(credential);
    List<SecurityInfo> securities = new ArrayList<>();
    Map<String, SecurityInfo> lookup = new HashMap<>();
    for (JsonNode node : response.path("securities")) {
      SecurityInfo security = normalizeSecurity(node);
      securities.add(security);
      lookup.put(security.providerSecurityId(), security);
    }
    List<HoldingInfo> holdings = new ArrayList<>();
    for (JsonNode node : response.path("holdings")) {
      holdings.add(normalizeHolding(node, lookup));
    }
    return new HoldingsSnapshot(holdings, securities);
  }

  @Override
  public boolean disconnect(String credential) {
    try {
      JsonNode response = client.removeItem(credential);
      return !response.has("removed") || response.path("removed").asBoolean(true);
    } catch (ProviderException ex) {
      log.warn("Plaid item removal failed: {}", ex.getMessage());
      return false;
    }
  }

  @Override
  public boolean supportsInstitution(String institutionId) {
    return institutionId == null || !LIMITED_SUPPORT.contains(institutionId);
  }

  @Override
  public String getInstitutionName(String institutionId) {
    if (institutionId == null || institutionId.isBlank()) {
      return null;
    }
    try {
      return text(client.getInstitution(institutionId), "institution.name");
    } catch (ProviderException ex) {
      log.warn("Plaid institution name lookup failed for {}: {}", institutionId, ex.getMessage());
      return null;
    }
  }

  private List<AccountInfo> normalizeAccounts(JsonNode response) {
    List<AccountInfo> accounts = new ArrayList<>();
    for (JsonNode node : response.path("accounts")) {
      accounts.add(normalizeAccount(node));
    }
    return accounts;
  }

  private AccountInfo normalizeAccount(JsonNode node) {
    String accountId = requireText(node, "account_id");
    String type = firstNonBlank(text(node, "type"), "other");
    return new AccountInfo(
        accountId,
        firstNonBlank(text(node, "name"), text(node, "official_name"), accountId),
        type,
        text(node, "subtype"),
        text(node, "mask"),
        amount(node, "balances.current"),
        amount(node, "balances.available"),
        amount(node, "balances.limit"),
        ASSET_TYPES.contains(type),
        firstNonBlank(text(node, "balances.iso_currency_code"), DEFAULT_CURRENCY));
  }

  private TransactionInfo normalizeTransaction(JsonNode node) {
    BigDecimal amount = amount(node, "amount");
    if (amount == null) {
      throw new ProviderException("Plaid transaction " + text(node, "transaction_id") + " has no amount");
    }
    LocalDate date = parseDate(text(node, "date"));
    if (date == null) {
      throw new ProviderException("Plaid transaction " + text(node, "transaction_id") + " has no date");
    }
    return new TransactionInfo(
        requireText(node, "transaction_id"),
        requireText(node, "account_id"),
        amount,
        firstNonBlank(text(node, "iso_currency_code"), text(node, "unofficial_currency_code"), DEFAULT_CURRENCY),
        date,
        parseDate(text(node, "authorized_date")),
        firstNonBlank(text(node, "name"), text(node, "merchant_name"), "Unknown"),
        text(node, "merchant_name"),
        firstNonBlank(text(node, "personal_finance_category.primary"), legacyCategory(node, 0)),
        firstNonBlank(text(node, "personal_finance_category.detailed"), legacyCategory(node, 1)),
        text(node, "payment_channel"),
        node.path("pending").asBoolean(false),
        text(node, "location.city"),
        text(node, "location.region"),
        text(node, "location.country"));
  }

  private SecurityInfo normalizeSecurity(JsonNode node) {
    String securityId = requireText(node, "security_id");
    return new SecurityInfo(
        securityId,
        firstNonBlank(text(node, "name"), text(node, "ticker_symbol"), securityId),
        text(node, "ticker_symbol"),
        text(node, "type"),
        amount(node, "close_price"),
        parseDate(text(node, "close_price_as_of")),
        node.path("is_cash_equivalent").asBoolean(false),
        firstNonBlank(text(node, "iso_currency_code"), DEFAULT_CURRENCY));
  }

  private HoldingInfo normalizeHolding(JsonNode node, Map<String, SecurityInfo> securities) {
    String securityId = requireText(node, "security_id");
    SecurityInfo security = securities.get(securityId);
    return new HoldingInfo(
        requireText(node, "account_id"),
        securityId,
        security == null ? "Unknown" : security.name(),
        security == null ? null : security.tickerSymbol(),
        zeroIfNull(amount(node, "quantity")),
        zeroIfNull(amount(node, "institution_price")),
        parseDate(text(node, "institution_price_as_of")),
        zeroIfNull(amount(node, "institution_value")),
        amount(node, "cost_basis"),
        firstNonBlank(text(node, "iso_currency_code"), DEFAULT_CURRENCY));
  }

  private static String legacyCategory(JsonNode node, int index) {
    JsonNode category = node.path("category");
    if (!category.isArray() || category.size() <= index) {
      return null;
    }
    return category.get(index).asText(null);
  }

  private static String requireText(JsonNode node, String path) {
    String value = text(node, path);
    if (value == null) {
      throw new ProviderException("Plaid payload is missing " + path);
    }
    return value;
  }

  private static String text(JsonNode node, String path) {
    JsonNode current = node;
    for (String part : path.split("\\.")) {
      if (current == null) {
        return null;
      }
      current = current.path(part);
      if (current.isMissingNode() || current.isNull()) {
        return null;
      }
    }
    String value = current.isTextual() ? current.asText() : current.toString();
    return value.isBlank() ? null : value;
  }

  private static BigDecimal amount(JsonNode node, String path) {
    JsonNode current = node;
    for (String part : path.split("\\.")) {
      current = current.path(part);
      if (current.isMissingNode() || current.isNull()) {
        return null;
      }
    }
    if (current.isNumber()) {
      return current.decimalValue();
    }
    if (current.isTextual()) {
      try {
        return new BigDecimal(current.asText());
      } catch (NumberFormatException ignored) {
        return null;
      }
    }
    return null;
  }

  private static BigDecimal zeroIfNull(BigDecimal value) {
    return value == null ? BigDecimal.ZERO : value;
  }

  private static LocalDate parseDate(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return LocalDate.parse(value);
    } catch (DateTimeParseException ex) {
      return null;
    }
  }

  private static Instant parseInstant(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException ex) {
      return null;
    }
  }

  private static String firstNonBlank(String... values) {
    for (String value : values) {
      if (value != null && !value.isBlank()) {
        return value;
      }
    }
    return null;
  }
}
