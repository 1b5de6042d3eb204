package com.finsync.provider.plaid;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.finsync.config.PlaidProperties;
import com.finsync.exception.ProviderException;
import com.finsync.provider.LinkOptions;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Lazy;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Component
@Lazy
public class PlaidClient {
  private static final Logger log = LoggerFactory.getLogger(PlaidClient.class);
  private static final int SYNC_PAGE_SIZE = 500;

  private final PlaidProperties properties;
  private final ObjectMapper objectMapper;
  private final RestClient restClient;

  public PlaidClient(PlaidProperties properties, RestClient.Builder builder, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    RestClient.Builder configured = builder
        .baseUrl(properties.resolveBaseUrl())
        .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE);
    if (properties.clientId() != null) {
      configured = configured.defaultHeader("PLAID-CLIENT-ID", properties.clientId());
    }
    if (properties.secret() != null) {
      configured = configured.defaultHeader("PLAID-SECRET", properties.secret());
    }
    if (properties.version() != null && !properties.version().isBlank()) {
      configured = configured.defaultHeader("Plaid-Version", properties.version());
    }
    this.restClient = configured.build();
  }

  public JsonNode createLinkToken(String userId, LinkOptions options) {
    ObjectNode body = objectMapper.createObjectNode();
    body.putObject("user").put("client_user_id", userId);
    body.put("client_name", firstNonBlank(properties.clientName(), "FinSync"));
    body.put("language", firstNonBlank(properties.language(), "en"));
    putArray(body, "products", orDefault(properties.products(), List.of("transactions")));
    putArray(body, "country_codes", orDefault(properties.countryCodes(), List.of("US")));
    LinkOptions effective = options == null ? LinkOptions.defaults() : options;
    String redirectUri = firstNonBlank(effective.redirectUri(), properties.redirectUri());
    if (redirectUri != null) {
      body.put("redirect_uri", redirectUri);
    }
    String webhook = firstNonBlank(effective.webhook(), properties.webhook());
    if (webhook != null) {
      body.put("webhook", webhook);
    }
    if (effective.institutionId() != null && !effective.institutionId().isBlank()) {
      body.put("institution_id", effective.institutionId());
    }
    return post("/link/token/create", body);
  }

  public JsonNode exchangePublicToken(String publicToken) {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("public_token", publicToken);
    return post("/item/public_token/exchange", body);
  }

  public JsonNode getAccounts(String accessToken) {
    return post("/accounts/get", accessTokenBody(accessToken));
  }

  public JsonNode getBalances(String accessToken) {
    return post("/accounts/balance/get", accessTokenBody(accessToken));
  }

  public JsonNode syncTransactions(String accessToken, String cursor) {
    ObjectNode body = accessTokenBody(accessToken);
    if (cursor != null && !cursor.isBlank()) {
      body.put("cursor", cursor);
    }
    body.put("count", SYNC_PAGE_SIZE);
    return post("/transactions/sync", body);
  }

  public JsonNode getHoldings(String accessToken) {
    return post("/investments/holdings/get", accessTokenBody(accessToken));
  }

  public JsonNode removeItem(String accessToken) {
    return post("/item/remove", accessTokenBody(accessToken));
  }

  public JsonNode getInstitution(String institutionId) {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("institution_id", institutionId);
    putArray(body, "country_codes", orDefault(properties.countryCodes(), List.of("US")));
    return post("/institutions/get_by_id", body);
  }

  private ObjectNode accessTokenBody(String accessToken) {
    if (accessToken == null || accessToken.isBlank()) {
      throw new ProviderException("Missing Plaid access token");
    }
    ObjectNode body = objectMapper.createObjectNode();
    body.put("access_token", accessToken);
    return body;
  }

  private JsonNode post(String path, ObjectNode body) {
    requireConfigured("clientId", properties.clientId());
    requireConfigured("secret", properties.secret());
    try {
      if (isDebugLogEnabled()) {
        log.info("Plaid POST {}", path);
      }
      JsonNode response = restClient.post()
          .uri(path)
          .contentType(MediaType.APPLICATION_JSON)
          .body(body)
          .retrieve()
          .body(JsonNode.class);
      if (isDebugLogEnabled()) {
        log.info("Plaid response {}: {}", path, truncate(response == null ? "null" : response.toString(), 2000));
      }
      if (response == null) {
        throw new ProviderException("Empty Plaid response for " + path);
      }
      return response;
    } catch (RestClientResponseException ex) {
      throw toProviderException(path, ex);
    } catch (RestClientException ex) {
      throw new ProviderException("Plaid request " + path + " failed: " + ex.getMessage(), ex);
    }
  }

  private ProviderException toProviderException(String path, RestClientResponseException ex) {
    String errorCode = null;
    String errorMessage = ex.getStatusText();
    String raw = ex.getResponseBodyAsString();
    if (raw != null && !raw.isBlank()) {
      try {
        JsonNode error = objectMapper.readTree(raw);
        errorCode = textOrNull(error.path("error_code"));
        errorMessage = firstNonBlank(textOrNull(error.path("error_message")), errorMessage);
      } catch (Exception parseFailure) {
        log.debug("Plaid error body for {} is not JSON: {}", path, truncate(raw, 500));
      }
    }
    String message = errorCode == null
        ? "Plaid API error (" + ex.getStatusCode().value() + "): " + errorMessage
        : "Plaid error (" + errorCode + "): " + errorMessage;
    return new ProviderException(message, errorCode, ex);
  }

  private void putArray(ObjectNode body, String field, List<String> values) {
    ArrayNode array = body.putArray(field);
    values.forEach(array::add);
  }

  private boolean isDebugLogEnabled() {
    return Boolean.TRUE.equals(properties.debugLogResponses());
  }

  private void requireConfigured(String name, String value) {
    if (value == null || value.isBlank()) {
      throw new ProviderException("Missing Plaid configuration: " + name);
    }
  }

  private static List<String> orDefault(List<String> values, List<String> fallback) {
    return values == null || values.isEmpty() ? fallback : values;
  }

  private static String textOrNull(JsonNode node) {
    return node == null || node.isMissingNode() || node.isNull() ? null : node.asText();
  }

  private static String truncate(String value, int maxLength) {
    if (value == null || value.length() <= maxLength) {
      return value;
    }
    return value.substring(0, maxLength) + "...";
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
