package com.finsync.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "finsync.providers.plaid")
public record PlaidProperties(
    String environment,
    String baseUrl,
    String clientId,
    String secret,
    String clientName,
    List<String> countryCodes,
    List<String> products,
    String language,
    String redirectUri,
    String webhook,
    String version,
    Boolean debugLogResponses
) {
  public String resolveBaseUrl() {
    if (baseUrl != null && !baseUrl.isBlank()) {
      return baseUrl;
    }
    String env = environment == null ? "sandbox" : environment.trim().toLowerCase();
    return switch (env) {
      case "production" -> "https://production.plaid.com";
      case "development" -> "https://development.plaid.com";
      default -> "https://sandbox.plaid.com";
    };
  }
}
