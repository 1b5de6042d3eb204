package com.finsync.controller;

import com.finsync.config.BatchProperties;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

/** Checks the shared {@code X-API-Key} secret that guards the internal sync API. */
@Component
public class ApiKeyGuard {
  public static final String HEADER = "X-API-Key";

  private final BatchProperties batchProperties;

  public ApiKeyGuard(BatchProperties batchProperties) {
    this.batchProperties = batchProperties;
  }

  public boolean isConfigured() {
    String expected = batchProperties.apiKey();
    return expected != null && !expected.isBlank();
  }

  public void verify(String providedKey) {
    if (!isConfigured()) {
      throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Batch API key is not configured");
    }
    String expected = batchProperties.apiKey();
    if (providedKey == null || !MessageDigest.isEqual(
        expected.getBytes(StandardCharsets.UTF_8), providedKey.getBytes(StandardCharsets.UTF_8))) {
      throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Invalid API key");
    }
  }
}
