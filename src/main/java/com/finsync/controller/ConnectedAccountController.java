package com.finsync.controller;

import com.finsync.dto.AccountStatsResponse;
import com.finsync.dto.ConnectedAccountResponse;
import com.finsync.dto.ExchangeTokenRequest;
import com.finsync.dto.HoldingListResponse;
import com.finsync.dto.LinkAccountRequest;
import com.finsync.dto.LinkResult;
import com.finsync.dto.LinkSuggestion;
import com.finsync.dto.LinkTokenRequest;
import com.finsync.dto.UserSyncReport;
import com.finsync.provider.LinkTokenResult;
import com.finsync.service.ConnectedAccountService;
import com.finsync.service.HoldingService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/users/{userId}")
public class ConnectedAccountController {
  private final ConnectedAccountService connectedAccountService;
  private final HoldingService holdingService;
  private final ApiKeyGuard apiKeyGuard;

  public ConnectedAccountController(ConnectedAccountService connectedAccountService,
                                    HoldingService holdingService,
                                    ApiKeyGuard apiKeyGuard) {
    this.connectedAccountService = connectedAccountService;
    this.holdingService = holdingService;
    this.apiKeyGuard = apiKeyGuard;
  }

  @PostMapping("/link-token")
  public LinkTokenResult createLinkToken(@RequestHeader(value = ApiKeyGuard.HEADER, required = false) String apiKey,
                                         @PathVariable UUID userId,
                                         @RequestBody(required = false) LinkTokenRequest request) {
    apiKeyGuard.verify(apiKey);
    return connectedAccountService.createLinkToken(userId, request == null ? null : request.getInstitutionName());
  }

  @PostMapping("/exchange-token")
  public List<LinkSuggestion> exchangeToken(@RequestHeader(value = ApiKeyGuard.HEADER, required = false) String apiKey,
                                            @PathVariable UUID userId,
                                            @Valid @RequestBody ExchangeTokenRequest request) {
    apiKeyGuard.verify(apiKey);
    return connectedAccountService.exchangePublicToken(userId, request.getPublicToken(), request.getProvider());
  }

  @GetMapping("/accounts")
  public List<ConnectedAccountResponse> listAccounts(
      @RequestHeader(value = ApiKeyGuard.HEADER, required = false) String apiKey,
      @PathVariable UUID userId) {
    apiKeyGuard.verify(apiKey);
    return connectedAccountService.listAccounts(userId);
  }

  @GetMapping("/accounts/stats")
  public AccountStatsResponse accountStats(@RequestHeader(value = ApiKeyGuard.HEADER, required = false) String apiKey,
                                           @PathVariable UUID userId) {
    apiKeyGuard.verify(apiKey);
    return connectedAccountService.accountStats(userId);
  }

  @GetMapping("/accounts/{accountId}/holdings")
  public HoldingListResponse listHoldings(@RequestHeader(value = ApiKeyGuard.HEADER, required = false) String apiKey,
                                          @PathVariable UUID userId,
                                          @PathVariable UUID accountId) {
    apiKeyGuard.verify(apiKey);
    return holdingService.listHoldings(userId, accountId);
  }

  @PostMapping("/accounts/{accountId}/link")
  public LinkResult linkAccount(@RequestHeader(value = ApiKeyGuard.HEADER, required = false) String apiKey,
                                @PathVariable UUID userId,
                                @PathVariable UUID accountId,
                                @Valid @RequestBody LinkAccountRequest request) {
    apiKeyGuard.verify(apiKey);
    return connectedAccountService.linkToEntity(userId, accountId, request.getEntityType(), request.getEntityId());
  }

  @PostMapping("/accounts/{accountId}/sync")
  public UserSyncReport syncAccount(@RequestHeader(value = ApiKeyGuard.HEADER, required = false) String apiKey,
                                    @PathVariable UUID userId,
                                    @PathVariable UUID accountId) {
    apiKeyGuard.verify(apiKey);
    return connectedAccountService.syncAccount(userId, accountId);
  }

  @DeleteMapping("/accounts/{accountId}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void disconnect(@RequestHeader(value = ApiKeyGuard.HEADER, required = false) String apiKey,
                         @PathVariable UUID userId,
                         @PathVariable UUID accountId) {
    apiKeyGuard.verify(apiKey);
    connectedAccountService.disconnect(userId, accountId);
  }
}
