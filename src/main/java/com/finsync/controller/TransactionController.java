package com.finsync.controller;

import com.finsync.dto.TransactionListResponse;
import com.finsync.dto.TransactionResponse;
import com.finsync.dto.UpdateTransactionRequest;
import com.finsync.service.TransactionService;
import jakarta.validation.Valid;
import java.time.LocalDate;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/users/{userId}/transactions")
public class TransactionController {
  private final TransactionService transactionService;
  private final ApiKeyGuard apiKeyGuard;

  public TransactionController(TransactionService transactionService, ApiKeyGuard apiKeyGuard) {
    this.transactionService = transactionService;
    this.apiKeyGuard = apiKeyGuard;
  }

  @GetMapping
  public TransactionListResponse listTransactions(
      @RequestHeader(value = ApiKeyGuard.HEADER, required = false) String apiKey,
      @PathVariable UUID userId,
      @RequestParam(value = "accountId", required = false) UUID accountId,
      @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
      @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
      @RequestParam(value = "page", defaultValue = "0") int page,
      @RequestParam(value = "size", defaultValue = "100") int size) {
    apiKeyGuard.verify(apiKey);
    return transactionService.listTransactions(userId, accountId, from, to, page, size);
  }

  @GetMapping("/{transactionId}")
  public TransactionResponse getTransaction(@RequestHeader(value = ApiKeyGuard.HEADER, required = false) String apiKey,
                                            @PathVariable UUID userId,
                                            @PathVariable UUID transactionId) {
    apiKeyGuard.verify(apiKey);
    return transactionService.getTransaction(userId, transactionId);
  }

  @PutMapping("/{transactionId}")
  public TransactionResponse updateTransaction(
      @RequestHeader(value = ApiKeyGuard.HEADER, required = false) String apiKey,
      @PathVariable UUID userId,
      @PathVariable UUID transactionId,
      @Valid @RequestBody UpdateTransactionRequest request) {
    apiKeyGuard.verify(apiKey);
    return transactionService.updateTransaction(userId, transactionId, request);
  }
}
