package com.finsync.controller;

import com.finsync.dto.BatchStatusResponse;
import com.finsync.dto.BatchSyncReport;
import com.finsync.dto.UserSyncReport;
import com.finsync.service.BatchSyncService;
import java.util.UUID;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/batch")
public class BatchSyncController {
  private final BatchSyncService batchSyncService;
  private final ApiKeyGuard apiKeyGuard;

  public BatchSyncController(BatchSyncService batchSyncService, ApiKeyGuard apiKeyGuard) {
    this.batchSyncService = batchSyncService;
    this.apiKeyGuard = apiKeyGuard;
  }

  @PostMapping("/sync")
  public BatchSyncReport syncAll(@RequestHeader(value = ApiKeyGuard.HEADER, required = false) String apiKey) {
    apiKeyGuard.verify(apiKey);
    return batchSyncService.syncAllUsers();
  }

  @GetMapping("/status")
  public BatchStatusResponse status(@RequestHeader(value = ApiKeyGuard.HEADER, required = false) String apiKey) {
    apiKeyGuard.verify(apiKey);
    return batchSyncService.getStatus(apiKeyGuard.isConfigured());
  }

  @PostMapping("/sync/users/{userId}")
  public UserSyncReport syncUser(@RequestHeader(value = ApiKeyGuard.HEADER, required = false) String apiKey,
                                 @PathVariable UUID userId) {
    apiKeyGuard.verify(apiKey);
    return batchSyncService.syncUser(userId);
  }
}
