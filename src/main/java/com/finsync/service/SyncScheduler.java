package com.finsync.service;

import com.finsync.config.SyncProperties;
import com.finsync.dto.BatchSyncReport;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class SyncScheduler {
  private static final Logger log = LoggerFactory.getLogger(SyncScheduler.class);

  private final SyncProperties syncProperties;
  private final BatchSyncService batchSyncService;
  private final AtomicBoolean running = new AtomicBoolean(false);

  public SyncScheduler(SyncProperties syncProperties, BatchSyncService batchSyncService) {
    this.syncProperties = syncProperties;
    this.batchSyncService = batchSyncService;
  }

  @Scheduled(fixedDelayString = "${finsync.sync.poll-ms:3600000}", initialDelayString = "${finsync.sync.poll-ms:3600000}")
  public void run() {
    if (!syncProperties.enabled()) {
      return;
    }
    if (!running.compareAndSet(false, true)) {
      log.info("Skipping scheduled sync, previous run still in progress");
      return;
    }
    try {
      BatchSyncReport report = batchSyncService.syncAllUsers();
      if (!report.isSuccess()) {
        log.warn("Scheduled sync completed with {} failed user(s)", report.getUsersFailed());
      }
    } finally {
      running.set(false);
    }
  }
}
