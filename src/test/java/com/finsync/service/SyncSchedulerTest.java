package com.finsync.service;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.finsync.config.SyncProperties;
import com.finsync.dto.BatchSyncReport;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SyncSchedulerTest {
  @Mock
  private BatchSyncService batchSyncService;

  @Test
  @DisplayName("Nothing runs while scheduled sync is disabled")
  void disabledSchedulerDoesNothing() {
    new SyncScheduler(new SyncProperties(false, 1000), batchSyncService).run();

    verify(batchSyncService, never()).syncAllUsers();
  }

  @Test
  @DisplayName("An enabled scheduler runs a full batch sync")
  void enabledSchedulerRunsBatch() {
    Instant now = Instant.now();
    when(batchSyncService.syncAllUsers()).thenReturn(
        new BatchSyncReport(now, now, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, List.of(), true, false));

    new SyncScheduler(new SyncProperties(true, 1000), batchSyncService).run();

    verify(batchSyncService).syncAllUsers();
  }
}
