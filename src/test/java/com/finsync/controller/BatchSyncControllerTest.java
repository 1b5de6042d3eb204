package com.finsync.controller;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;

import com.finsync.config.BatchProperties;
import com.finsync.dto.BatchStatusResponse;
import com.finsync.dto.SyncErrorEntry;
import com.finsync.dto.UserSyncReport;
import com.finsync.model.SyncStage;
import com.finsync.service.BatchSyncService;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.result.MockMvcResultMatchers;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class BatchSyncControllerTest {
  @Mock
  private BatchSyncService batchSyncService;

  private MockMvc mockMvc(String configuredKey) {
    BatchSyncController controller = new BatchSyncController(batchSyncService,
        new ApiKeyGuard(new BatchProperties(configuredKey)));
    return MockMvcBuilders.standaloneSetup(controller).build();
  }

  @Test
  @DisplayName("Requests are refused while no API key is configured")
  void unconfiguredKey() throws Exception {
    mockMvc(null).perform(post("/api/batch/sync").header(ApiKeyGuard.HEADER, "anything"))
        .andExpect(MockMvcResultMatchers.status().isServiceUnavailable());
    verify(batchSyncService, never()).syncAllUsers();
  }

  @Test
  @DisplayName("A wrong or missing API key is unauthorized")
  void wrongKey() throws Exception {
    MockMvc mvc = mockMvc("test-key");
    mvc.perform(post("/api/batch/sync").header(ApiKeyGuard.HEADER, "nope"))
        .andExpect(MockMvcResultMatchers.status().isUnauthorized());
    mvc.perform(post("/api/batch/sync"))
        .andExpect(MockMvcResultMatchers.status().isUnauthorized());
  }

  @Test
  @DisplayName("A user sync returns the user report with stage tags")
  void syncUser() throws Exception {
    UUID userId = UUID.randomUUID();
    UUID accountId = UUID.randomUUID();
    when(batchSyncService.syncUser(userId)).thenReturn(new UserSyncReport(userId, 1, 0, 2, 0, 0, 0, 0,
        List.of(new SyncErrorEntry(accountId, "Checking", SyncStage.TRANSACTION_SYNC, "boom"))));

    mockMvc("test-key").perform(post("/api/batch/sync/users/" + userId).header(ApiKeyGuard.HEADER, "test-key"))
        .andExpect(MockMvcResultMatchers.status().isOk())
        .andExpect(jsonPath("$.accountsSynced").value(1))
        .andExpect(jsonPath("$.transactionsAdded").value(2))
        .andExpect(jsonPath("$.errors[0].stage").value("transaction_sync"))
        .andExpect(jsonPath("$.errors[0].message").value("boom"));
  }

  @Test
  @DisplayName("Status reports users and active accounts behind the API key")
  void status() throws Exception {
    when(batchSyncService.getStatus(true)).thenReturn(new BatchStatusResponse(3, 7L, true));

    mockMvc("test-key").perform(get("/api/batch/status").header(ApiKeyGuard.HEADER, "test-key"))
        .andExpect(MockMvcResultMatchers.status().isOk())
        .andExpect(jsonPath("$.usersWithAccounts").value(3))
        .andExpect(jsonPath("$.totalActiveAccounts").value(7))
        .andExpect(jsonPath("$.batchSyncConfigured").value(true));
  }
}
