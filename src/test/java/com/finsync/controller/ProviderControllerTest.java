package com.finsync.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.finsync.dto.InstitutionRecommendationResponse;
import com.finsync.dto.ProviderInfoResponse;
import com.finsync.service.ProviderCatalogService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class ProviderControllerTest {
  @Mock
  private ProviderCatalogService providerCatalogService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc = MockMvcBuilders.standaloneSetup(new ProviderController(providerCatalogService)).build();
  }

  @Test
  @DisplayName("The recommendation route is not mistaken for a provider name")
  void recommendRoute() throws Exception {
    when(providerCatalogService.recommend("Fidelity", null)).thenReturn(new InstitutionRecommendationResponse(
        "Fidelity", "finicity", false, "finicity integration is not available yet, plaid is used instead"));

    mockMvc.perform(get("/api/providers/recommend").param("institutionName", "Fidelity"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.recommendedProvider").value("finicity"))
        .andExpect(jsonPath("$.available").value(false));
  }

  @Test
  @DisplayName("Provider details are served by tag")
  void providerByTag() throws Exception {
    when(providerCatalogService.getProvider("plaid")).thenReturn(new ProviderInfoResponse("plaid", true));

    mockMvc.perform(get("/api/providers/plaid"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.provider").value("plaid"))
        .andExpect(jsonPath("$.available").value(true));
  }
}
