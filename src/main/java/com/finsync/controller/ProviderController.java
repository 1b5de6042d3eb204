package com.finsync.controller;

import com.finsync.dto.InstitutionRecommendationResponse;
import com.finsync.dto.ProviderInfoResponse;
import com.finsync.dto.ProvidersResponse;
import com.finsync.service.ProviderCatalogService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/providers")
public class ProviderController {
  private final ProviderCatalogService providerCatalogService;

  public ProviderController(ProviderCatalogService providerCatalogService) {
    this.providerCatalogService = providerCatalogService;
  }

  @GetMapping
  public ProvidersResponse listProviders() {
    return providerCatalogService.listProviders();
  }

  @GetMapping("/recommend")
  public InstitutionRecommendationResponse recommend(
      @RequestParam("institutionName") String institutionName,
      @RequestParam(value = "institutionId", required = false) String institutionId) {
    return providerCatalogService.recommend(institutionName, institutionId);
  }

  @GetMapping("/{provider}")
  public ProviderInfoResponse getProvider(@PathVariable String provider) {
    return providerCatalogService.getProvider(provider);
  }
}
