package com.finsync.service;

import com.finsync.dto.InstitutionRecommendationResponse;
import com.finsync.dto.ProviderInfoResponse;
import com.finsync.dto.ProvidersResponse;
import com.finsync.model.AggregatorType;
import com.finsync.provider.ProviderRecommendation;
import com.finsync.provider.ProviderRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

/** Which aggregators are usable and which one an institution should be linked through. */
@Service
public class ProviderCatalogService {
  private final ProviderRegistry providerRegistry;

  public ProviderCatalogService(ProviderRegistry providerRegistry) {
    this.providerRegistry = providerRegistry;
  }

  public ProvidersResponse listProviders() {
    return new ProvidersResponse(
        providerRegistry.getAvailableProviders().stream().map(AggregatorType::getTag).toList(),
        providerRegistry.getDefaultType().getTag());
  }

  public ProviderInfoResponse getProvider(String tag) {
    AggregatorType type;
    try {
      type = AggregatorType.fromTag(tag);
    } catch (IllegalArgumentException ex) {
      throw new ResponseStatusException(HttpStatus.NOT_FOUND, ex.getMessage());
    }
    return new ProviderInfoResponse(type.getTag(), providerRegistry.isAvailable(type));
  }

  public InstitutionRecommendationResponse recommend(String institutionName, String institutionId) {
    if (institutionName == null || institutionName.isBlank()) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "institutionName is required");
    }
    ProviderRecommendation recommendation = providerRegistry.recommendForInstitution(institutionName, institutionId);
    return new InstitutionRecommendationResponse(institutionName.trim(), recommendation.provider().getTag(),
        recommendation.available(), recommendation.note());
  }
}
