package com.finsync.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class InstitutionRecommendationResponse {
  private String institutionName;
  private String recommendedProvider;
  private boolean available;
  private String note;
}
