package com.finsync.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.finsync.dto.InstitutionRecommendationResponse;
import com.finsync.dto.ProvidersResponse;
import com.finsync.model.AggregatorType;
import com.finsync.provider.AggregatorProvider;
import com.finsync.provider.ProviderRegistry;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

class ProviderCatalogServiceTest {
  private ProviderCatalogService service;

  @BeforeEach
  void setUp() {
    AggregatorProvider plaid = mock(AggregatorProvider.class);
    when(plaid.getType()).thenReturn(AggregatorType.PLAID);
    when(plaid.supportsInstitution("ins_1")).thenReturn(true);
    service = new ProviderCatalogService(
        new ProviderRegistry(Map.of(AggregatorType.PLAID, () -> plaid), AggregatorType.PLAID));
  }

  @Test
  @DisplayName("Only backed providers are listed, with the default named")
  void listsProviders() {
    ProvidersResponse providers = service.listProviders();

    assertThat(providers.getProviders()).containsExactly("plaid");
    assertThat(providers.getDefaultProvider()).isEqualTo("plaid");
  }

  @Test
  @DisplayName("Declared providers report availability and unknown ones are not found")
  void providerInfo() {
    assertThat(service.getProvider("plaid").isAvailable()).isTrue();
    assertThat(service.getProvider("MX").isAvailable()).isFalse();
    assertThat(service.getProvider("MX").getProvider()).isEqualTo("mx");
    assertThatThrownBy(() -> service.getProvider("acme"))
        .isInstanceOfSatisfying(ResponseStatusException.class,
            ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND));
  }

  @Test
  @DisplayName("USAA is recommended through MX, flagged unavailable until MX is backed")
  void recommendsOverrideProvider() {
    InstitutionRecommendationResponse usaa = service.recommend(" USAA ", null);

    assertThat(usaa.getInstitutionName()).isEqualTo("USAA");
    assertThat(usaa.getRecommendedProvider()).isEqualTo("mx");
    assertThat(usaa.isAvailable()).isFalse();
    assertThat(usaa.getNote()).contains("plaid is used instead");
  }

  @Test
  @DisplayName("Other institutions are recommended through the default provider")
  void recommendsDefaultProvider() {
    InstitutionRecommendationResponse chase = service.recommend("Chase", "ins_1");

    assertThat(chase.getRecommendedProvider()).isEqualTo("plaid");
    assertThat(chase.isAvailable()).isTrue();
    assertThat(chase.getNote()).isNull();
  }
}
