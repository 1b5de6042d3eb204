package com.finsync.provider;

import com.finsync.exception.ProviderNotImplementedException;
import com.finsync.model.AggregatorType;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves aggregator providers by type and by institution. Instances are built lazily on first
 * resolution and cached for the lifetime of the registry. Declared types without a factory fail
 * at resolution with {@link ProviderNotImplementedException}.
 */
public class ProviderRegistry {
  private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

  private static final Map<String, AggregatorType> INSTITUTION_OVERRIDES = Map.of(
      "Fidelity", AggregatorType.FINICITY,
      "Fidelity Investments", AggregatorType.FINICITY,
      "Fidelity NetBenefits", AggregatorType.FINICITY,
      "Fidelity 401k", AggregatorType.FINICITY,
      "USAA", AggregatorType.MX);

  private final Map<AggregatorType, Supplier<? extends AggregatorProvider>> factories;
  private final Map<AggregatorType, AggregatorProvider> providers = new ConcurrentHashMap<>();
  private final AggregatorType defaultType;

  public ProviderRegistry(Map<AggregatorType, Supplier<? extends AggregatorProvider>> factories,
                          AggregatorType defaultType) {
    this.factories = factories.isEmpty() ? Map.of() : new EnumMap<>(factories);
    this.defaultType = defaultType == null ? AggregatorType.PLAID : defaultType;
  }

  public AggregatorProvider getProvider(AggregatorType type) {
    Supplier<? extends AggregatorProvider> factory = factories.get(type);
    if (factory == null) {
      throw new ProviderNotImplementedException(type);
    }
    return providers.computeIfAbsent(type, key -> factory.get());
  }

  public AggregatorProvider getDefaultProvider() {
    return getProvider(defaultType);
  }

  public AggregatorProvider getProviderForInstitution(String institutionName) {
    if (institutionName != null) {
      String normalized = institutionName.trim();
      AggregatorType required = INSTITUTION_OVERRIDES.get(normalized);
      if (required != null && required != defaultType) {
        try {
          return getProvider(required);
        } catch (ProviderNotImplementedException ex) {
          log.warn("Provider {} not available for institution {}, falling back to {}",
              required.getTag(), normalized, defaultType.getTag());
        }
      }
    }
    return getDefaultProvider();
  }

  /**
   * Recommended provider for an institution. An override whose provider is not backed yet is still
   * reported, flagged unavailable, with the default provider named as fallback. A provider that
   * declines the institution id is also reported unavailable.
   */
  public ProviderRecommendation recommendForInstitution(String institutionName, String institutionId) {
    String normalized = institutionName == null ? "" : institutionName.trim();
    AggregatorType required = INSTITUTION_OVERRIDES.get(normalized);
    if (required != null && required != defaultType && !isAvailable(required)) {
      return new ProviderRecommendation(required, false,
          required.getTag() + " integration is not available yet, " + defaultType.getTag() + " is used instead");
    }
    AggregatorProvider provider = getProviderForInstitution(normalized);
    if (institutionId != null && !institutionId.isBlank() && !provider.supportsInstitution(institutionId)) {
      return new ProviderRecommendation(provider.getType(), false,
          provider.getType().getTag() + " has limited support for institution " + institutionId);
    }
    return new ProviderRecommendation(provider.getType(), true, null);
  }

  public boolean isAvailable(AggregatorType type) {
    return factories.containsKey(type);
  }

  public List<AggregatorType> getAvailableProviders() {
    return Arrays.stream(AggregatorType.values())
        .filter(factories::containsKey)
        .toList();
  }

  public AggregatorType getDefaultType() {
    return defaultType;
  }
}
