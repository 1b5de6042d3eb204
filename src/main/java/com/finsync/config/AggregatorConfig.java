package com.finsync.config;

import com.finsync.model.AggregatorType;
import com.finsync.provider.AggregatorProvider;
import com.finsync.provider.ProviderRegistry;
import com.finsync.provider.plaid.PlaidProvider;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AggregatorConfig {
  @Bean
  public ProviderRegistry providerRegistry(ObjectProvider<PlaidProvider> plaidProvider,
                                           AggregatorProperties properties) {
    Map<AggregatorType, Supplier<? extends AggregatorProvider>> factories = new EnumMap<>(AggregatorType.class);
    factories.put(AggregatorType.PLAID, plaidProvider::getObject);
    String defaultTag = properties.defaultProvider();
    AggregatorType defaultType = defaultTag == null || defaultTag.isBlank()
        ? AggregatorType.PLAID
        : AggregatorType.fromTag(defaultTag);
    return new ProviderRegistry(factories, defaultType);
  }
}
