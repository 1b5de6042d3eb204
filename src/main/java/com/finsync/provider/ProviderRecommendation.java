package com.finsync.provider;

import com.finsync.model.AggregatorType;

public record ProviderRecommendation(AggregatorType provider, boolean available, String note) {}
