package com.finsync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "finsync.aggregators")
public record AggregatorProperties(String defaultProvider) {}
