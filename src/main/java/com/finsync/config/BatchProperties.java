package com.finsync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "finsync.batch")
public record BatchProperties(String apiKey) {}
