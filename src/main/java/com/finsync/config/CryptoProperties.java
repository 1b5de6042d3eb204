package com.finsync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "finsync.crypto")
public record CryptoProperties(String secret) {}
