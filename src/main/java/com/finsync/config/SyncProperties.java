package com.finsync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "finsync.sync")
public record SyncProperties(boolean enabled, long pollMs) {}
