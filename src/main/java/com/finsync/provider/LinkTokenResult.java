package com.finsync.provider;

import com.finsync.model.AggregatorType;
import java.time.Instant;

public record LinkTokenResult(AggregatorType provider, String linkToken, String connectUrl, Instant expiration) {}
