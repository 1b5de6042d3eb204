package com.finsync.exception;

import com.finsync.model.AggregatorType;

public class ProviderNotImplementedException extends SyncException {
  private final AggregatorType type;

  public ProviderNotImplementedException(AggregatorType type) {
    super("Provider " + type.getTag() + " is not implemented");
    this.type = type;
  }

  public AggregatorType getType() {
    return type;
  }
}
