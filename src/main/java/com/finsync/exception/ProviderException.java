package com.finsync.exception;

public class ProviderException extends SyncException {
  private final String errorCode;

  public ProviderException(String message) {
    this(message, null, null);
  }

  public ProviderException(String message, Throwable cause) {
    this(message, null, cause);
  }

  public ProviderException(String message, String errorCode, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }

  public String getErrorCode() {
    return errorCode;
  }
}
