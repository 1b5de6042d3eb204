package com.finsync.exception;

public abstract class SyncException extends RuntimeException {
  protected SyncException(String message) {
    super(message);
  }

  protected SyncException(String message, Throwable cause) {
    super(message, cause);
  }
}
