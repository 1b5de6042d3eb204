package com.finsync.exception;

public class StorageException extends SyncException {
  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
