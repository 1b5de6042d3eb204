package com.finsync.exception;

public class CredentialException extends SyncException {
  public CredentialException(String message, Throwable cause) {
    super(message, cause);
  }
}
