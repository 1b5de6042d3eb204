package com.finsync.exception;

public class MappingException extends SyncException {
  private final String accountType;
  private final String accountSubtype;

  public MappingException(String accountType, String accountSubtype) {
    super("Unable to map account type " + accountType + "/" + accountSubtype);
    this.accountType = accountType;
    this.accountSubtype = accountSubtype;
  }

  public String getAccountType() {
    return accountType;
  }

  public String getAccountSubtype() {
    return accountSubtype;
  }
}
