package com.finsync.provider;

public record LinkOptions(String redirectUri, String webhook, String institutionId) {
  public static LinkOptions defaults() {
    return new LinkOptions(null, null, null);
  }
}
