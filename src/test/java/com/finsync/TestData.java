package com.finsync;

import com.finsync.model.ConnectedAccount;
import com.finsync.provider.TransactionInfo;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

public final class TestData {
  private TestData() {
  }

  public static ConnectedAccount account(UUID userId, String providerAccountId, String type, String subtype) {
    ConnectedAccount account = new ConnectedAccount();
    account.setUserId(userId);
    account.setProviderConnectionId("item-" + userId);
    account.setEncryptedCredential("iv:ciphertext");
    account.setProviderAccountId(providerAccountId);
    account.setInstitutionName("First Platypus Bank");
    account.setAccountName(providerAccountId + " account");
    account.setAccountType(type);
    account.setAccountSubtype(subtype);
    return account;
  }

  public static TransactionInfo transaction(String id, String providerAccountId, String amount, String name) {
    return new TransactionInfo(id, providerAccountId, new BigDecimal(amount), "USD",
        LocalDate.of(2024, 3, 1), null, name, null, "FOOD_AND_DRINK", null, "online", false,
        null, null, null);
  }
}
