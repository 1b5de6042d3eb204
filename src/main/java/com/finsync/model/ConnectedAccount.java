package com.finsync.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "connected_accounts", indexes = {
    @Index(name = "ix_connected_accounts_user_id", columnList = "user_id"),
    @Index(name = "ix_connected_accounts_connection_id", columnList = "provider_connection_id")
})
@Getter
@Setter
public class ConnectedAccount {
  private static final int ERROR_LIMIT = 2000;

  @Id
  private UUID id;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 32)
  private AggregatorType provider = AggregatorType.PLAID;

  @Column(name = "provider_connection_id", nullable = false)
  private String providerConnectionId;

  @Column(nullable = false, length = 4096)
  private String encryptedCredential;

  @Column(name = "provider_account_id", nullable = false, unique = true)
  private String providerAccountId;

  @Column
  private String institutionId;

  @Column(nullable = false)
  private String institutionName;

  @Column(nullable = false)
  private String accountName;

  @Column(nullable = false, length = 50)
  private String accountType;

  @Column(length = 50)
  private String accountSubtype;

  @Column(length = 10)
  private String mask;

  @Column(nullable = false)
  private boolean active = true;

  @Column
  private Instant lastSyncedAt;

  @Column(length = ERROR_LIMIT)
  private String lastSyncError;

  @Column(length = 4096)
  private String syncCursor;

  @Column(nullable = false)
  private Instant createdAt;

  @Column(nullable = false)
  private Instant updatedAt;

  public AccountKind getKind() {
    return AccountKind.from(accountType);
  }

  public void setLastSyncError(String lastSyncError) {
    if (lastSyncError != null && lastSyncError.length() > ERROR_LIMIT) {
      lastSyncError = lastSyncError.substring(0, ERROR_LIMIT);
    }
    this.lastSyncError = lastSyncError;
  }

  @PrePersist
  void prePersist() {
    if (id == null) {
      id = UUID.randomUUID();
    }
    Instant now = Instant.now();
    if (createdAt == null) {
      createdAt = now;
    }
    updatedAt = now;
  }

  @PreUpdate
  void preUpdate() {
    updatedAt = Instant.now();
  }
}
