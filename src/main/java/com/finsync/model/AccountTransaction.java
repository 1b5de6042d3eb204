package com.finsync.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

/**
 * A ledger entry synced from an aggregator. Positive amounts leave the account, negative amounts
 * enter it. {@code providerTransactionId} is the idempotency key for every sync write.
 */
@Entity
@Table(name = "transactions", indexes = {
    @Index(name = "ix_transactions_user_id", columnList = "user_id"),
    @Index(name = "ix_transactions_transaction_date", columnList = "transaction_date")
})
@Getter
@Setter
public class AccountTransaction {
  private static final int DEFAULT_VARCHAR_LIMIT = 255;

  @Id
  private UUID id;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @ManyToOne(optional = false)
  @JoinColumn(name = "connected_account_id")
  private ConnectedAccount account;

  @Column(nullable = false, unique = true)
  private String providerTransactionId;

  @Column(nullable = false)
  private String providerAccountId;

  @Column(nullable = false, precision = 19, scale = 4)
  private BigDecimal amount;

  @Column(length = 3)
  private String currency;

  @Column(name = "transaction_date", nullable = false)
  private LocalDate date;

  @Column
  private LocalDate authorizedDate;

  @Column(nullable = false)
  private String name;

  @Column
  private String merchantName;

  @Column(length = 100)
  private String categoryPrimary;

  @Column(length = 100)
  private String categoryDetailed;

  @Column(length = 50)
  private String paymentChannel;

  @Column(nullable = false)
  private boolean pending;

  @Column(length = 100)
  private String locationCity;

  @Column(length = 50)
  private String locationRegion;

  @Column(length = 50)
  private String locationCountry;

  @Column(length = 100)
  private String userCategory;

  @Column(length = 2000)
  private String userNotes;

  @Column(nullable = false)
  private boolean hidden;

  @Column(nullable = false)
  private Instant createdAt;

  @Column(nullable = false)
  private Instant updatedAt;

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
    normalizeLengths();
  }

  @PreUpdate
  void preUpdate() {
    updatedAt = Instant.now();
    normalizeLengths();
  }

  private void normalizeLengths() {
    name = truncate(name, DEFAULT_VARCHAR_LIMIT);
    merchantName = truncate(merchantName, DEFAULT_VARCHAR_LIMIT);
  }

  private static String truncate(String value, int max) {
    if (value == null || value.length() <= max) {
      return value;
    }
    return value.substring(0, max);
  }
}
