package com.finsync.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "securities")
@Getter
@Setter
public class Security {
  @Id
  private UUID id;

  @Column(nullable = false, unique = true)
  private String providerSecurityId;

  @Column(nullable = false)
  private String name;

  @Column(length = 20)
  private String tickerSymbol;

  @Column(nullable = false)
  private boolean cashEquivalent;

  @Column(length = 50)
  private String securityType;

  @Column(precision = 19, scale = 6)
  private BigDecimal closePrice;

  @Column
  private LocalDate closePriceAsOf;

  @Column(length = 3)
  private String currency;

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
  }

  @PreUpdate
  void preUpdate() {
    updatedAt = Instant.now();
  }
}
