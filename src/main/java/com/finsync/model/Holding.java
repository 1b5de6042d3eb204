package com.finsync.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "holdings")
@Getter
@Setter
public class Holding {
  @Id
  private UUID id;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @ManyToOne(optional = false)
  @JoinColumn(name = "connected_account_id")
  private ConnectedAccount account;

  @ManyToOne(optional = false)
  @JoinColumn(name = "security_id")
  private Security security;

  @Column(nullable = false, precision = 24, scale = 8)
  private BigDecimal quantity = BigDecimal.ZERO;

  @Column(nullable = false, precision = 19, scale = 6)
  private BigDecimal institutionPrice = BigDecimal.ZERO;

  @Column
  private LocalDate institutionPriceAsOf;

  @Column(nullable = false, precision = 19, scale = 4)
  private BigDecimal institutionValue = BigDecimal.ZERO;

  @Column(precision = 19, scale = 4)
  private BigDecimal costBasis;

  @Column(length = 3)
  private String currency;

  @Column(nullable = false)
  private Instant createdAt;

  @PrePersist
  void prePersist() {
    if (id == null) {
      id = UUID.randomUUID();
    }
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }
}
