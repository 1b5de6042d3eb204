package com.finsync.repository;

import com.finsync.model.AccountTransaction;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface AccountTransactionRepository extends JpaRepository<AccountTransaction, UUID> {
  Optional<AccountTransaction> findByProviderTransactionId(String providerTransactionId);

  List<AccountTransaction> findByAccountIdOrderByDateDesc(UUID accountId);

  Optional<AccountTransaction> findByIdAndUserId(UUID id, UUID userId);

  @Query(value = "select t from AccountTransaction t " +
      "where t.userId = :userId and t.date >= :from and t.date <= :to " +
      "order by t.date desc, t.createdAt desc",
      countQuery = "select count(t) from AccountTransaction t " +
          "where t.userId = :userId and t.date >= :from and t.date <= :to")
  Page<AccountTransaction> findUserTransactionsInRange(
      @Param("userId") UUID userId,
      @Param("from") LocalDate from,
      @Param("to") LocalDate to,
      Pageable pageable);

  @Query(value = "select t from AccountTransaction t " +
      "where t.userId = :userId and t.account.id = :accountId and t.date >= :from and t.date <= :to " +
      "order by t.date desc, t.createdAt desc",
      countQuery = "select count(t) from AccountTransaction t " +
          "where t.userId = :userId and t.account.id = :accountId and t.date >= :from and t.date <= :to")
  Page<AccountTransaction> findAccountTransactionsInRange(
      @Param("userId") UUID userId,
      @Param("accountId") UUID accountId,
      @Param("from") LocalDate from,
      @Param("to") LocalDate to,
      Pageable pageable);

  long countByAccountId(UUID accountId);

  @Transactional
  @Modifying(flushAutomatically = true)
  @Query("delete from AccountTransaction t where t.providerTransactionId = :providerTransactionId")
  int deleteByProviderTransactionId(@Param("providerTransactionId") String providerTransactionId);

  @Transactional
  @Modifying(flushAutomatically = true)
  @Query("delete from AccountTransaction t where t.account.id = :accountId")
  int deleteByAccountId(@Param("accountId") UUID accountId);
}
