package com.finsync.repository;

import com.finsync.model.Holding;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface HoldingRepository extends JpaRepository<Holding, UUID> {
  List<Holding> findByAccountId(UUID accountId);

  @Transactional
  @Modifying(flushAutomatically = true)
  @Query("delete from Holding h where h.account.id = :accountId")
  int deleteByAccountId(@Param("accountId") UUID accountId);
}
