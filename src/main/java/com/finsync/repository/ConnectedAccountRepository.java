package com.finsync.repository;

import com.finsync.model.ConnectedAccount;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface ConnectedAccountRepository extends JpaRepository<ConnectedAccount, UUID> {
  Optional<ConnectedAccount> findByIdAndUserId(UUID id, UUID userId);

  Optional<ConnectedAccount> findByProviderAccountId(String providerAccountId);

  List<ConnectedAccount> findByUserIdAndActiveTrueOrderByCreatedAtAsc(UUID userId);

  long countByActiveTrue();

  long countByProviderConnectionIdAndActiveTrueAndIdNot(String providerConnectionId, UUID id);

  @Query("select distinct a.userId from ConnectedAccount a where a.active = true")
  List<UUID> findDistinctUserIdsWithActiveAccounts();
}
