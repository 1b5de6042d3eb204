package com.finsync.repository;

import com.finsync.model.Liability;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface LiabilityRepository extends JpaRepository<Liability, UUID> {
  Optional<Liability> findFirstByConnectedAccountIdOrderByCreatedAtAsc(UUID connectedAccountId);

  List<Liability> findByConnectedAccountId(UUID connectedAccountId);

  Optional<Liability> findByIdAndUserId(UUID id, UUID userId);
}
