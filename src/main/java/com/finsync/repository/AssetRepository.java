package com.finsync.repository;

import com.finsync.model.Asset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AssetRepository extends JpaRepository<Asset, UUID> {
  Optional<Asset> findFirstByConnectedAccountIdOrderByCreatedAtAsc(UUID connectedAccountId);

  List<Asset> findByConnectedAccountId(UUID connectedAccountId);

  Optional<Asset> findByIdAndUserId(UUID id, UUID userId);
}
