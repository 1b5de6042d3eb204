package com.finsync.repository;

import com.finsync.model.Security;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SecurityRepository extends JpaRepository<Security, UUID> {
  Optional<Security> findByProviderSecurityId(String providerSecurityId);
}
