package com.clapgrow.bridge.api.repository;

import com.clapgrow.bridge.api.entity.BridgeConfig;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface BridgeConfigRepository extends JpaRepository<BridgeConfig, UUID> {
    Optional<BridgeConfig> findByTenantId(String tenantId);

    @Transactional
    long deleteByTenantId(String tenantId);
}
