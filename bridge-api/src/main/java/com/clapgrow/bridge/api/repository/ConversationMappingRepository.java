package com.clapgrow.bridge.api.repository;

import com.clapgrow.bridge.api.entity.ConversationMapping;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ConversationMappingRepository extends JpaRepository<ConversationMapping, UUID> {
    Optional<ConversationMapping> findByTenantIdAndChatJid(String tenantId, String chatJid);

    @Transactional
    long deleteByTenantId(String tenantId);
}
