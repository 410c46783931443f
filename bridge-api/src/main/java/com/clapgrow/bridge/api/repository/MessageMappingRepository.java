package com.clapgrow.bridge.api.repository;

import com.clapgrow.bridge.api.entity.MessageMapping;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface MessageMappingRepository extends JpaRepository<MessageMapping, UUID> {
}
