package com.clapgrow.bridge.api.service;

import com.clapgrow.bridge.api.entity.Tenant;
import com.clapgrow.bridge.api.repository.TenantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Read-only access to tenants.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TenantService {

    private final TenantRepository tenantRepository;

    /**
     * @throws UnauthorizedException "missing token" when blank, "invalid token" when unknown
     */
    public Tenant resolveByToken(String token) {
        if (token == null || token.isBlank()) {
            throw new UnauthorizedException("missing token");
        }
        return tenantRepository.findByToken(token.trim())
            .orElseThrow(() -> {
                log.warn("Rejected request with unknown tenant token");
                return new UnauthorizedException("invalid token");
            });
    }

    public Optional<Tenant> findById(String tenantId) {
        return tenantRepository.findById(tenantId);
    }
}
