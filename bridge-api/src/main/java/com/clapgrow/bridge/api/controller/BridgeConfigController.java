package com.clapgrow.bridge.api.controller;

import com.clapgrow.bridge.api.dto.BridgeConfigRequest;
import com.clapgrow.bridge.api.dto.BridgeConfigResponse;
import com.clapgrow.bridge.api.dto.StatusResponse;
import com.clapgrow.bridge.api.entity.Tenant;
import com.clapgrow.bridge.api.service.BridgeConfigService;
import com.clapgrow.bridge.api.service.TenantService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

@RestController
@RequestMapping("/api/v1/chatwoot/config")
@RequiredArgsConstructor
@Tag(name = "Chatwoot configuration", description = "Per-tenant Chatwoot integration settings")
public class BridgeConfigController {

    static final String TOKEN_HEADER = "token";

    private final TenantService tenantService;
    private final BridgeConfigService bridgeConfigService;

    @GetMapping
    @Operation(summary = "Get the tenant's Chatwoot configuration (API token masked)")
    public ResponseEntity<BridgeConfigResponse> getConfig(
            @RequestHeader(value = TOKEN_HEADER, required = false) String token) {

        Tenant tenant = tenantService.resolveByToken(token);
        return ResponseEntity.ok(bridgeConfigService.getConfig(tenant, requestBaseUrl()));
    }

    @PutMapping
    @Operation(summary = "Create or replace the tenant's Chatwoot configuration")
    public ResponseEntity<StatusResponse> saveConfig(
            @RequestHeader(value = TOKEN_HEADER, required = false) String token,
            @Valid @RequestBody BridgeConfigRequest request) {

        Tenant tenant = tenantService.resolveByToken(token);
        return ResponseEntity.ok(bridgeConfigService.saveConfig(tenant, request, requestBaseUrl()));
    }

    @DeleteMapping
    @Operation(summary = "Delete the tenant's Chatwoot configuration")
    public ResponseEntity<StatusResponse> deleteConfig(
            @RequestHeader(value = TOKEN_HEADER, required = false) String token) {

        Tenant tenant = tenantService.resolveByToken(token);
        return ResponseEntity.ok(bridgeConfigService.deleteConfig(tenant));
    }

    private static String requestBaseUrl() {
        return ServletUriComponentsBuilder.fromCurrentContextPath().toUriString();
    }
}
