package com.clapgrow.bridge.api.controller;

import com.clapgrow.bridge.api.dto.WebhookResponse;
import com.clapgrow.bridge.api.service.ChatwootWebhookService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Receives Chatwoot's {@code message_created} webhooks. The tenant token travels in
 * the path or, for older inbox setups, as a query parameter.
 */
@RestController
@RequestMapping("/chatwoot/webhook")
@RequiredArgsConstructor
@Tag(name = "Chatwoot webhook", description = "Agent replies from Chatwoot to WhatsApp")
public class ChatwootWebhookController {

    private final ChatwootWebhookService chatwootWebhookService;

    @PostMapping("/{token}")
    @Operation(summary = "Deliver an agent reply to WhatsApp")
    public ResponseEntity<WebhookResponse> handleWebhook(
            @PathVariable("token") String token,
            @RequestBody(required = false) String body) {

        return ResponseEntity.ok(chatwootWebhookService.handleOutgoingWebhook(token, body));
    }

    @PostMapping
    @Operation(summary = "Deliver an agent reply to WhatsApp (token as query parameter)")
    public ResponseEntity<WebhookResponse> handleWebhookWithQueryToken(
            @RequestParam(value = "token", required = false) String token,
            @RequestBody(required = false) String body) {

        return ResponseEntity.ok(chatwootWebhookService.handleOutgoingWebhook(token, body));
    }
}
