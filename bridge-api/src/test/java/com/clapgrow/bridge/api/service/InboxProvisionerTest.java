package com.clapgrow.bridge.api.service;

import com.clapgrow.bridge.api.chatwoot.ChatwootApiException;
import com.clapgrow.bridge.api.chatwoot.ChatwootClient;
import com.clapgrow.bridge.api.chatwoot.ChatwootClientFactory;
import com.clapgrow.bridge.api.config.ChatwootProperties;
import com.clapgrow.bridge.api.entity.BridgeConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InboxProvisionerTest {

    private static final String WEBHOOK = "https://bridge.example.com/chatwoot/webhook/tok";

    @Mock
    private ChatwootClientFactory chatwootClientFactory;

    @Mock
    private ChatwootClient chatwootClient;

    private ChatwootProperties chatwootProperties;
    private InboxProvisioner inboxProvisioner;
    private BridgeConfig config;

    @BeforeEach
    void setUp() {
        chatwootProperties = new ChatwootProperties();
        inboxProvisioner = new InboxProvisioner(chatwootClientFactory, chatwootProperties);
        config = new BridgeConfig();
        config.setTenantId("tenant-1");
        config.setInboxName("Support");
        when(chatwootClientFactory.forConfig(config)).thenReturn(chatwootClient);
    }

    @Test
    void testProvision_CreatesInboxAndBotContact() {
        when(chatwootClient.createInbox("Support", WEBHOOK)).thenReturn(42L);
        when(chatwootClient.createContact(42L, "WhatsApp Bot", null, "123456",
            chatwootProperties.getBotAvatarUrl())).thenReturn(1L);

        assertEquals(42L, inboxProvisioner.provision(config, WEBHOOK));
    }

    @Test
    void testProvision_OrganizationAndLogoOverrideBotDefaults() {
        config.setOrganization("Acme");
        config.setLogo("https://acme.example.com/logo.png");
        when(chatwootClient.createInbox("Support", WEBHOOK)).thenReturn(42L);
        when(chatwootClient.createContact(42L, "Acme", null, "123456", "https://acme.example.com/logo.png"))
            .thenReturn(1L);

        inboxProvisioner.provision(config, WEBHOOK);

        verify(chatwootClient).createContact(42L, "Acme", null, "123456", "https://acme.example.com/logo.png");
    }

    @Test
    void testProvision_BotContactFails_StillReturnsInbox() {
        when(chatwootClient.createInbox("Support", WEBHOOK)).thenReturn(42L);
        when(chatwootClient.createContact(anyLong(), any(), any(), any(), any()))
            .thenThrow(new ChatwootApiException(422, "Identifier has already been taken"));

        assertEquals(42L, inboxProvisioner.provision(config, WEBHOOK));
    }

    @Test
    void testProvision_InboxFails_ThrowsBridgeException() {
        when(chatwootClient.createInbox("Support", WEBHOOK)).thenThrow(new ChatwootApiException(401, "Unauthorized"));

        BridgeException e = assertThrows(BridgeException.class, () -> inboxProvisioner.provision(config, WEBHOOK));

        assertTrue(e.getMessage().startsWith("Failed to create inbox: "));
        verify(chatwootClient, never()).createContact(anyLong(), any(), any(), any(), any());
    }
}
