package com.clapgrow.bridge.api.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

/**
 * Durable tier of the conversation cache: which Chatwoot conversation a WhatsApp chat lives in.
 */
@Entity
@Table(name = "chatwoot_conversations", uniqueConstraints = {
    @UniqueConstraint(name = "uk_chatwoot_conversation_chat", columnNames = {"tenant_id", "chat_jid"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ConversationMapping extends BaseAuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id")
    private UUID id;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(name = "chat_jid", nullable = false, length = 255)
    private String chatJid;

    @Column(name = "conversation_id", nullable = false)
    private Long conversationId;

    @Column(name = "contact_id")
    private Long contactId;

    @Column(name = "inbox_id")
    private Long inboxId;
}
