package com.clapgrow.bridge.api.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

@Entity
@Table(name = "chatwoot_message_mappings", uniqueConstraints = {
    @UniqueConstraint(name = "uk_chatwoot_message_mapping", columnNames = {"tenant_id", "message_id"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class MessageMapping extends BaseAuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id")
    private UUID id;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    /** WhatsApp message id. */
    @Column(name = "message_id", nullable = false, length = 255)
    private String messageId;

    @Column(name = "chatwoot_message_id", nullable = false)
    private Long chatwootMessageId;

    @Column(name = "chatwoot_conversation_id", nullable = false)
    private Long chatwootConversationId;
}
