package com.clapgrow.bridge.api.service;

import com.clapgrow.bridge.api.chatwoot.ChatwootClient;
import com.clapgrow.bridge.api.entity.BridgeConfig;
import com.clapgrow.bridge.api.entity.ConversationMapping;
import com.clapgrow.bridge.api.repository.ConversationMappingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Two-tier mapping of (tenant, chat JID) to the Chatwoot conversation.
 *
 * <p>Lookup order: memory, then {@code chatwoot_conversations}, then a remote create.
 * Entries live until the tenant is reset by {@link #evictTenant(String)}.
 *
 * <p>Check-then-create runs inside a per-key lock, so concurrent first messages for
 * the same chat produce exactly one remote conversation. Different chats proceed
 * in parallel. Key locks are never dropped, and a result is only cached when no
 * tenant reset happened while it was being resolved.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConversationCache {

    public static final String CONVERSATION_SOURCE_PREFIX = "wa:";

    private final ConversationMappingRepository conversationMappingRepository;

    private final ConcurrentHashMap<String, CachedConversation> memory = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Object> keyLocks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, TenantGeneration> generations = new ConcurrentHashMap<>();

    /**
     * Resolve the conversation for a chat, creating it in Chatwoot on a full miss.
     * A failure to persist a freshly created mapping is logged and does not fail the call.
     *
     * @return Chatwoot conversation id
     */
    public long ensureConversation(String tenantId, ChatwootClient client, BridgeConfig config,
                                   long contactId, String chatJid) {
        String key = cacheKey(tenantId, chatJid);

        CachedConversation cached = memory.get(key);
        if (cached != null) {
            log.debug("Conversation {} found in memory for {}", cached.conversationId(), key);
            return cached.conversationId();
        }

        TenantGeneration tenant = generationOf(tenantId);
        Object lock = keyLocks.computeIfAbsent(key, k -> new Object());
        synchronized (lock) {
            // Another thread may have created it while we waited
            cached = memory.get(key);
            if (cached != null) {
                return cached.conversationId();
            }
            long generation = tenant.current();

            Optional<ConversationMapping> persisted =
                conversationMappingRepository.findByTenantIdAndChatJid(tenantId, chatJid);
            if (persisted.isPresent()) {
                ConversationMapping mapping = persisted.get();
                synchronized (tenant) {
                    if (tenant.current() == generation) {
                        memory.put(key, CachedConversation.of(mapping));
                    }
                }
                log.debug("Conversation {} found in database for {}", mapping.getConversationId(), key);
                return mapping.getConversationId();
            }

            long inboxId = config.getInboxId() != null ? config.getInboxId() : 0L;
            String sourceId = CONVERSATION_SOURCE_PREFIX + chatJid;
            log.info("No conversation for {} - creating one in Chatwoot (contactId={}, inboxId={})",
                key, contactId, inboxId);

            long conversationId = client.createConversation(contactId, inboxId, sourceId,
                Boolean.TRUE.equals(config.getConversationPending()));

            synchronized (tenant) {
                if (tenant.current() != generation) {
                    log.warn("Tenant {} was reset while creating conversation {} for {} - not caching it",
                        tenantId, conversationId, key);
                    return conversationId;
                }
                try {
                    ConversationMapping mapping = new ConversationMapping();
                    mapping.setTenantId(tenantId);
                    mapping.setChatJid(chatJid);
                    mapping.setConversationId(conversationId);
                    mapping.setContactId(contactId);
                    mapping.setInboxId(inboxId);
                    conversationMappingRepository.save(mapping);
                } catch (RuntimeException e) {
                    // Memory still serves this process; a restart before a later save may duplicate the conversation
                    log.error("Failed to persist conversation {} for {} - continuing with memory cache only",
                        conversationId, key, e);
                }
                memory.put(key, new CachedConversation(conversationId, contactId, inboxId));
            }
            return conversationId;
        }
    }

    /**
     * Upsert a mapping learned from a Chatwoot webhook into both tiers.
     *
     * @throws RuntimeException when the database write fails; the memory tier is updated regardless
     */
    public void storeFromWebhook(String tenantId, String chatJid, long conversationId, long contactId, long inboxId) {
        String key = cacheKey(tenantId, chatJid);
        TenantGeneration tenant = generationOf(tenantId);
        Object lock = keyLocks.computeIfAbsent(key, k -> new Object());
        synchronized (lock) {
            synchronized (tenant) {
                memory.put(key, new CachedConversation(conversationId, contactId, inboxId));

                ConversationMapping mapping = conversationMappingRepository
                    .findByTenantIdAndChatJid(tenantId, chatJid)
                    .orElseGet(() -> {
                        ConversationMapping created = new ConversationMapping();
                        created.setTenantId(tenantId);
                        created.setChatJid(chatJid);
                        return created;
                    });
                mapping.setConversationId(conversationId);
                mapping.setContactId(contactId);
                mapping.setInboxId(inboxId);
                conversationMappingRepository.save(mapping);
            }
            log.debug("Stored conversation {} for {} from webhook", conversationId, key);
        }
    }

    /**
     * Forget every conversation of a tenant, in memory and in {@code chatwoot_conversations}.
     * Used when the tenant's Chatwoot account changes or its configuration is removed.
     */
    public void evictTenant(String tenantId) {
        String prefix = tenantId + ":";
        TenantGeneration tenant = generationOf(tenantId);
        synchronized (tenant) {
            tenant.advance();
            memory.keySet().removeIf(key -> key.startsWith(prefix));
            long deleted = conversationMappingRepository.deleteByTenantId(tenantId);
            log.info("Evicted conversations for tenant {} ({} stored mappings removed)", tenantId, deleted);
        }
    }

    static String cacheKey(String tenantId, String chatJid) {
        return tenantId + ":" + chatJid;
    }

    private TenantGeneration generationOf(String tenantId) {
        return generations.computeIfAbsent(tenantId, id -> new TenantGeneration());
    }

    /** Bumped on every reset; guarded by its own monitor. */
    private static final class TenantGeneration {
        private long value;

        synchronized long current() {
            return value;
        }

        synchronized void advance() {
            value++;
        }
    }

    private record CachedConversation(long conversationId, long contactId, long inboxId) {

        static CachedConversation of(ConversationMapping mapping) {
            return new CachedConversation(
                mapping.getConversationId(),
                mapping.getContactId() != null ? mapping.getContactId() : 0L,
                mapping.getInboxId() != null ? mapping.getInboxId() : 0L);
        }
    }
}
