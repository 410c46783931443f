package com.clapgrow.bridge.api.service;

import com.clapgrow.bridge.api.chatwoot.ChatwootClient;
import com.clapgrow.bridge.api.entity.BridgeConfig;
import com.clapgrow.bridge.api.entity.ConversationMapping;
import com.clapgrow.bridge.api.repository.ConversationMappingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConversationCacheTest {

    private static final String TENANT = "tenant-1";
    private static final String CHAT = "5511999999999@s.whatsapp.net";
    private static final String SOURCE_ID = "wa:" + CHAT;

    @Mock
    private ConversationMappingRepository conversationMappingRepository;

    @Mock
    private ChatwootClient chatwootClient;

    private ConversationCache conversationCache;
    private BridgeConfig config;

    /** Stands in for the table: what save() stored, find() returns. */
    private final AtomicReference<ConversationMapping> stored = new AtomicReference<>();

    @BeforeEach
    void setUp() {
        conversationCache = new ConversationCache(conversationMappingRepository);
        config = new BridgeConfig();
        config.setTenantId(TENANT);
        config.setInboxId(7L);
    }

    private void givenRepositoryBackedByMemory() {
        when(conversationMappingRepository.findByTenantIdAndChatJid(TENANT, CHAT))
            .thenAnswer(invocation -> Optional.ofNullable(stored.get()));
        when(conversationMappingRepository.save(any(ConversationMapping.class)))
            .thenAnswer(invocation -> {
                ConversationMapping mapping = invocation.getArgument(0);
                stored.set(mapping);
                return mapping;
            });
    }

    @Test
    void testEnsureConversation_CalledRepeatedly_CreatesRemoteConversationOnce() {
        givenRepositoryBackedByMemory();
        when(chatwootClient.createConversation(11L, 7L, SOURCE_ID, false)).thenReturn(99L);

        for (int i = 0; i < 5; i++) {
            assertEquals(99L, conversationCache.ensureConversation(TENANT, chatwootClient, config, 11L, CHAT));
        }

        verify(chatwootClient, times(1)).createConversation(11L, 7L, SOURCE_ID, false);
        verify(conversationMappingRepository, times(1)).findByTenantIdAndChatJid(TENANT, CHAT);

        ArgumentCaptor<ConversationMapping> captor = ArgumentCaptor.forClass(ConversationMapping.class);
        verify(conversationMappingRepository).save(captor.capture());
        assertEquals(TENANT, captor.getValue().getTenantId());
        assertEquals(CHAT, captor.getValue().getChatJid());
        assertEquals(99L, captor.getValue().getConversationId());
        assertEquals(11L, captor.getValue().getContactId());
        assertEquals(7L, captor.getValue().getInboxId());
    }

    @Test
    void testEnsureConversation_AfterRestart_HitsPersistentTier() {
        givenRepositoryBackedByMemory();
        when(chatwootClient.createConversation(11L, 7L, SOURCE_ID, false)).thenReturn(99L);
        conversationCache.ensureConversation(TENANT, chatwootClient, config, 11L, CHAT);

        ConversationCache restarted = new ConversationCache(conversationMappingRepository);
        long first = restarted.ensureConversation(TENANT, chatwootClient, config, 11L, CHAT);
        long second = restarted.ensureConversation(TENANT, chatwootClient, config, 11L, CHAT);

        assertEquals(99L, first);
        assertEquals(99L, second);
        verify(chatwootClient, times(1)).createConversation(anyLong(), anyLong(), anyString(), anyBoolean());
        // one lookup per process: original miss, then the restarted cache's first call
        verify(conversationMappingRepository, times(2)).findByTenantIdAndChatJid(TENANT, CHAT);
    }

    @Test
    void testEnsureConversation_WhenPendingFlagSet_CreatesPendingConversation() {
        config.setConversationPending(true);
        when(conversationMappingRepository.findByTenantIdAndChatJid(TENANT, CHAT)).thenReturn(Optional.empty());
        when(chatwootClient.createConversation(11L, 7L, SOURCE_ID, true)).thenReturn(42L);

        assertEquals(42L, conversationCache.ensureConversation(TENANT, chatwootClient, config, 11L, CHAT));
    }

    @Test
    void testEnsureConversation_WhenPersistFails_StillReturnsAndCachesInMemory() {
        when(conversationMappingRepository.findByTenantIdAndChatJid(TENANT, CHAT)).thenReturn(Optional.empty());
        when(conversationMappingRepository.save(any(ConversationMapping.class)))
            .thenThrow(new DataIntegrityViolationException("duplicate key"));
        when(chatwootClient.createConversation(11L, 7L, SOURCE_ID, false)).thenReturn(99L);

        assertEquals(99L, conversationCache.ensureConversation(TENANT, chatwootClient, config, 11L, CHAT));
        assertEquals(99L, conversationCache.ensureConversation(TENANT, chatwootClient, config, 11L, CHAT));

        verify(chatwootClient, times(1)).createConversation(11L, 7L, SOURCE_ID, false);
        // second call served from memory
        verify(conversationMappingRepository, times(1)).findByTenantIdAndChatJid(TENANT, CHAT);
    }

    @Test
    void testEnsureConversation_ConcurrentFirstContact_SingleRemoteCreate() throws Exception {
        givenRepositoryBackedByMemory();
        when(chatwootClient.createConversation(11L, 7L, SOURCE_ID, false)).thenAnswer(invocation -> {
            Thread.sleep(50);
            return 99L;
        });

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Long>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return conversationCache.ensureConversation(TENANT, chatwootClient, config, 11L, CHAT);
                }));
            }
            start.countDown();
            for (Future<Long> result : results) {
                assertEquals(99L, result.get(5, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }

        verify(chatwootClient, times(1)).createConversation(11L, 7L, SOURCE_ID, false);
    }

    @Test
    void testStoreFromWebhook_ThenEnsure_NoRemoteCall() {
        givenRepositoryBackedByMemory();

        conversationCache.storeFromWebhook(TENANT, CHAT, 55L, 12L, 7L);
        long conversationId = conversationCache.ensureConversation(TENANT, chatwootClient, config, 12L, CHAT);

        assertEquals(55L, conversationId);
        verifyNoInteractions(chatwootClient);
        assertEquals(55L, stored.get().getConversationId());
    }

    @Test
    void testStoreFromWebhook_WhenMappingExists_UpdatesIt() {
        ConversationMapping existing = new ConversationMapping();
        existing.setTenantId(TENANT);
        existing.setChatJid(CHAT);
        existing.setConversationId(10L);
        stored.set(existing);
        givenRepositoryBackedByMemory();

        conversationCache.storeFromWebhook(TENANT, CHAT, 55L, 12L, 7L);

        assertSame(existing, stored.get());
        assertEquals(55L, existing.getConversationId());
        assertEquals(12L, existing.getContactId());
    }

    private void givenResetClearsRepository() {
        when(conversationMappingRepository.deleteByTenantId(TENANT)).thenAnswer(invocation -> {
            long removed = stored.get() != null ? 1L : 0L;
            stored.set(null);
            return removed;
        });
    }

    @Test
    void testEvictTenant_PreviouslyMappedChat_CreatesConversationInNewAccount() {
        givenRepositoryBackedByMemory();
        givenResetClearsRepository();
        when(chatwootClient.createConversation(11L, 7L, SOURCE_ID, false)).thenReturn(99L);
        conversationCache.ensureConversation(TENANT, chatwootClient, config, 11L, CHAT);

        conversationCache.evictTenant(TENANT);

        ChatwootClient newAccountClient = mock(ChatwootClient.class);
        when(newAccountClient.createConversation(21L, 8L, SOURCE_ID, false)).thenReturn(123L);
        config.setInboxId(8L);

        assertEquals(123L, conversationCache.ensureConversation(TENANT, newAccountClient, config, 21L, CHAT));
        verify(conversationMappingRepository).deleteByTenantId(TENANT);
        verify(chatwootClient, times(1)).createConversation(anyLong(), anyLong(), anyString(), anyBoolean());
        assertEquals(123L, stored.get().getConversationId());
        assertEquals(8L, stored.get().getInboxId());
    }

    @Test
    void testEvictTenant_DuringRemoteCreate_ResultIsNotCached() {
        givenRepositoryBackedByMemory();
        givenResetClearsRepository();
        when(chatwootClient.createConversation(11L, 7L, SOURCE_ID, false))
            .thenAnswer(invocation -> {
                conversationCache.evictTenant(TENANT);
                return 99L;
            })
            .thenReturn(123L);

        assertEquals(99L, conversationCache.ensureConversation(TENANT, chatwootClient, config, 11L, CHAT));
        assertEquals(123L, conversationCache.ensureConversation(TENANT, chatwootClient, config, 11L, CHAT));
        assertEquals(123L, conversationCache.ensureConversation(TENANT, chatwootClient, config, 11L, CHAT));

        ArgumentCaptor<ConversationMapping> captor = ArgumentCaptor.forClass(ConversationMapping.class);
        verify(conversationMappingRepository, times(1)).save(captor.capture());
        assertEquals(123L, captor.getValue().getConversationId());
        verify(chatwootClient, times(2)).createConversation(11L, 7L, SOURCE_ID, false);
    }

    @Test
    void testEvictTenant_WhileCreateInFlight_NextCallerWaitsForSameKeyLock() throws Exception {
        givenRepositoryBackedByMemory();
        givenResetClearsRepository();
        CountDownLatch creating = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(chatwootClient.createConversation(11L, 7L, SOURCE_ID, false))
            .thenAnswer(invocation -> {
                creating.countDown();
                release.await(5, TimeUnit.SECONDS);
                return 99L;
            })
            .thenReturn(123L);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<Long> first = pool.submit(
                () -> conversationCache.ensureConversation(TENANT, chatwootClient, config, 11L, CHAT));
            assertTrue(creating.await(5, TimeUnit.SECONDS));

            conversationCache.evictTenant(TENANT);
            Future<Long> second = pool.submit(
                () -> conversationCache.ensureConversation(TENANT, chatwootClient, config, 11L, CHAT));

            verify(chatwootClient, after(200).times(1)).createConversation(11L, 7L, SOURCE_ID, false);
            assertFalse(second.isDone());

            release.countDown();
            assertEquals(99L, first.get(5, TimeUnit.SECONDS));
            assertEquals(123L, second.get(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        verify(chatwootClient, times(2)).createConversation(11L, 7L, SOURCE_ID, false);
        assertEquals(123L, stored.get().getConversationId());
    }
}
