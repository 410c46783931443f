package com.clapgrow.bridge.api.service;

import com.clapgrow.bridge.api.config.DedupProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Time-windowed set of WhatsApp message ids the bridge has already handled.
 *
 * <p>Written by the inbound path (test-and-set on every event) and by the webhook
 * path (ids of messages the bridge itself sent, so their echo is dropped).
 * An id older than the TTL counts as absent and is dropped by the next purge.
 */
@Component
@Slf4j
public class DedupGuard {

    private final ConcurrentHashMap<String, Instant> seen = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    public DedupGuard(Clock clock, DedupProperties properties) {
        this.clock = clock;
        this.ttl = properties.getTtl();
    }

    /**
     * Atomically record {@code messageId} unless a live entry exists.
     *
     * @return true when this call recorded the id (first sighting), false for a duplicate
     */
    public boolean markIfAbsent(String messageId) {
        Instant now = clock.instant();
        AtomicBoolean inserted = new AtomicBoolean(false);
        seen.compute(messageId, (id, firstSeen) -> {
            if (firstSeen == null || isExpired(firstSeen, now)) {
                inserted.set(true);
                return now;
            }
            return firstSeen;
        });
        return inserted.get();
    }

    /**
     * Record an id unconditionally, e.g. a message the bridge just sent.
     */
    public void register(String messageId) {
        if (messageId == null || messageId.isEmpty()) {
            return;
        }
        seen.put(messageId, clock.instant());
    }

    public boolean contains(String messageId) {
        Instant firstSeen = seen.get(messageId);
        return firstSeen != null && !isExpired(firstSeen, clock.instant());
    }

    /**
     * @return number of entries removed
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = seen.size();
        seen.entrySet().removeIf(entry -> isExpired(entry.getValue(), now));
        int removed = Math.max(0, before - seen.size());
        if (removed > 0) {
            log.debug("Dedup purge removed {} expired message ids, {} remaining", removed, seen.size());
        }
        return removed;
    }

    @Scheduled(fixedDelayString = "${bridge.dedup.purge-interval:PT10M}",
               initialDelayString = "${bridge.dedup.purge-interval:PT10M}")
    public void scheduledPurge() {
        purgeExpired();
    }

    private boolean isExpired(Instant firstSeen, Instant now) {
        return Duration.between(firstSeen, now).compareTo(ttl) > 0;
    }
}
