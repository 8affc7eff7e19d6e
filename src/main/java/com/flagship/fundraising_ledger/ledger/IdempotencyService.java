package com.flagship.fundraising_ledger.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Idempotency-Key lookups for entry creation.
 *
 * Redis is the fast path; the ledger tables, which store the key with the
 * entry, are the source of truth. Any Redis failure falls through to the
 * database. Keys are scoped by entry kind and club.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final LedgerRecordStore recordStore;
    private final Optional<StringRedisTemplate> redisTemplate;

    public IdempotencyService(LedgerRecordStore recordStore, Optional<StringRedisTemplate> redisTemplate) {
        this.recordStore = recordStore;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return id of the entry created earlier with this key, if any
     */
    public Optional<UUID> findEntryId(EntryKind kind, UUID clubId, String idempotencyKey) {
        requireKey(idempotencyKey);
        String redisKey = redisKey(kind, clubId, idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(redisKey);
                if (cached != null) {
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key {}, using database: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> stored = recordStore.findByIdempotencyKey(kind, clubId, idempotencyKey)
                .map(StoredEntry::getId);
        stored.ifPresent(id -> cache(redisKey, id));
        return stored;
    }

    /**
     * Caches the key after a successful create. The database copy was
     * written with the entry itself.
     */
    public void remember(EntryKind kind, UUID clubId, String idempotencyKey, UUID entryId) {
        requireKey(idempotencyKey);
        if (entryId == null) {
            throw new IllegalArgumentException("Entry id cannot be null");
        }
        cache(redisKey(kind, clubId, idempotencyKey), entryId);
    }

    private void cache(String redisKey, UUID entryId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(redisKey, entryId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.debug("Could not cache idempotency key {}: {}", redisKey, e.getMessage());
        }
    }

    private static String redisKey(EntryKind kind, UUID clubId, String idempotencyKey) {
        return REDIS_KEY_PREFIX + kind.name().toLowerCase() + ":" + clubId + ":" + idempotencyKey;
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
