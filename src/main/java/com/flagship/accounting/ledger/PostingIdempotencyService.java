package com.flagship.accounting.ledger;

import com.flagship.accounting.config.AccountingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps an {@code Idempotency-Key} to the journal entry it created.
 *
 * Redis answers repeated keys without touching the database. The unique
 * {@code journal_entries.idempotency_key} column stays authoritative: a Redis miss
 * or outage falls back to it, and a race between two first calls is settled by that
 * constraint.
 */
@Service
@Slf4j
public class PostingIdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:journal:";

    private final JournalEntryRepository journalEntryRepository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;
    private final Duration ttl;

    public PostingIdempotencyService(JournalEntryRepository journalEntryRepository,
                                     Optional<RedisTemplate<String, String>> redisTemplate,
                                     AccountingProperties properties) {
        this.journalEntryRepository = journalEntryRepository;
        this.redisTemplate = redisTemplate;
        this.ttl = properties.getIdempotency().getTtl();
    }

    /**
     * Journal entry id previously created under this key, if any.
     */
    public Optional<UUID> findEntryId(String idempotencyKey) {
        requireKey(idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String entryId = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (entryId != null) {
                    log.debug("Idempotency key {} found in Redis", idempotencyKey);
                    return Optional.of(UUID.fromString(entryId));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key {}, using database: {}",
                    idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> entryId = journalEntryRepository.findByIdempotencyKey(idempotencyKey)
            .map(JournalEntryEntity::getId);
        entryId.ifPresent(id -> cache(idempotencyKey, id));
        return entryId;
    }

    /**
     * Caches the mapping after the posting commits. The database row already holds the key.
     */
    public void remember(String idempotencyKey, UUID entryId) {
        requireKey(idempotencyKey);
        if (entryId == null) {
            throw new IllegalArgumentException("Journal entry id cannot be null");
        }
        cache(idempotencyKey, entryId);
    }

    private void cache(String idempotencyKey, UUID entryId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, entryId.toString(), ttl);
        } catch (Exception e) {
            log.debug("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
