package com.ai.studyengine.service.cache;

import com.ai.studyengine.model.GenerationCacheEntry;
import com.ai.studyengine.repository.GenerationCacheRepository;
import com.ai.studyengine.service.hierarchy.TopicTree;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Generation cache backed by the {@code generation_cache} table.
 * Writes run in their own transaction so a failing cache write cannot roll
 * back the caller's work. Expired entries are purged every hour.
 */
@Slf4j
@Component
public class JpaGenerationCache implements GenerationCache {

    private final GenerationCacheRepository generationCacheRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final TransactionTemplate requiresNew;

    public JpaGenerationCache(GenerationCacheRepository generationCacheRepository,
                              ObjectMapper objectMapper,
                              Clock clock,
                              PlatformTransactionManager transactionManager) {
        this.generationCacheRepository = generationCacheRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public Optional<TopicTree> lookup(String key) {
        try {
            Optional<GenerationCacheEntry> entry = generationCacheRepository.findById(key);
            if (entry.isEmpty()) {
                return Optional.empty();
            }
            if (entry.get().isExpired(LocalDateTime.now(clock))) {
                log.debug("Cache entry expired for key={}", key);
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(entry.get().getPayload(), TopicTree.class));
        } catch (DataAccessException e) {
            log.warn("Generation cache unavailable on lookup (treated as miss): {}", e.getMessage());
            return Optional.empty();
        } catch (JsonProcessingException e) {
            log.warn("Unreadable generation cache entry for key={} (treated as miss): {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void store(String key, TopicTree tree, Duration ttl) {
        try {
            String payload = objectMapper.writeValueAsString(tree);
            LocalDateTime now = LocalDateTime.now(clock);
            requiresNew.executeWithoutResult(status -> generationCacheRepository.save(GenerationCacheEntry.builder()
                    .cacheKey(key)
                    .payload(payload)
                    .createdAt(now)
                    .expiresAt(now.plus(ttl))
                    .build()));
            log.info("Cached generated topic tree with key {} ({}h TTL)", key, ttl.toHours());
        } catch (DataAccessException | TransactionException e) {
            log.warn("Generation cache unavailable on store, continuing without cache: {}", e.getMessage());
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize topic tree for cache key={}: {}", key, e.getMessage());
        }
    }

    /** Purges expired cache entries every hour. */
    @Scheduled(fixedDelayString = "${study.cache.purge-interval-ms:3600000}")
    public void purgeExpired() {
        try {
            long removed = generationCacheRepository.deleteByExpiresAtBefore(LocalDateTime.now(clock));
            if (removed > 0)
                log.info("Purged {} expired generation cache entries", removed);
        } catch (DataAccessException e) {
            log.warn("Generation cache purge failed: {}", e.getMessage());
        }
    }
}
