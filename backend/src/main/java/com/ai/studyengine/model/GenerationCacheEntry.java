package com.ai.studyengine.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Generated topic tree (topics, questions, flashcards) keyed by a hash of
 * the source content and the generation parameters.
 * Expired rows are purged on a schedule.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "generation_cache", indexes = {
        @Index(name = "idx_generation_cache_expires", columnList = "expires_at")
})
public class GenerationCacheEntry {

    /** e.g. {@code ai_session:3f2a...:14:30} */
    @Id
    @Column(name = "cache_key", length = 128, nullable = false, updatable = false)
    private String cacheKey;

    /** JSON of the cached topic tree. */
    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    public boolean isExpired(LocalDateTime now) {
        return !expiresAt.isAfter(now);
    }
}
