package com.ai.studyengine.repository;

import com.ai.studyengine.model.GenerationCacheEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Repository for generation cache entries.
 */
@Repository
public interface GenerationCacheRepository extends JpaRepository<GenerationCacheEntry, String> {

    /** Purge expired entries to keep the table lean (called by scheduled task). */
    @Modifying
    @Transactional
    long deleteByExpiresAtBefore(LocalDateTime cutoff);
}
