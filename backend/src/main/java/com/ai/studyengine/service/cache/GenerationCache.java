package com.ai.studyengine.service.cache;

import com.ai.studyengine.service.hierarchy.TopicTree;

import java.time.Duration;
import java.util.Optional;

/**
 * Advisory store of generated topic trees. Implementations never throw:
 * an unavailable backing store behaves as a permanent miss.
 */
public interface GenerationCache {

    Optional<TopicTree> lookup(String key);

    /** Idempotent; the last writer wins. */
    void store(String key, TopicTree tree, Duration ttl);
}
