package com.ai.studyengine.service;

import com.ai.studyengine.dto.GenerateMoreResponse;
import com.ai.studyengine.dto.GenerationStreamMessage;
import com.ai.studyengine.exception.GenerationException;
import com.ai.studyengine.repository.TopicRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.concurrent.CompletableFuture;

/**
 * Generates every remaining leaf of a session on a background thread and
 * reports each batch over STOMP.
 *
 * <pre>
 *  POST /api/sessions/{id}/generate-remaining ──► 202 ACCEPTED
 *        │
 *        ▼ @Async (generationExecutor)
 *  GENERATION_STARTED ─► GENERATION_BATCH ... ─► GENERATION_COMPLETED
 *                              │
 *                              └─ failure ─► GENERATION_ERROR
 *  all pushed to /topic/sessions/{id}
 * </pre>
 *
 * Batches go through the same orchestrator path as "generate more", so a
 * background run and client calls never fill the same leaf twice.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BackgroundGenerationService {

    /** STOMP destination prefix for generation progress messages. */
    static final String TOPIC_PREFIX = "/topic/sessions/";

    private final GenerationOrchestrator generationOrchestrator;
    private final TopicRepository topicRepository;
    private final SimpMessagingTemplate messagingTemplate;

    @Async("generationExecutor")
    public CompletableFuture<Void> generateRemaining(String sessionId) {
        long startTime = System.currentTimeMillis();
        int remaining = (int) topicRepository.countLeavesWithoutContent(sessionId);
        log.info("Background generation starting for session {} with {} topic(s) remaining", sessionId, remaining);
        send(sessionId, GenerationStreamMessage.started(sessionId, remaining));

        try {
            GenerateMoreResponse result;
            do {
                result = generationOrchestrator.generateNextBatch(sessionId);
                remaining = result.getRemaining();
                if (result.getGenerated() > 0)
                    send(sessionId, GenerationStreamMessage.batch(result));
            } while (result.isHasMore());

            send(sessionId, GenerationStreamMessage.completed(sessionId));
            log.info("Background generation finished for session {} in {}ms",
                    sessionId, System.currentTimeMillis() - startTime);

        } catch (GenerationException e) {
            int left = (int) topicRepository.countLeavesWithoutContent(sessionId);
            log.error("Background generation failed for session {} with {} topic(s) remaining: {}",
                    sessionId, left, e.getMessage());
            send(sessionId, GenerationStreamMessage.error(sessionId, left,
                    "Generation failed: " + e.getMessage()));
        } catch (ResponseStatusException e) {
            log.warn("Background generation stopped for session {}: {}", sessionId, e.getReason());
            send(sessionId, GenerationStreamMessage.error(sessionId, 0, e.getReason()));
        } catch (RuntimeException e) {
            log.error("Background generation aborted for session {} with {} topic(s) remaining",
                    sessionId, remaining, e);
            send(sessionId, GenerationStreamMessage.error(sessionId, remaining,
                    "Generation aborted: " + e.getMessage()));
        }
        return CompletableFuture.completedFuture(null);
    }

    private void send(String sessionId, GenerationStreamMessage message) {
        messagingTemplate.convertAndSend(TOPIC_PREFIX + sessionId, message);
    }
}
