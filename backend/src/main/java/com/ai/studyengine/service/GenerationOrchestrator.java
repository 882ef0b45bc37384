package com.ai.studyengine.service;

import com.ai.studyengine.dto.ContentAnalysisResponse;
import com.ai.studyengine.dto.CreateSessionRequest;
import com.ai.studyengine.dto.GenerateMoreResponse;
import com.ai.studyengine.dto.StudySessionResponse;
import com.ai.studyengine.exception.GenerationException;
import com.ai.studyengine.model.StudySession;
import com.ai.studyengine.model.Topic;
import com.ai.studyengine.repository.StudySessionRepository;
import com.ai.studyengine.repository.TopicRepository;
import com.ai.studyengine.service.cache.ContentFingerprint;
import com.ai.studyengine.service.cache.GenerationCache;
import com.ai.studyengine.service.generation.ContentBatch;
import com.ai.studyengine.service.generation.ContentBatchSchema;
import com.ai.studyengine.service.generation.GenerationPhase;
import com.ai.studyengine.service.generation.GenerationPrompt;
import com.ai.studyengine.service.generation.GenerationPrompts;
import com.ai.studyengine.service.generation.GenerationProviderAdapter;
import com.ai.studyengine.service.hierarchy.TopicHierarchyBuilder;
import com.ai.studyengine.service.hierarchy.TopicTree;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Creates study sessions and fills their leaf topics with generated
 * questions and flashcards, a few leaves at a time.
 *
 * <pre>
 *  create ──► cache lookup ──HIT──► rebuild tree with fresh ids (no generation)
 *                 │
 *                MISS
 *                 ▼
 *   analyze ─► build hierarchy ─► persist ─► fill first k leaves ─► cache snapshot
 *
 *  generate-more ──► [session lock + row lock]
 *                       select next b leaves without content (traversal order)
 *                       generate ─► attach content ─► commit
 * </pre>
 *
 * Nothing is kept in memory between calls: the leaves still lacking
 * questions are the source of truth for what remains to be generated.
 */
@Slf4j
@Service
public class GenerationOrchestrator {

    private static final String DEFAULT_TITLE = "Study Session";

    private final StudySessionRepository studySessionRepository;
    private final TopicRepository topicRepository;
    private final StudySessionService studySessionService;
    private final StudySessionAssembler studySessionAssembler;
    private final ContentAnalysisService contentAnalysisService;
    private final TopicHierarchyBuilder topicHierarchyBuilder;
    private final GenerationProviderAdapter generationProviderAdapter;
    private final GenerationPrompts generationPrompts;
    private final GenerationCache generationCache;
    private final SessionLockRegistry sessionLockRegistry;
    private final TransactionTemplate transactionTemplate;

    @Value("${study.generation.initial-batch-size:3}")
    private int initialBatchSize;

    @Value("${study.generation.batch-size:2}")
    private int batchSize;

    @Value("${study.cache.ttl-hours:24}")
    private long cacheTtlHours;

    public GenerationOrchestrator(StudySessionRepository studySessionRepository,
                                  TopicRepository topicRepository,
                                  StudySessionService studySessionService,
                                  StudySessionAssembler studySessionAssembler,
                                  ContentAnalysisService contentAnalysisService,
                                  TopicHierarchyBuilder topicHierarchyBuilder,
                                  GenerationProviderAdapter generationProviderAdapter,
                                  GenerationPrompts generationPrompts,
                                  GenerationCache generationCache,
                                  SessionLockRegistry sessionLockRegistry,
                                  TransactionTemplate transactionTemplate) {
        this.studySessionRepository = studySessionRepository;
        this.topicRepository = topicRepository;
        this.studySessionService = studySessionService;
        this.studySessionAssembler = studySessionAssembler;
        this.contentAnalysisService = contentAnalysisService;
        this.topicHierarchyBuilder = topicHierarchyBuilder;
        this.generationProviderAdapter = generationProviderAdapter;
        this.generationPrompts = generationPrompts;
        this.generationCache = generationCache;
        this.sessionLockRegistry = sessionLockRegistry;
        this.transactionTemplate = transactionTemplate;
    }

    // ── Create ───────────────────────────────────────────────────────────────

    /**
     * Creates a session from study text. A failure while filling the first
     * leaves is logged and leaves them empty; the session is still returned
     * and "generate more" picks them up.
     *
     * @throws GenerationException when the topic hierarchy itself could not be generated
     */
    public StudySessionResponse createSession(CreateSessionRequest request, String userId) {
        long startTime = System.currentTimeMillis();
        String content = request.getContent();
        String cacheKey = ContentFingerprint.cacheKey(content, request.getTopicCount(), request.getQuestionsPerTopic());

        Optional<TopicTree> cached = generationCache.lookup(cacheKey);
        if (cached.isPresent()) {
            log.info("Cache HIT for {}: rebuilding session without generation", cacheKey);
            String sessionId = persistNewSession(request, userId, cacheKey, cached.get(), true);
            if (!request.isProgressiveLoad()) {
                long remaining = topicRepository.countLeavesWithoutContent(sessionId);
                if (remaining > 0) {
                    log.info("Cached tree of session {} has {} unfilled topic(s); filling them", sessionId, remaining);
                    fillRemaining(sessionId, response(sessionId, 0, (int) remaining, 0, 0));
                }
            }
            return studySessionService.getSession(sessionId, userId);
        }
        log.info("Cache MISS for {}: generating topics={}, questionsPerTopic={}, progressiveLoad={}",
                cacheKey, request.getTopicCount(), request.getQuestionsPerTopic(), request.isProgressiveLoad());

        ContentAnalysisResponse analysis = contentAnalysisService.analyze(content);
        TopicTree tree = topicHierarchyBuilder.build(content, analysis, request.getTopicCount(), titleOf(request, null));
        String sessionId = persistNewSession(request, userId, cacheKey, tree, false);

        boolean cacheable = fillAtCreation(sessionId, request.isProgressiveLoad());
        if (cacheable) {
            TopicTree snapshot = transactionTemplate.execute(status -> studySessionAssembler.snapshot(
                    studySessionRepository.findById(sessionId).orElseThrow()));
            generationCache.store(cacheKey, snapshot, cacheTtl());
        }

        log.info("Study session {} created in {}ms", sessionId, System.currentTimeMillis() - startTime);
        return studySessionService.getSession(sessionId, userId);
    }

    /**
     * Fills the first leaves, and every remaining leaf when progressive loading
     * is off.
     *
     * @return true when the session should be cached now; false when the initial
     *         fill failed or a fully filled session was already cached
     */
    private boolean fillAtCreation(String sessionId, boolean progressiveLoad) {
        GenerateMoreResponse result;
        try {
            result = generateNextBatch(sessionId, initialBatchSize, GenerationPhase.INITIAL);
        } catch (GenerationException e) {
            log.error("Initial content generation failed for session {} after {} attempt(s): {}",
                    sessionId, e.getAttempts(), e.getMessage());
            return false;
        }

        if (!progressiveLoad) {
            result = fillRemaining(sessionId, result);
        }
        return result.isHasMore();
    }

    /**
     * Generates incremental batches until no leaf is left or a batch fails.
     * A failed batch is logged; its leaves stay pending.
     */
    private GenerateMoreResponse fillRemaining(String sessionId, GenerateMoreResponse result) {
        while (result.isHasMore()) {
            try {
                result = generateNextBatch(sessionId, batchSize, GenerationPhase.INCREMENTAL);
            } catch (GenerationException e) {
                log.error("Content generation stopped for session {} with {} topic(s) remaining: {}",
                        sessionId, result.getRemaining(), e.getMessage());
                break;
            }
        }
        return result;
    }

    private String persistNewSession(CreateSessionRequest request, String userId, String cacheKey,
                                     TopicTree tree, boolean fromCache) {
        return transactionTemplate.execute(status -> {
            StudySession session = StudySession.builder()
                    .id(UUID.randomUUID().toString())
                    .userId(userId)
                    .title(titleOf(request, tree))
                    .sourceText(request.getContent())
                    .contentHash(cacheKey)
                    .topicCount(request.getTopicCount())
                    .questionsPerTopic(request.getQuestionsPerTopic())
                    .progressiveLoad(request.isProgressiveLoad())
                    .fromCache(fromCache)
                    .build();
            studySessionAssembler.assemble(session, tree);
            studySessionRepository.save(session);
            log.info("Persisted study session {} ('{}') with {} topic(s), {} leaves, fromCache={}",
                    session.getId(), session.getTitle(), session.getTopics().size(),
                    session.leafTopics().size(), fromCache);
            return session.getId();
        });
    }

    // ── Generate more ────────────────────────────────────────────────────────

    /**
     * Fills the next batch of leaves of one of the caller's sessions.
     * Safe to call repeatedly: once nothing remains it returns
     * {@code generated=0, hasMore=false} without calling any backend.
     *
     * @throws GenerationException when the batch failed; no leaf of it was written
     */
    public GenerateMoreResponse generateMore(String sessionId, String userId) {
        studySessionService.requireOwnedSession(sessionId, userId);
        return generateNextBatch(sessionId, batchSize, GenerationPhase.INCREMENTAL);
    }

    /** Next incremental batch, without an ownership check. */
    public GenerateMoreResponse generateNextBatch(String sessionId) {
        return generateNextBatch(sessionId, batchSize, GenerationPhase.INCREMENTAL);
    }

    /**
     * Selects, generates and persists one batch while holding the session's
     * lock and row lock, so concurrent callers never select the same leaf.
     */
    GenerateMoreResponse generateNextBatch(String sessionId, int size, GenerationPhase phase) {
        return sessionLockRegistry.withLock(sessionId, () -> {
            BatchResult result = transactionTemplate.execute(status -> fillBatch(sessionId, size, phase));
            if (result.getCompletedTree() != null) {
                generationCache.store(result.getCacheKey(), result.getCompletedTree(), cacheTtl());
            }
            return result.getResponse();
        });
    }

    private BatchResult fillBatch(String sessionId, int size, GenerationPhase phase) {
        StudySession session = studySessionRepository.findByIdForUpdate(sessionId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Study session not found: " + sessionId));

        List<Topic> pending = topicRepository.findLeavesWithoutContent(sessionId);
        if (pending.isEmpty()) {
            log.debug("Session {} has no topics left to generate", sessionId);
            return new BatchResult(response(sessionId, 0, 0, 0, 0), null, null);
        }

        List<Topic> batch = pending.subList(0, Math.min(size, pending.size()));
        Map<String, Topic> leavesByKey = new LinkedHashMap<>();
        for (int i = 0; i < batch.size(); i++) {
            leavesByKey.put(String.valueOf(i), batch.get(i));
        }

        log.info("Generating content for {} of {} pending topic(s) of session {} (phase={})",
                batch.size(), pending.size(), sessionId, phase);
        ContentBatch content = generationProviderAdapter.generate(GenerationPrompt.builder()
                        .text(generationPrompts.contentBatchPrompt(session.getSourceText(), leavesByKey,
                                session.getQuestionsPerTopic()))
                        .batchSize(batch.size())
                        .build(),
                phase, new ContentBatchSchema(new ArrayList<>(leavesByKey.keySet())));

        leavesByKey.forEach((key, leaf) -> studySessionAssembler.applyContent(leaf, content.get(key)));
        int remaining = pending.size() - batch.size();
        log.info("Session {}: filled {} topic(s) with {} question(s) and {} flashcard(s), {} remaining",
                sessionId, batch.size(), content.questionCount(), content.flashcardCount(), remaining);

        TopicTree completedTree = null;
        if (remaining == 0) {
            log.info("Session {} is fully generated", sessionId);
            completedTree = studySessionAssembler.snapshot(session);
        }
        return new BatchResult(
                response(sessionId, batch.size(), remaining, content.questionCount(), content.flashcardCount()),
                completedTree, session.getContentHash());
    }

    private GenerateMoreResponse response(String sessionId, int generated, int remaining,
                                          int questions, int flashcards) {
        return GenerateMoreResponse.builder()
                .sessionId(sessionId)
                .generated(generated)
                .remaining(remaining)
                .totalQuestions(questions)
                .totalFlashcards(flashcards)
                .hasMore(remaining > 0)
                .build();
    }

    private String titleOf(CreateSessionRequest request, TopicTree tree) {
        if (request.getTitle() != null && !request.getTitle().isBlank())
            return request.getTitle().strip();
        if (tree != null && tree.getTitle() != null && !tree.getTitle().isBlank())
            return tree.getTitle().strip();
        return DEFAULT_TITLE;
    }

    private Duration cacheTtl() {
        return Duration.ofHours(cacheTtlHours);
    }

    /** Outcome of one batch, plus the tree to cache once the session is full. */
    @Getter
    @AllArgsConstructor
    private static class BatchResult {
        private final GenerateMoreResponse response;
        private final TopicTree completedTree;
        private final String cacheKey;
    }
}
