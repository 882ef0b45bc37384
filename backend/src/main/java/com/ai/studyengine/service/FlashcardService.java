package com.ai.studyengine.service;

import com.ai.studyengine.dto.DueFlashcardsResponse;
import com.ai.studyengine.dto.FlashcardResponse;
import com.ai.studyengine.dto.FlashcardReviewResponse;
import com.ai.studyengine.dto.TopicFlashcardsResponse;
import com.ai.studyengine.dto.WorkflowCompletionResponse;
import com.ai.studyengine.model.Flashcard;
import com.ai.studyengine.model.Topic;
import com.ai.studyengine.model.WorkflowStage;
import com.ai.studyengine.repository.FlashcardRepository;
import com.ai.studyengine.service.workflow.SpacedRepetitionScheduler;
import com.ai.studyengine.service.workflow.TopicWorkflowService;
import com.ai.studyengine.service.workflow.WorkflowOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Flashcard reviews and read-side flashcard views.
 *
 * <p>Every review runs under the row lock of the card's topic, so the SM-2
 * update, the review-pass flag and a resulting topic completion commit
 * together.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FlashcardService {

    private final FlashcardRepository flashcardRepository;
    private final StudySessionService studySessionService;
    private final SpacedRepetitionScheduler spacedRepetitionScheduler;
    private final TopicWorkflowService topicWorkflowService;
    private final Clock clock;

    @Transactional
    public FlashcardReviewResponse review(String flashcardId, int quality, String userId) {
        String topicId = flashcardRepository.findTopicIdById(flashcardId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Flashcard not found: " + flashcardId));
        Topic topic = studySessionService.requireOwnedTopicForUpdate(topicId, userId);
        Flashcard card = flashcardRepository.findById(flashcardId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Flashcard not found: " + flashcardId));

        spacedRepetitionScheduler.review(card, quality);
        if (topic.getWorkflowStage() == WorkflowStage.FLASHCARD_REVIEW)
            card.setReviewedInCurrentPass(true);
        WorkflowOutcome outcome = topicWorkflowService.afterFlashcardReview(topic);

        log.info("Flashcard {} reviewed with quality {}: repetitions={}, interval={}d, ease={}",
                flashcardId, quality, card.getRepetitions(), card.getIntervalDays(), card.getEaseFactor());

        return FlashcardReviewResponse.builder()
                .flashcard(FlashcardResponse.from(card, LocalDateTime.now(clock)))
                .topicId(topic.getId())
                .workflowStage(outcome.getStage().wireName())
                .unlockedTopicIds(outcome.getUnlockedTopicIds())
                .sessionProgress(outcome.getSessionProgress())
                .build();
    }

    @Transactional(readOnly = true)
    public TopicFlashcardsResponse getTopicFlashcards(String topicId, String userId) {
        Topic topic = studySessionService.requireOwnedTopic(topicId, userId);
        LocalDateTime now = LocalDateTime.now(clock);
        List<FlashcardResponse> cards = topic.getFlashcards().stream()
                .map(f -> FlashcardResponse.from(f, now))
                .toList();
        return TopicFlashcardsResponse.builder()
                .topicId(topic.getId())
                .topicTitle(topic.getTitle())
                .workflowStage(topic.getWorkflowStage() != null ? topic.getWorkflowStage().wireName() : null)
                .flashcards(cards)
                .totalFlashcards(cards.size())
                .dueCount((int) cards.stream().filter(FlashcardResponse::isDue).count())
                .reviewedInCurrentPass((int) cards.stream().filter(FlashcardResponse::isReviewedInCurrentPass).count())
                .build();
    }

    @Transactional(readOnly = true)
    public DueFlashcardsResponse getDueFlashcards(String sessionId, String userId) {
        studySessionService.requireOwnedSession(sessionId, userId);
        LocalDateTime now = LocalDateTime.now(clock);
        List<FlashcardResponse> due = flashcardRepository.findDueInSession(sessionId, now).stream()
                .map(f -> FlashcardResponse.from(f, now))
                .toList();
        return DueFlashcardsResponse.builder()
                .sessionId(sessionId)
                .dueCount(due.size())
                .flashcards(due)
                .build();
    }

    /**
     * @throws com.ai.studyengine.exception.WorkflowTransitionException unless every card
     *                                                                  of the topic was reviewed in this pass
     */
    @Transactional
    public WorkflowCompletionResponse completeReview(String topicId, String userId) {
        Topic topic = studySessionService.requireOwnedTopicForUpdate(topicId, userId);
        WorkflowOutcome outcome = topicWorkflowService.completeFlashcardReview(topic);
        return WorkflowCompletionResponse.builder()
                .topicId(topic.getId())
                .workflowStage(outcome.getStage().wireName())
                .unlockedTopicIds(outcome.getUnlockedTopicIds())
                .sessionProgress(outcome.getSessionProgress())
                .build();
    }
}
