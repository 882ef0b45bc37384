package com.ai.studyengine.service.workflow;

import com.ai.studyengine.exception.WorkflowTransitionException;
import com.ai.studyengine.model.Flashcard;
import com.ai.studyengine.model.StudySession;
import com.ai.studyengine.model.Topic;
import com.ai.studyengine.model.WorkflowStage;
import com.ai.studyengine.repository.TopicRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Drives the per-leaf mastery workflow
 * {@code locked -> quiz_available -> flashcard_review -> completed}.
 *
 * <p>All methods join the caller's transaction: a completion and the
 * unlock cascade it triggers commit together or not at all.</p>
 */
@Slf4j
@Service
@Transactional(propagation = Propagation.MANDATORY)
public class TopicWorkflowService {

    private final TopicRepository topicRepository;
    private final int passThreshold;
    private final UnlockPolicy unlockPolicy;

    public TopicWorkflowService(TopicRepository topicRepository,
                                @Value("${study.workflow.pass-threshold:70}") int passThreshold,
                                @Value("${study.workflow.unlock-policy:SEQUENTIAL}") UnlockPolicy unlockPolicy) {
        this.topicRepository = topicRepository;
        this.passThreshold = passThreshold;
        this.unlockPolicy = unlockPolicy;
    }

    public int getPassThreshold() {
        return passThreshold;
    }

    public boolean isPassing(int percentage) {
        return percentage >= passThreshold;
    }

    /**
     * Records a finished quiz. A passing score on a topic awaiting its quiz
     * moves it to flashcard review; retakes in later stages only update the score.
     *
     * @throws WorkflowTransitionException if the topic is a category, still locked
     *                                     or has no generated questions yet
     */
    public WorkflowOutcome recordQuizResult(Topic topic, int percentage) {
        requireLeaf(topic);
        if (topic.getWorkflowStage() == WorkflowStage.LOCKED) {
            throw new WorkflowTransitionException("Topic '" + topic.getTitle() + "' is locked; "
                    + "complete its prerequisites first");
        }
        if (topic.getQuestions().isEmpty()) {
            throw new WorkflowTransitionException("Topic '" + topic.getTitle() + "' has no questions yet; "
                    + "generate its content first");
        }

        topic.setScore(percentage);
        List<String> unlocked = new ArrayList<>();
        if (topic.getWorkflowStage() == WorkflowStage.QUIZ_AVAILABLE && isPassing(percentage)) {
            unlocked.addAll(enterFlashcardReview(topic));
        } else if (topic.getWorkflowStage() == WorkflowStage.QUIZ_AVAILABLE) {
            log.info("Quiz score {}% below pass threshold {}% for topic {}; stays in quiz",
                    percentage, passThreshold, topic.getId());
        }
        return outcome(topic, unlocked);
    }

    /**
     * Re-checks a topic after one of its cards was reviewed and completes it
     * once every card was reviewed in the current pass.
     */
    public WorkflowOutcome afterFlashcardReview(Topic topic) {
        List<String> unlocked = new ArrayList<>();
        if (topic.getWorkflowStage() == WorkflowStage.FLASHCARD_REVIEW && allReviewedInPass(topic)) {
            unlocked.addAll(complete(topic));
        }
        return outcome(topic, unlocked);
    }

    /**
     * Explicit completion of a topic's flashcard review.
     *
     * @throws WorkflowTransitionException unless the topic is in flashcard review
     *                                     and every card was reviewed in this pass
     */
    public WorkflowOutcome completeFlashcardReview(Topic topic) {
        requireLeaf(topic);
        if (topic.getWorkflowStage() != WorkflowStage.FLASHCARD_REVIEW) {
            throw new WorkflowTransitionException("Topic '" + topic.getTitle() + "' is not in flashcard review (stage: "
                    + topic.getWorkflowStage().wireName() + ")");
        }
        long pending = topic.getFlashcards().stream().filter(f -> !f.isReviewedInCurrentPass()).count();
        if (pending > 0) {
            throw new WorkflowTransitionException(pending + " flashcard(s) of topic '" + topic.getTitle()
                    + "' have not been reviewed yet");
        }
        return outcome(topic, complete(topic));
    }

    /**
     * Unlock cascade: re-evaluates every locked leaf of the session after a
     * completion and returns the ids of the leaves it opened.
     */
    public List<String> cascadeUnlocks(StudySession session) {
        List<Topic> leaves = topicRepository.findLeaves(session.getId());
        Map<String, Topic> byId = leaves.stream().collect(Collectors.toMap(Topic::getId, Function.identity()));
        List<String> unlocked = new ArrayList<>();

        for (Topic leaf : leaves) {
            if (leaf.getWorkflowStage() == WorkflowStage.LOCKED
                    && !leaf.getPrerequisiteTopicIds().isEmpty()
                    && prerequisitesCompleted(leaf, byId)) {
                unlock(leaf, unlocked);
            }
        }

        for (Topic leaf : leaves) {
            if (leaf.getWorkflowStage() == WorkflowStage.LOCKED && leaf.getPrerequisiteTopicIds().isEmpty()) {
                unlock(leaf, unlocked);
                if (unlockPolicy == UnlockPolicy.SEQUENTIAL)
                    break;
            }
        }

        session.setProgress(SessionProgressCalculator.progressOf(leaves));
        return unlocked;
    }

    private List<String> enterFlashcardReview(Topic topic) {
        topic.advanceTo(WorkflowStage.FLASHCARD_REVIEW);
        topic.getFlashcards().forEach(f -> f.setReviewedInCurrentPass(false));
        log.info("Topic {} ('{}') moved to flashcard review with {} card(s)",
                topic.getId(), topic.getTitle(), topic.getFlashcards().size());

        if (topic.getFlashcards().isEmpty()) {
            return complete(topic);
        }
        return List.of();
    }

    private List<String> complete(Topic topic) {
        topic.advanceTo(WorkflowStage.COMPLETED);
        log.info("Topic {} ('{}') completed", topic.getId(), topic.getTitle());
        return cascadeUnlocks(topic.getSession());
    }

    private void unlock(Topic leaf, List<String> unlocked) {
        leaf.advanceTo(WorkflowStage.QUIZ_AVAILABLE);
        unlocked.add(leaf.getId());
        log.info("Unlocked topic {} ('{}')", leaf.getId(), leaf.getTitle());
    }

    private boolean prerequisitesCompleted(Topic leaf, Map<String, Topic> byId) {
        // ids of topics that no longer exist count as satisfied
        for (String id : leaf.getPrerequisiteTopicIds()) {
            Topic prerequisite = byId.get(id);
            if (prerequisite != null && prerequisite.getWorkflowStage() != WorkflowStage.COMPLETED)
                return false;
        }
        return true;
    }

    private boolean allReviewedInPass(Topic topic) {
        return topic.getFlashcards().stream().allMatch(Flashcard::isReviewedInCurrentPass);
    }

    private void requireLeaf(Topic topic) {
        if (topic.isCategory()) {
            throw new WorkflowTransitionException("Topic '" + topic.getTitle() + "' is a category and has no workflow");
        }
    }

    private WorkflowOutcome outcome(Topic topic, List<String> unlocked) {
        return WorkflowOutcome.builder()
                .stage(topic.getWorkflowStage())
                .unlockedTopicIds(unlocked)
                .sessionProgress(topic.getSession().getProgress())
                .build();
    }
}
