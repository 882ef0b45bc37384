package com.ai.studyengine.service;

import com.ai.studyengine.dto.BatchProgressRequest;
import com.ai.studyengine.dto.TopicProgressRequest;
import com.ai.studyengine.dto.TopicProgressResponse;
import com.ai.studyengine.model.StudySession;
import com.ai.studyengine.model.Topic;
import com.ai.studyengine.repository.TopicRepository;
import com.ai.studyengine.service.workflow.SessionProgressCalculator;
import com.ai.studyengine.service.workflow.TopicWorkflowService;
import com.ai.studyengine.service.workflow.WorkflowOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies learner progress reported by the client. A finished quiz goes
 * through the workflow like a graded submission; everything else is
 * stored as is.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TopicProgressService {

    private final StudySessionService studySessionService;
    private final TopicWorkflowService topicWorkflowService;
    private final TopicRepository topicRepository;

    @Transactional
    public TopicProgressResponse updateProgress(String topicId, TopicProgressRequest request, String userId) {
        Topic topic = studySessionService.requireOwnedTopicForUpdate(topicId, userId);
        TopicProgressResponse response = apply(topic, request);
        refreshSessionProgress(topic.getSession());
        response.setSessionProgress(topic.getSession().getProgress());
        return response;
    }

    /**
     * Applies several updates of one session in a single transaction.
     *
     * @throws ResponseStatusException 400 if an update lacks its topic id or
     *                                 the topics span more than one session
     */
    @Transactional
    public List<TopicProgressResponse> updateProgressBatch(String sessionId, BatchProgressRequest request,
                                                           String userId) {
        StudySession session = studySessionService.requireOwnedSessionForUpdate(sessionId, userId);
        List<TopicProgressResponse> responses = new ArrayList<>();
        for (TopicProgressRequest update : request.getUpdates()) {
            if (update.getTopicId() == null || update.getTopicId().isBlank()) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Every update needs a topicId");
            }
            Topic topic = studySessionService.requireOwnedTopicForUpdate(update.getTopicId(), userId);
            if (!topic.getSession().getId().equals(sessionId)) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                        "Topic " + update.getTopicId() + " does not belong to session " + sessionId);
            }
            responses.add(apply(topic, update));
        }
        refreshSessionProgress(session);
        responses.forEach(r -> r.setSessionProgress(session.getProgress()));
        log.info("Applied {} progress update(s) to session {}", responses.size(), sessionId);
        return responses;
    }

    private TopicProgressResponse apply(Topic topic, TopicProgressRequest request) {
        if (request.getCurrentQuestionIndex() != null)
            topic.setCurrentQuestionIndex(request.getCurrentQuestionIndex());

        List<String> unlocked = new ArrayList<>();
        Integer score = request.getScore() != null ? request.getScore() : topic.getScore();
        if (Boolean.TRUE.equals(request.getCompleted()) && score != null) {
            WorkflowOutcome outcome = topicWorkflowService.recordQuizResult(topic, score);
            unlocked.addAll(outcome.getUnlockedTopicIds());
        } else if (request.getScore() != null) {
            topic.setScore(request.getScore());
        }

        return TopicProgressResponse.builder()
                .topicId(topic.getId())
                .score(topic.getScore())
                .currentQuestionIndex(topic.getCurrentQuestionIndex())
                .completed(topic.isCompleted())
                .workflowStage(topic.getWorkflowStage() != null ? topic.getWorkflowStage().wireName() : null)
                .unlockedTopicIds(unlocked)
                .build();
    }

    private void refreshSessionProgress(StudySession session) {
        session.setProgress(SessionProgressCalculator.progressOf(topicRepository.findLeaves(session.getId())));
    }
}
