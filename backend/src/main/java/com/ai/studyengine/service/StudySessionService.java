package com.ai.studyengine.service;

import com.ai.studyengine.dto.SessionHistoryResponse;
import com.ai.studyengine.dto.SessionWorkflowResponse;
import com.ai.studyengine.dto.StudySessionResponse;
import com.ai.studyengine.dto.WorkflowNodeResponse;
import com.ai.studyengine.model.SessionStatus;
import com.ai.studyengine.model.StudySession;
import com.ai.studyengine.model.Topic;
import com.ai.studyengine.repository.QuizAttemptRepository;
import com.ai.studyengine.repository.StudySessionRepository;
import com.ai.studyengine.repository.TopicRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Read, list, archive and delete operations on study sessions, plus the
 * ownership checks shared by every session, topic and flashcard operation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StudySessionService {

    private final StudySessionRepository studySessionRepository;
    private final TopicRepository topicRepository;
    private final QuizAttemptRepository quizAttemptRepository;
    private final SessionLockRegistry sessionLockRegistry;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    @Transactional(readOnly = true)
    public StudySessionResponse getSession(String sessionId, String userId) {
        StudySession session = requireOwnedSession(sessionId, userId);
        return StudySessionResponse.from(session, LocalDateTime.now(clock));
    }

    @Transactional(readOnly = true)
    public List<SessionHistoryResponse> listSessions(String userId) {
        return studySessionRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(s -> SessionHistoryResponse.builder()
                        .id(s.getId())
                        .title(s.getTitle())
                        .status(s.getStatus().name().toLowerCase())
                        .progress(s.getProgress())
                        .totalTopics((int) topicRepository.countBySessionIdAndCategoryFalse(s.getId()))
                        .questionsRemaining((int) topicRepository.countLeavesWithoutContent(s.getId()))
                        .fromCache(s.isFromCache())
                        .createdAt(s.getCreatedAt())
                        .build())
                .toList();
    }

    @Transactional(readOnly = true)
    public SessionWorkflowResponse getWorkflow(String sessionId, String userId) {
        StudySession session = requireOwnedSession(sessionId, userId);
        return SessionWorkflowResponse.builder()
                .sessionId(session.getId())
                .title(session.getTitle())
                .progress(session.getProgress())
                .nodes(session.getTopics().stream().map(WorkflowNodeResponse::from).toList())
                .build();
    }

    @Transactional
    public void archiveSession(String sessionId, String userId) {
        StudySession session = requireOwnedSession(sessionId, userId);
        session.setStatus(SessionStatus.ARCHIVED);
        log.info("Archived study session {}", sessionId);
    }

    /**
     * Deletes a session with its topic tree, content and quiz history. Waits
     * for any generation running for the session in this instance.
     */
    public void deleteSession(String sessionId, String userId) {
        requireOwnedSession(sessionId, userId);
        sessionLockRegistry.withLock(sessionId, () -> transactionTemplate.execute(status -> {
            studySessionRepository.findByIdForUpdate(sessionId).ifPresent(session -> {
                quizAttemptRepository.deleteBySessionId(sessionId);
                studySessionRepository.delete(session);
            });
            return null;
        }));
        sessionLockRegistry.forget(sessionId);
        log.info("Deleted study session {}", sessionId);
    }

    /**
     * @throws ResponseStatusException 404 when absent, 403 when owned by someone else
     */
    public StudySession requireOwnedSession(String sessionId, String userId) {
        StudySession session = studySessionRepository.findById(sessionId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Study session not found: " + sessionId));
        checkOwner(session, userId);
        return session;
    }

    /**
     * Like {@link #requireOwnedSession} but holds the session row lock until
     * the surrounding transaction ends.
     */
    public StudySession requireOwnedSessionForUpdate(String sessionId, String userId) {
        StudySession session = studySessionRepository.findByIdForUpdate(sessionId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Study session not found: " + sessionId));
        checkOwner(session, userId);
        return session;
    }

    /**
     * Loads a topic of one of the caller's sessions for a workflow change.
     * The session row is locked before the topic row, so stage changes and
     * unlock cascades of one session run one at a time and each cascade sees
     * every completion committed before it.
     *
     * @throws ResponseStatusException 404 when absent, 403 when owned by someone else
     */
    public Topic requireOwnedTopicForUpdate(String topicId, String userId) {
        String sessionId = topicRepository.findSessionIdById(topicId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Topic not found: " + topicId));
        requireOwnedSessionForUpdate(sessionId, userId);
        return topicRepository.findByIdForUpdate(topicId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Topic not found: " + topicId));
    }

    public Topic requireOwnedTopic(String topicId, String userId) {
        Topic topic = topicRepository.findById(topicId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Topic not found: " + topicId));
        checkOwner(topic.getSession(), userId);
        return topic;
    }

    private void checkOwner(StudySession session, String userId) {
        if (userId != null && !userId.equals(session.getUserId())) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN,
                    "Access denied to study session: " + session.getId());
        }
    }
}
