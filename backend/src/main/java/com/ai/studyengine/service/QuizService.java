package com.ai.studyengine.service;

import com.ai.studyengine.dto.QuizSubmitRequest;
import com.ai.studyengine.dto.QuizSubmitResponse;
import com.ai.studyengine.model.Question;
import com.ai.studyengine.model.QuizAttempt;
import com.ai.studyengine.model.Topic;
import com.ai.studyengine.repository.QuizAttemptRepository;
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
 * QuizService grades quiz submissions for a leaf topic against its stored
 * questions and feeds the result into the topic workflow.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QuizService {

    private final StudySessionService studySessionService;
    private final TopicWorkflowService topicWorkflowService;
    private final QuizAttemptRepository quizAttemptRepository;

    // ── Submit & Grade ───────────────────────────────────────────────────────

    @Transactional
    public QuizSubmitResponse submitQuiz(String topicId, String userId, QuizSubmitRequest submitRequest) {
        Topic topic = studySessionService.requireOwnedTopicForUpdate(topicId, userId);
        List<Question> questions = topic.getQuestions();
        if (questions.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "No questions generated yet for topic: " + topicId);
        }

        List<Integer> answers = submitRequest.getAnswers();
        List<QuizSubmitResponse.QuestionResult> results = new ArrayList<>();
        int score = 0;

        for (int i = 0; i < questions.size(); i++) {
            Question q = questions.get(i);
            Integer selected = (i < answers.size()) ? answers.get(i) : null;
            boolean correct = selected != null && selected == q.getCorrectAnswer();

            if (correct)
                score++;

            results.add(QuizSubmitResponse.QuestionResult.builder()
                    .index(i)
                    .question(q.getText())
                    .selectedAnswer(selected)
                    .correctAnswer(q.getCorrectAnswer())
                    .correct(correct)
                    .explanation(q.getExplanation())
                    .sourceText(q.getSourceText())
                    .build());
        }

        int total = questions.size();
        int pct = score * 100 / total;
        WorkflowOutcome outcome = topicWorkflowService.recordQuizResult(topic, pct);
        boolean passed = topicWorkflowService.isPassing(pct);

        quizAttemptRepository.save(QuizAttempt.builder()
                .sessionId(topic.getSession().getId())
                .topicId(topic.getId())
                .topicTitle(topic.getTitle())
                .userId(userId)
                .score(score)
                .totalQuestions(total)
                .percentage(pct)
                .passed(passed)
                .build());

        log.info("Quiz submitted for topic {}. Score: {}/{} ({}%), stage={}",
                topicId, score, total, pct, outcome.getStage().wireName());

        return QuizSubmitResponse.builder()
                .topicId(topic.getId())
                .score(score)
                .totalQuestions(total)
                .percentage(pct)
                .passed(passed)
                .grade(gradeOf(pct))
                .workflowStage(outcome.getStage().wireName())
                .unlockedTopicIds(outcome.getUnlockedTopicIds())
                .sessionProgress(outcome.getSessionProgress())
                .results(results)
                .build();
    }

    // ── History ──────────────────────────────────────────────────────────────

    @Transactional(readOnly = true)
    public List<QuizAttempt> getTopicAttempts(String topicId, String userId) {
        studySessionService.requireOwnedTopic(topicId, userId);
        return quizAttemptRepository.findByTopicIdOrderByAttemptedAtDesc(topicId);
    }

    @Transactional(readOnly = true)
    public List<QuizAttempt> getSessionAttempts(String sessionId, String userId) {
        studySessionService.requireOwnedSession(sessionId, userId);
        return quizAttemptRepository.findBySessionIdOrderByAttemptedAtDesc(sessionId);
    }

    static String gradeOf(int pct) {
        if (pct >= 90)
            return "Excellent 🏆";
        if (pct >= 75)
            return "Good 👍";
        if (pct >= 50)
            return "Average 📚";
        return "Needs Improvement 💪";
    }
}
