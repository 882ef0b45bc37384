package com.ai.studyengine.service;

import com.ai.studyengine.dto.BatchProgressRequest;
import com.ai.studyengine.dto.FlashcardReviewResponse;
import com.ai.studyengine.dto.QuizSubmitRequest;
import com.ai.studyengine.dto.QuizSubmitResponse;
import com.ai.studyengine.dto.StudySessionResponse;
import com.ai.studyengine.dto.TopicProgressRequest;
import com.ai.studyengine.dto.TopicProgressResponse;
import com.ai.studyengine.dto.TopicResponse;
import com.ai.studyengine.exception.GenerationException;
import com.ai.studyengine.exception.WorkflowTransitionException;
import com.ai.studyengine.model.QuizAttempt;
import com.ai.studyengine.model.Topic;
import com.ai.studyengine.model.WorkflowStage;
import com.ai.studyengine.repository.TopicRepository;
import com.ai.studyengine.service.generation.GenerationProviderAdapter;
import com.ai.studyengine.service.generation.ResponseSchema;
import com.ai.studyengine.service.generation.TopicProposalSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.ai.studyengine.StudyFixtures.leavesOf;
import static com.ai.studyengine.StudyFixtures.proposal;
import static com.ai.studyengine.StudyFixtures.request;
import static com.ai.studyengine.StudyFixtures.scriptedGeneration;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.when;

@SpringBootTest
class StudyWorkflowTest {

    private static final String USER = "user-1";

    @Autowired
    private GenerationOrchestrator orchestrator;

    @Autowired
    private StudySessionService studySessionService;

    @Autowired
    private QuizService quizService;

    @Autowired
    private FlashcardService flashcardService;

    @Autowired
    private TopicProgressService topicProgressService;

    @Autowired
    private TopicRepository topicRepository;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @MockBean
    private GenerationProviderAdapter adapter;

    private StudySessionResponse session;
    private List<TopicResponse> leaves;

    @BeforeEach
    void createFullyGeneratedSession() {
        when(adapter.generate(any(), any(), any())).thenAnswer(scriptedGeneration());
        session = orchestrator.createSession(request(false), USER);
        leaves = leavesOf(session);
    }

    private QuizSubmitResponse quiz(TopicResponse topic, Integer... answers) {
        return quizService.submitQuiz(topic.getId(), USER, new QuizSubmitRequest(List.of(answers)));
    }

    @Test
    void passingQuizThenReviewingEveryCardCompletesTheTopic() {
        TopicResponse first = leaves.get(0);

        QuizSubmitResponse result = quiz(first, 1, 1);

        assertThat(result.getPercentage()).isEqualTo(100);
        assertThat(result.isPassed()).isTrue();
        assertThat(result.getGrade()).startsWith("Excellent");
        assertThat(result.getWorkflowStage()).isEqualTo("flashcard_review");
        assertThat(result.getResults()).allMatch(QuizSubmitResponse.QuestionResult::isCorrect);

        FlashcardReviewResponse firstCard = flashcardService.review(first.getFlashcards().get(0).getId(), 5, USER);
        assertThat(firstCard.getWorkflowStage()).isEqualTo("flashcard_review");
        assertThat(firstCard.getFlashcard().getRepetitions()).isEqualTo(1);
        assertThat(firstCard.getUnlockedTopicIds()).isEmpty();

        FlashcardReviewResponse lastCard = flashcardService.review(first.getFlashcards().get(1).getId(), 4, USER);
        assertThat(lastCard.getWorkflowStage()).isEqualTo("completed");
        assertThat(lastCard.getUnlockedTopicIds()).containsExactly(leaves.get(1).getId());
        assertThat(lastCard.getSessionProgress()).isEqualTo(7);

        List<TopicResponse> after = leavesOf(studySessionService.getSession(session.getSessionId(), USER));
        assertThat(after.get(0).isCompleted()).isTrue();
        assertThat(after.get(1).getWorkflowStage()).isEqualTo("quiz_available");
        assertThat(after.get(2).getWorkflowStage()).isEqualTo("locked");
    }

    @Test
    void failingQuizIsRecordedButKeepsTheTopicInQuiz() {
        QuizSubmitResponse result = quiz(leaves.get(0), 0, 1);

        assertThat(result.getPercentage()).isEqualTo(50);
        assertThat(result.isPassed()).isFalse();
        assertThat(result.getWorkflowStage()).isEqualTo("quiz_available");
        assertThat(result.getResults().get(0).getSelectedAnswer()).isZero();
        assertThat(quizService.getTopicAttempts(leaves.get(0).getId(), USER)).hasSize(1);
        assertThat(quizService.getSessionAttempts(session.getSessionId(), USER))
                .extracting(QuizAttempt::getPercentage).containsExactly(50);
    }

    @Test
    void lockedTopicsRejectQuizzes() {
        assertThatThrownBy(() -> quiz(leaves.get(2), 1, 1))
                .isInstanceOf(WorkflowTransitionException.class);
    }

    @Test
    void explicitReviewCompletionNeedsEveryCardReviewed() {
        TopicResponse first = leaves.get(0);
        quiz(first, 1, 1);
        flashcardService.review(first.getFlashcards().get(0).getId(), 3, USER);

        assertThatThrownBy(() -> flashcardService.completeReview(first.getId(), USER))
                .isInstanceOf(WorkflowTransitionException.class)
                .hasMessageStartingWith("1 flashcard(s)");
        assertThat(flashcardService.getTopicFlashcards(first.getId(), USER).getReviewedInCurrentPass()).isEqualTo(1);
    }

    @Test
    void reviewedCardsLeaveTheDueList() {
        assertThat(flashcardService.getDueFlashcards(session.getSessionId(), USER).getDueCount()).isEqualTo(28);

        flashcardService.review(leaves.get(3).getFlashcards().get(0).getId(), 5, USER);

        assertThat(flashcardService.getDueFlashcards(session.getSessionId(), USER).getDueCount()).isEqualTo(27);
    }

    @Test
    void concurrentCompletionsOfTwoPrerequisitesUnlockTheirDependent() throws Exception {
        String a = leaves.get(0).getId();
        String b = leaves.get(1).getId();
        String c = leaves.get(5).getId();
        transactionTemplate.executeWithoutResult(status -> {
            for (String id : List.of(a, b)) {
                Topic topic = topicRepository.findById(id).orElseThrow();
                topic.setWorkflowStage(WorkflowStage.FLASHCARD_REVIEW);
                topic.getFlashcards().get(0).setReviewedInCurrentPass(true);
            }
            Topic dependent = topicRepository.findById(c).orElseThrow();
            dependent.getPrerequisiteTopicIds().clear();
            dependent.getPrerequisiteTopicIds().add(a);
            dependent.getPrerequisiteTopicIds().add(b);
        });

        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        List<Future<FlashcardReviewResponse>> reviews = new ArrayList<>();
        try {
            for (TopicResponse topic : List.of(leaves.get(0), leaves.get(1))) {
                String lastCard = topic.getFlashcards().get(1).getId();
                reviews.add(pool.submit(() -> {
                    start.await();
                    return flashcardService.review(lastCard, 5, USER);
                }));
            }
            start.countDown();
            for (Future<FlashcardReviewResponse> review : reviews) {
                assertThat(review.get(30, TimeUnit.SECONDS).getWorkflowStage()).isEqualTo("completed");
            }
        } finally {
            pool.shutdownNow();
        }

        List<TopicResponse> after = leavesOf(studySessionService.getSession(session.getSessionId(), USER));
        assertThat(after.get(5).getWorkflowStage()).isEqualTo("quiz_available");
        assertThat(reviews.get(0).get().getUnlockedTopicIds().contains(c)
                ^ reviews.get(1).get().getUnlockedTopicIds().contains(c)).isTrue();
    }

    @Test
    void completedProgressUpdateGoesThroughTheWorkflow() {
        TopicResponse first = leaves.get(0);

        TopicProgressResponse saved = topicProgressService.updateProgress(first.getId(),
                TopicProgressRequest.builder().score(40).currentQuestionIndex(1).build(), USER);
        assertThat(saved.getScore()).isEqualTo(40);
        assertThat(saved.getWorkflowStage()).isEqualTo("quiz_available");

        TopicProgressResponse finished = topicProgressService.updateProgress(first.getId(),
                TopicProgressRequest.builder().score(85).completed(true).build(), USER);
        assertThat(finished.getWorkflowStage()).isEqualTo("flashcard_review");
        assertThat(finished.getCurrentQuestionIndex()).isEqualTo(1);
    }

    @Test
    void finishedProgressIsRejectedForTopicsWithoutContent() {
        doAnswer(invocation -> {
            ResponseSchema<?> schema = invocation.getArgument(2);
            if (schema instanceof TopicProposalSchema)
                return proposal(14);
            throw new GenerationException("fast backend unavailable");
        }).when(adapter).generate(any(), any(), any());
        StudySessionResponse empty = orchestrator.createSession(request(true), USER);
        TopicResponse first = leavesOf(empty).get(0);

        assertThatThrownBy(() -> topicProgressService.updateProgress(first.getId(),
                TopicProgressRequest.builder().score(100).completed(true).build(), USER))
                .isInstanceOf(WorkflowTransitionException.class)
                .hasMessageContaining("has no questions yet");

        List<TopicResponse> after = leavesOf(studySessionService.getSession(empty.getSessionId(), USER));
        assertThat(after.get(0).getWorkflowStage()).isEqualTo("quiz_available");
        assertThat(after.get(1).getWorkflowStage()).isEqualTo("locked");
        assertThat(after.get(0).isCompleted()).isFalse();
    }

    @Test
    void batchProgressRejectsTopicsOfAnotherSession() {
        StudySessionResponse other = orchestrator.createSession(request(true), USER);
        BatchProgressRequest batch = new BatchProgressRequest(List.of(
                TopicProgressRequest.builder().topicId(leaves.get(0).getId()).currentQuestionIndex(1).build(),
                TopicProgressRequest.builder().topicId(leavesOf(other).get(0).getId()).currentQuestionIndex(1).build()));

        assertThatThrownBy(() -> topicProgressService.updateProgressBatch(session.getSessionId(), batch, USER))
                .isInstanceOf(ResponseStatusException.class)
                .hasMessageContaining("400");
    }

    @Test
    void workflowViewListsEveryNode() {
        assertThat(studySessionService.getWorkflow(session.getSessionId(), USER).getNodes()).hasSize(18);
        assertThat(studySessionService.listSessions(USER))
                .anySatisfy(h -> {
                    assertThat(h.getId()).isEqualTo(session.getSessionId());
                    assertThat(h.getTotalTopics()).isEqualTo(14);
                    assertThat(h.getQuestionsRemaining()).isZero();
                });
    }

    @Test
    void archivedSessionsStayReadableAndDeletedOnesAreGone() {
        quiz(leaves.get(0), 1, 0);
        studySessionService.archiveSession(session.getSessionId(), USER);
        assertThat(studySessionService.getSession(session.getSessionId(), USER).getStatus()).isEqualTo("archived");

        studySessionService.deleteSession(session.getSessionId(), USER);

        assertThatThrownBy(() -> studySessionService.getSession(session.getSessionId(), USER))
                .isInstanceOf(ResponseStatusException.class)
                .hasMessageContaining("404");
        assertThatThrownBy(() -> quizService.getTopicAttempts(leaves.get(0).getId(), USER))
                .isInstanceOf(ResponseStatusException.class)
                .hasMessageContaining("404");
    }
}
