package com.ai.studyengine.service;

import com.ai.studyengine.dto.CreateSessionRequest;
import com.ai.studyengine.dto.GenerateMoreResponse;
import com.ai.studyengine.dto.StudySessionResponse;
import com.ai.studyengine.dto.TopicResponse;
import com.ai.studyengine.exception.GenerationException;
import com.ai.studyengine.service.generation.GenerationProviderAdapter;
import com.ai.studyengine.service.generation.ResponseSchema;
import com.ai.studyengine.service.generation.TopicProposalSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
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
import static org.mockito.ArgumentMatchers.isA;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@SpringBootTest
class GenerationOrchestratorTest {

    private static final String USER = "user-1";

    @Autowired
    private GenerationOrchestrator orchestrator;

    @Autowired
    private StudySessionService studySessionService;

    @MockBean
    private GenerationProviderAdapter adapter;

    @BeforeEach
    void scriptAdapter() {
        when(adapter.generate(any(), any(), any())).thenAnswer(scriptedGeneration());
    }

    @Test
    void fillsTheFirstLeavesAtCreationAndTheRestInBatches() {
        StudySessionResponse created = orchestrator.createSession(request(true), USER);

        assertThat(created.getTotalTopics()).isEqualTo(14);
        assertThat(created.getTotalQuestions()).isEqualTo(6);
        assertThat(created.getQuestionsRemaining()).isEqualTo(11);
        assertThat(created.isHasMore()).isTrue();
        assertThat(created.isFromCache()).isFalse();
        assertThat(leavesOf(created)).extracting(TopicResponse::isPendingContent)
                .containsExactly(false, false, false, true, true, true, true, true, true, true, true, true, true, true);

        List<Integer> generated = new ArrayList<>();
        List<Integer> remaining = new ArrayList<>();
        GenerateMoreResponse batch;
        do {
            batch = orchestrator.generateMore(created.getSessionId(), USER);
            generated.add(batch.getGenerated());
            remaining.add(batch.getRemaining());
        } while (batch.isHasMore());
        assertThat(generated).containsExactly(2, 2, 2, 2, 2, 1);
        assertThat(remaining).containsExactly(9, 7, 5, 3, 1, 0);

        StudySessionResponse full = studySessionService.getSession(created.getSessionId(), USER);
        assertThat(full.getTotalQuestions()).isEqualTo(28);
        assertThat(full.getTotalFlashcards()).isEqualTo(28);
        assertThat(leavesOf(full)).allSatisfy(leaf -> {
            assertThat(leaf.getQuestions()).hasSize(2);
            assertThat(leaf.isPendingContent()).isFalse();
        });

        clearInvocations(adapter);
        GenerateMoreResponse idle = orchestrator.generateMore(created.getSessionId(), USER);
        assertThat(idle.getGenerated()).isZero();
        assertThat(idle.isHasMore()).isFalse();
        verifyNoInteractions(adapter);
    }

    @Test
    void nonProgressiveSessionsAreCompleteOnCreation() {
        StudySessionResponse created = orchestrator.createSession(request(false), USER);

        assertThat(created.getTotalQuestions()).isEqualTo(28);
        assertThat(created.isHasMore()).isFalse();
        // proposal, initial batch, six incremental batches
        verify(adapter, times(8)).generate(any(), any(), any());
    }

    @Test
    void identicalRequestIsServedFromTheCacheWithoutGeneration() {
        CreateSessionRequest request = request(true);
        StudySessionResponse first = orchestrator.createSession(request, USER);
        clearInvocations(adapter);

        StudySessionResponse second = orchestrator.createSession(request, "user-2");

        verifyNoInteractions(adapter);
        assertThat(second.isFromCache()).isTrue();
        assertThat(second.getSessionId()).isNotEqualTo(first.getSessionId());
        assertThat(second.getTotalTopics()).isEqualTo(first.getTotalTopics());
        assertThat(second.getTotalQuestions()).isEqualTo(first.getTotalQuestions());
        assertThat(second.getQuestionsRemaining()).isEqualTo(first.getQuestionsRemaining());
        assertThat(leavesOf(second)).extracting(TopicResponse::getTitle)
                .containsExactlyElementsOf(leavesOf(first).stream().map(TopicResponse::getTitle).toList());
        assertThat(leavesOf(second)).extracting(TopicResponse::getId)
                .doesNotContainAnyElementsOf(leavesOf(first).stream().map(TopicResponse::getId).toList());
    }

    @Test
    void nonProgressiveRequestCompletesAPartialTreeFromTheCache() {
        CreateSessionRequest request = request(true);
        orchestrator.createSession(request, USER);
        clearInvocations(adapter);

        request.setProgressiveLoad(false);
        StudySessionResponse copy = orchestrator.createSession(request, USER);

        assertThat(copy.isFromCache()).isTrue();
        assertThat(copy.isProgressiveLoad()).isFalse();
        assertThat(copy.getTotalQuestions()).isEqualTo(28);
        assertThat(copy.getQuestionsRemaining()).isZero();
        assertThat(copy.isHasMore()).isFalse();
        verify(adapter, never()).generate(any(), any(), isA(TopicProposalSchema.class));
        // only the eleven leaves the cached tree left empty, two per batch
        verify(adapter, times(6)).generate(any(), any(), any());
    }

    @Test
    void fullyGeneratedSessionReplacesThePartialCacheEntry() {
        CreateSessionRequest request = request(true);
        StudySessionResponse first = orchestrator.createSession(request, USER);
        for (int i = 0; i < 6; i++) {
            orchestrator.generateMore(first.getSessionId(), USER);
        }
        clearInvocations(adapter);

        StudySessionResponse copy = orchestrator.createSession(request, USER);

        verifyNoInteractions(adapter);
        assertThat(copy.getTotalQuestions()).isEqualTo(28);
        assertThat(copy.isHasMore()).isFalse();
    }

    @Test
    void concurrentBatchesNeverFillALeafTwice() throws Exception {
        StudySessionResponse created = orchestrator.createSession(request(true), USER);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<Future<Integer>> results = new ArrayList<>();
        try {
            for (int i = 0; i < 8; i++) {
                results.add(pool.submit(() -> orchestrator.generateMore(created.getSessionId(), USER).getGenerated()));
            }
            int generated = 0;
            for (Future<Integer> result : results) {
                generated += result.get(30, TimeUnit.SECONDS);
            }
            assertThat(generated).isEqualTo(11);
        } finally {
            pool.shutdownNow();
        }

        StudySessionResponse full = studySessionService.getSession(created.getSessionId(), USER);
        Set<String> questionIds = new HashSet<>();
        leavesOf(full).forEach(leaf -> {
            assertThat(leaf.getQuestions()).hasSize(2);
            leaf.getQuestions().forEach(q -> questionIds.add(q.getId()));
        });
        assertThat(questionIds).hasSize(28);
    }

    @Test
    void failedBatchLeavesItsLeavesPendingForARetry() {
        StudySessionResponse created = orchestrator.createSession(request(true), USER);
        doThrow(new GenerationException("bulk backend unavailable"))
                .when(adapter).generate(any(), any(), any());

        assertThatThrownBy(() -> orchestrator.generateMore(created.getSessionId(), USER))
                .isInstanceOf(GenerationException.class);
        assertThat(studySessionService.getSession(created.getSessionId(), USER).getQuestionsRemaining())
                .isEqualTo(11);
    }

    @Test
    void initialFillFailureStillReturnsTheSession() {
        doAnswer(invocation -> {
            ResponseSchema<?> schema = invocation.getArgument(2);
            if (schema instanceof TopicProposalSchema)
                return proposal(14);
            throw new GenerationException("fast backend unavailable");
        }).when(adapter).generate(any(), any(), any());

        StudySessionResponse created = orchestrator.createSession(request(true), USER);

        assertThat(created.getTotalTopics()).isEqualTo(14);
        assertThat(created.getQuestionsRemaining()).isEqualTo(14);
    }

    @Test
    void sessionsOfOtherUsersAreOffLimits() {
        StudySessionResponse created = orchestrator.createSession(request(true), USER);

        assertThatThrownBy(() -> orchestrator.generateMore(created.getSessionId(), "intruder"))
                .isInstanceOf(ResponseStatusException.class)
                .hasMessageContaining("403");
        assertThatThrownBy(() -> orchestrator.generateMore("missing-session", USER))
                .isInstanceOf(ResponseStatusException.class)
                .hasMessageContaining("404");
    }
}
