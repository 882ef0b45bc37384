package com.ai.studyengine.controller;

import com.ai.studyengine.dto.QuizSubmitRequest;
import com.ai.studyengine.dto.QuizSubmitResponse;
import com.ai.studyengine.dto.TopicFlashcardsResponse;
import com.ai.studyengine.dto.TopicProgressRequest;
import com.ai.studyengine.dto.TopicProgressResponse;
import com.ai.studyengine.dto.WorkflowCompletionResponse;
import com.ai.studyengine.model.QuizAttempt;
import com.ai.studyengine.service.FlashcardService;
import com.ai.studyengine.service.QuizService;
import com.ai.studyengine.service.TopicProgressService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.util.List;

@RestController
@RequestMapping("/api/topics")
@RequiredArgsConstructor
@CrossOrigin(origins = { "http://localhost:5173", "http://localhost:3000" })
public class TopicController {

    private final TopicProgressService topicProgressService;
    private final QuizService quizService;
    private final FlashcardService flashcardService;

    // ── PUT /api/topics/{topicId}/progress ───────────────────────────────────

    @PutMapping("/{topicId}/progress")
    public ResponseEntity<TopicProgressResponse> updateProgress(
            @PathVariable String topicId,
            @Valid @RequestBody TopicProgressRequest request,
            Principal principal) {
        String userId = (principal != null) ? principal.getName() : null;
        return ResponseEntity.ok(topicProgressService.updateProgress(topicId, request, userId));
    }

    // ── POST /api/topics/{topicId}/quiz/submit ───────────────────────────────

    @PostMapping("/{topicId}/quiz/submit")
    public ResponseEntity<QuizSubmitResponse> submitQuiz(
            @PathVariable String topicId,
            @Valid @RequestBody QuizSubmitRequest request,
            Principal principal) {
        String userId = (principal != null) ? principal.getName() : null;
        return ResponseEntity.ok(quizService.submitQuiz(topicId, userId, request));
    }

    @GetMapping("/{topicId}/quiz-attempts")
    public ResponseEntity<List<QuizAttempt>> getQuizAttempts(@PathVariable String topicId, Principal principal) {
        String userId = (principal != null) ? principal.getName() : null;
        return ResponseEntity.ok(quizService.getTopicAttempts(topicId, userId));
    }

    // ── Flashcards ───────────────────────────────────────────────────────────

    @GetMapping("/{topicId}/flashcards")
    public ResponseEntity<TopicFlashcardsResponse> getFlashcards(@PathVariable String topicId, Principal principal) {
        String userId = (principal != null) ? principal.getName() : null;
        return ResponseEntity.ok(flashcardService.getTopicFlashcards(topicId, userId));
    }

    @PostMapping("/{topicId}/flashcards/complete-review")
    public ResponseEntity<WorkflowCompletionResponse> completeReview(@PathVariable String topicId,
                                                                     Principal principal) {
        String userId = (principal != null) ? principal.getName() : null;
        return ResponseEntity.ok(flashcardService.completeReview(topicId, userId));
    }
}
