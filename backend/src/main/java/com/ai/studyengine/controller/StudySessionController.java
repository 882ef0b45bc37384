package com.ai.studyengine.controller;

import com.ai.studyengine.dto.AnalyzeContentRequest;
import com.ai.studyengine.dto.BatchProgressRequest;
import com.ai.studyengine.dto.ContentAnalysisResponse;
import com.ai.studyengine.dto.CreateSessionRequest;
import com.ai.studyengine.dto.DueFlashcardsResponse;
import com.ai.studyengine.dto.GenerateMoreResponse;
import com.ai.studyengine.dto.SessionHistoryResponse;
import com.ai.studyengine.dto.SessionWorkflowResponse;
import com.ai.studyengine.dto.StudySessionResponse;
import com.ai.studyengine.dto.TopicProgressResponse;
import com.ai.studyengine.model.QuizAttempt;
import com.ai.studyengine.service.BackgroundGenerationService;
import com.ai.studyengine.service.ContentAnalysisService;
import com.ai.studyengine.service.ContentExtractionService;
import com.ai.studyengine.service.FlashcardService;
import com.ai.studyengine.service.GenerationOrchestrator;
import com.ai.studyengine.service.QuizService;
import com.ai.studyengine.service.StudySessionService;
import com.ai.studyengine.service.TopicProgressService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.security.Principal;
import java.util.List;
import java.util.Map;

/**
 * StudySessionController exposes session creation, progressive generation,
 * history, and session-level views.
 */
@Slf4j
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
@CrossOrigin(origins = { "http://localhost:5173", "http://localhost:3000" })
public class StudySessionController {

    private final GenerationOrchestrator generationOrchestrator;
    private final BackgroundGenerationService backgroundGenerationService;
    private final StudySessionService studySessionService;
    private final ContentAnalysisService contentAnalysisService;
    private final ContentExtractionService contentExtractionService;
    private final TopicProgressService topicProgressService;
    private final FlashcardService flashcardService;
    private final QuizService quizService;

    // ── POST /api/sessions/analyze ───────────────────────────────────────────

    @PostMapping("/analyze")
    public ResponseEntity<ContentAnalysisResponse> analyze(@Valid @RequestBody AnalyzeContentRequest request) {
        return ResponseEntity.ok(contentAnalysisService.analyze(request.getContent()));
    }

    @PostMapping(value = "/analyze/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ContentAnalysisResponse> analyzeUpload(@RequestParam("file") MultipartFile file)
            throws IOException {
        return ResponseEntity.ok(contentAnalysisService.analyze(contentExtractionService.extractText(file)));
    }

    // ── POST /api/sessions ───────────────────────────────────────────────────

    @PostMapping
    public ResponseEntity<StudySessionResponse> createSession(
            @Valid @RequestBody CreateSessionRequest request,
            Principal principal) {

        String userId = (principal != null) ? principal.getName() : null;
        log.info("Create session request: chars={}, topicCount={}, questionsPerTopic={}, user='{}'",
                request.getContent().length(), request.getTopicCount(), request.getQuestionsPerTopic(), userId);
        return ResponseEntity.status(HttpStatus.CREATED).body(generationOrchestrator.createSession(request, userId));
    }

    /**
     * Creates a session from an uploaded PDF. Accepts the same generation
     * parameters as the JSON endpoint as form fields.
     */
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<StudySessionResponse> createSessionFromUpload(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "title", required = false) String title,
            @RequestParam(value = "topicCount", defaultValue = "6") int topicCount,
            @RequestParam(value = "questionsPerTopic", defaultValue = "20") int questionsPerTopic,
            @RequestParam(value = "progressiveLoad", defaultValue = "true") boolean progressiveLoad,
            Principal principal) throws IOException {

        if (topicCount < 1 || topicCount > 35)
            throw new IllegalArgumentException("topicCount must be between 1 and 35");
        if (questionsPerTopic < 1 || questionsPerTopic > 100)
            throw new IllegalArgumentException("questionsPerTopic must be between 1 and 100");

        String userId = (principal != null) ? principal.getName() : null;
        log.info("Create session from upload: file='{}', size={}KB, user='{}'",
                file.getOriginalFilename(), file.getSize() / 1024, userId);

        String content = contentExtractionService.extractText(file);
        CreateSessionRequest request = CreateSessionRequest.builder()
                .content(content)
                .title(title)
                .topicCount(topicCount)
                .questionsPerTopic(questionsPerTopic)
                .progressiveLoad(progressiveLoad)
                .build();
        return ResponseEntity.status(HttpStatus.CREATED).body(generationOrchestrator.createSession(request, userId));
    }

    // ── History ──────────────────────────────────────────────────────────────

    @GetMapping
    public ResponseEntity<List<SessionHistoryResponse>> listSessions(Principal principal) {
        String userId = (principal != null) ? principal.getName() : null;
        return ResponseEntity.ok(studySessionService.listSessions(userId));
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<StudySessionResponse> getSession(@PathVariable String sessionId, Principal principal) {
        String userId = (principal != null) ? principal.getName() : null;
        return ResponseEntity.ok(studySessionService.getSession(sessionId, userId));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> deleteSession(@PathVariable String sessionId, Principal principal) {
        String userId = (principal != null) ? principal.getName() : null;
        studySessionService.deleteSession(sessionId, userId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{sessionId}/archive")
    public ResponseEntity<Map<String, String>> archiveSession(@PathVariable String sessionId, Principal principal) {
        String userId = (principal != null) ? principal.getName() : null;
        studySessionService.archiveSession(sessionId, userId);
        return ResponseEntity.ok(Map.of("sessionId", sessionId, "status", "archived"));
    }

    // ── Progressive generation ───────────────────────────────────────────────

    @PostMapping("/{sessionId}/generate-more")
    public ResponseEntity<GenerateMoreResponse> generateMore(@PathVariable String sessionId, Principal principal) {
        String userId = (principal != null) ? principal.getName() : null;
        return ResponseEntity.ok(generationOrchestrator.generateMore(sessionId, userId));
    }

    /**
     * Generates every remaining topic in the background. Progress is pushed
     * to {@code /topic/sessions/{sessionId}}.
     */
    @PostMapping("/{sessionId}/generate-remaining")
    public ResponseEntity<Map<String, String>> generateRemaining(@PathVariable String sessionId, Principal principal) {
        String userId = (principal != null) ? principal.getName() : null;
        studySessionService.requireOwnedSession(sessionId, userId);
        backgroundGenerationService.generateRemaining(sessionId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
                "sessionId", sessionId,
                "status", "generating",
                "topic", "/topic/sessions/" + sessionId));
    }

    // ── Session-level views ──────────────────────────────────────────────────

    @GetMapping("/{sessionId}/workflow")
    public ResponseEntity<SessionWorkflowResponse> getWorkflow(@PathVariable String sessionId, Principal principal) {
        String userId = (principal != null) ? principal.getName() : null;
        return ResponseEntity.ok(studySessionService.getWorkflow(sessionId, userId));
    }

    @GetMapping("/{sessionId}/flashcards/due")
    public ResponseEntity<DueFlashcardsResponse> getDueFlashcards(@PathVariable String sessionId, Principal principal) {
        String userId = (principal != null) ? principal.getName() : null;
        return ResponseEntity.ok(flashcardService.getDueFlashcards(sessionId, userId));
    }

    @PutMapping("/{sessionId}/progress")
    public ResponseEntity<List<TopicProgressResponse>> updateProgressBatch(
            @PathVariable String sessionId,
            @Valid @RequestBody BatchProgressRequest request,
            Principal principal) {
        String userId = (principal != null) ? principal.getName() : null;
        return ResponseEntity.ok(topicProgressService.updateProgressBatch(sessionId, request, userId));
    }

    @GetMapping("/{sessionId}/quiz-attempts")
    public ResponseEntity<List<QuizAttempt>> getQuizAttempts(@PathVariable String sessionId, Principal principal) {
        String userId = (principal != null) ? principal.getName() : null;
        return ResponseEntity.ok(quizService.getSessionAttempts(sessionId, userId));
    }
}
