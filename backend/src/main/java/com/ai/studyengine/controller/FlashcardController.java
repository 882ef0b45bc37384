package com.ai.studyengine.controller;

import com.ai.studyengine.dto.FlashcardReviewRequest;
import com.ai.studyengine.dto.FlashcardReviewResponse;
import com.ai.studyengine.service.FlashcardService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;

/**
 * Records a flashcard review.
 *
 * <pre>
 *   POST /api/flashcards/{flashcardId}/review
 *   Body: { "quality": 4 }
 * </pre>
 */
@RestController
@RequestMapping("/api/flashcards")
@RequiredArgsConstructor
@CrossOrigin(origins = { "http://localhost:5173", "http://localhost:3000" })
public class FlashcardController {

    private final FlashcardService flashcardService;

    @PostMapping("/{flashcardId}/review")
    public ResponseEntity<FlashcardReviewResponse> review(
            @PathVariable String flashcardId,
            @Valid @RequestBody FlashcardReviewRequest request,
            Principal principal) {
        String userId = (principal != null) ? principal.getName() : null;
        return ResponseEntity.ok(flashcardService.review(flashcardId, request.getQuality(), userId));
    }
}
