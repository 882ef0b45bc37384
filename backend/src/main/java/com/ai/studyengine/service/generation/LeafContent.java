package com.ai.studyengine.service.generation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Questions and flashcards generated for one leaf topic.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeafContent {

    @Builder.Default
    private List<GeneratedQuestion> questions = new ArrayList<>();

    @Builder.Default
    private List<GeneratedFlashcard> flashcards = new ArrayList<>();
}
