package com.ai.studyengine.service.hierarchy;

import com.ai.studyengine.service.generation.GeneratedFlashcard;
import com.ai.studyengine.service.generation.GeneratedQuestion;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Identity-free description of one topic of a validated tree. This is
 * what the generation cache stores; sessions are assembled from it with
 * fresh ids.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopicBlueprint {

    private String title;

    private String description;

    private boolean category;

    @Builder.Default
    private List<TopicBlueprint> children = new ArrayList<>();

    /** Ordinals (in leaf traversal order) of the leaves this leaf requires. */
    @Builder.Default
    private List<Integer> prerequisites = new ArrayList<>();

    private Double positionX;
    private Double positionY;

    @Builder.Default
    private List<GeneratedQuestion> questions = new ArrayList<>();

    @Builder.Default
    private List<GeneratedFlashcard> flashcards = new ArrayList<>();

    @JsonIgnore
    public boolean isLeaf() {
        return !category;
    }
}
