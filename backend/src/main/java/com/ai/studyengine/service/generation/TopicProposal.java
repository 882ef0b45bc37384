package com.ai.studyengine.service.generation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw nested topic proposal returned by a backend, before any validation
 * of depth, distinctness or prerequisites.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopicProposal {

    /** Suggested session title, may be null. */
    private String title;

    @Builder.Default
    private List<Node> categories = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Node {

        private String title;

        private String description;

        /** Empty for leaves. */
        @Builder.Default
        private List<Node> subtopics = new ArrayList<>();

        /** Titles of leaf topics that must be completed first. */
        @Builder.Default
        private List<String> prerequisites = new ArrayList<>();

        public boolean isLeaf() {
            return subtopics == null || subtopics.isEmpty();
        }
    }
}
