package com.ai.studyengine.dto;

import com.ai.studyengine.model.StudySession;
import com.ai.studyengine.model.Topic;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Full view of a study session: the topic tree with all generated content
 * and the generation progress.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StudySessionResponse {

    private String sessionId;
    private String title;
    private String status;
    private int progress;
    private boolean progressiveLoad;
    private boolean fromCache;
    private LocalDateTime createdAt;

    private int totalTopics;
    private int totalQuestions;
    private int totalFlashcards;

    /** Leaf topics still lacking content, derived by scanning the leaves. */
    private int questionsRemaining;

    private boolean hasMore;

    private List<TopicResponse> topics;

    public static StudySessionResponse from(StudySession session, LocalDateTime now) {
        List<Topic> leaves = session.leafTopics();
        int remaining = (int) leaves.stream().filter(Topic::needsContent).count();
        return StudySessionResponse.builder()
                .sessionId(session.getId())
                .title(session.getTitle())
                .status(session.getStatus().name().toLowerCase())
                .progress(session.getProgress())
                .progressiveLoad(session.isProgressiveLoad())
                .fromCache(session.isFromCache())
                .createdAt(session.getCreatedAt())
                .totalTopics(leaves.size())
                .totalQuestions(leaves.stream().mapToInt(t -> t.getQuestions().size()).sum())
                .totalFlashcards(leaves.stream().mapToInt(t -> t.getFlashcards().size()).sum())
                .questionsRemaining(remaining)
                .hasMore(remaining > 0)
                .topics(session.rootTopics().stream().map(t -> TopicResponse.from(t, now)).toList())
                .build();
    }
}
