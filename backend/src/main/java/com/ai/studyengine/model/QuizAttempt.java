package com.ai.studyengine.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Persists a single graded quiz attempt on a leaf topic so we can show
 * score history per topic and per session.
 */
@Entity
@Table(name = "quiz_attempts", indexes = {
        @Index(name = "idx_quiz_attempts_session", columnList = "session_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuizAttempt {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "session_id", nullable = false, length = 36)
    private String sessionId;

    @Column(name = "topic_id", nullable = false, length = 36)
    private String topicId;

    /** Topic title, stored so history survives renames. */
    @Column(name = "topic_title")
    private String topicTitle;

    @Column(name = "user_id")
    private String userId;

    /** Number of correct answers */
    @Column(nullable = false)
    private int score;

    @Column(name = "total_questions", nullable = false)
    private int totalQuestions;

    /** Score % (0-100) */
    @Column(nullable = false)
    private int percentage;

    @Column(nullable = false)
    private boolean passed;

    @CreationTimestamp
    @Column(name = "attempted_at", nullable = false, updatable = false)
    private LocalDateTime attemptedAt;

    @PrePersist
    public void prePersist() {
        if (id == null)
            id = UUID.randomUUID().toString();
    }
}
