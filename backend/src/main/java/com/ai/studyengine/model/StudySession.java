package com.ai.studyengine.model;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.domain.Persistable;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A study session created from one uploaded document.
 * Owns the whole topic tree; {@link #topics} holds every topic of the tree
 * (categories and leaves) in traversal order.
 */
@Entity
@Table(name = "study_sessions", indexes = {
        @Index(name = "idx_study_sessions_user", columnList = "user_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StudySession implements Persistable<String> {

    @Id
    @Column(length = 36, nullable = false, updatable = false)
    private String id;

    @Column(name = "user_id")
    private String userId;

    @Column(nullable = false)
    private String title;

    @Column(name = "source_text", columnDefinition = "TEXT")
    private String sourceText;

    /**
     * Generation cache key of the source text and generation parameters.
     * Used to refresh the cache once every leaf has content.
     */
    @Column(name = "content_hash", length = 128)
    private String contentHash;

    @Column(name = "topic_count", nullable = false)
    private int topicCount;

    @Column(name = "questions_per_topic", nullable = false)
    private int questionsPerTopic;

    @Column(name = "progressive_load", nullable = false)
    private boolean progressiveLoad;

    /** Completion percentage (0-100), derived from leaf workflow stages. */
    @Column(nullable = false)
    private int progress;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private SessionStatus status = SessionStatus.IN_PROGRESS;

    /** True when the topic tree was rebuilt from the generation cache. */
    @Column(name = "from_cache", nullable = false)
    private boolean fromCache;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @OneToMany(mappedBy = "session", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("orderIndex ASC")
    @Builder.Default
    private List<Topic> topics = new ArrayList<>();

    /** Ids are assigned before saving, so newness is tracked explicitly. */
    @Transient
    @Builder.Default
    private boolean persisted = false;

    @Override
    public boolean isNew() {
        return !persisted;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        persisted = true;
    }

    public void addTopic(Topic topic) {
        topic.setSession(this);
        topics.add(topic);
    }

    /** Top-level topics (no parent), in traversal order. */
    public List<Topic> rootTopics() {
        return topics.stream().filter(t -> t.getParent() == null).toList();
    }

    /** Leaf topics in traversal order. */
    public List<Topic> leafTopics() {
        return topics.stream().filter(Topic::isLeaf).toList();
    }

    @PrePersist
    public void prePersist() {
        if (createdAt == null)
            createdAt = LocalDateTime.now();
    }
}
