package com.ai.studyengine.model;

import jakarta.persistence.*;
import lombok.*;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A node of a session's topic tree. Categories only group children;
 * leaves carry the questions and flashcards and move through the
 * {@link WorkflowStage} machine.
 */
@Entity
@Table(name = "topics", indexes = {
        @Index(name = "idx_topics_session_order", columnList = "session_id, order_index")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Topic {

    @Id
    @Column(length = 36, nullable = false, updatable = false)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "session_id", nullable = false)
    private StudySession session;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "parent_id")
    private Topic parent;

    @OneToMany(mappedBy = "parent", cascade = CascadeType.REMOVE)
    @OrderBy("siblingIndex ASC")
    @Builder.Default
    private List<Topic> children = new ArrayList<>();

    @Column(nullable = false)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "is_category", nullable = false)
    private boolean category;

    /** 1 for top-level topics. */
    @Column(nullable = false)
    private int depth;

    @Column(name = "sibling_index", nullable = false)
    private int siblingIndex;

    /** Position in the session-wide pre-order traversal. */
    @Column(name = "order_index", nullable = false)
    private int orderIndex;

    @Column(name = "position_x")
    private Double positionX;

    @Column(name = "position_y")
    private Double positionY;

    /** Null for categories. */
    @Enumerated(EnumType.STRING)
    @Column(name = "workflow_stage", length = 20)
    private WorkflowStage workflowStage;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "topic_prerequisites", joinColumns = @JoinColumn(name = "topic_id"))
    @Column(name = "prerequisite_topic_id", length = 36)
    @Builder.Default
    private Set<String> prerequisiteTopicIds = new LinkedHashSet<>();

    /** Last reported quiz score (0-100). */
    private Integer score;

    @Column(name = "current_question_index", nullable = false)
    private int currentQuestionIndex;

    @Column(nullable = false)
    private boolean completed;

    @OneToMany(mappedBy = "topic", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("orderIndex ASC")
    @Builder.Default
    private List<Question> questions = new ArrayList<>();

    @OneToMany(mappedBy = "topic", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("orderIndex ASC")
    @Builder.Default
    private List<Flashcard> flashcards = new ArrayList<>();

    public boolean isLeaf() {
        return !category;
    }

    /** A leaf still waiting for generated content. */
    public boolean needsContent() {
        return isLeaf() && questions.isEmpty();
    }

    public void addChild(Topic child) {
        child.setParent(this);
        children.add(child);
    }

    public void addQuestion(Question question) {
        question.setTopic(this);
        question.setOrderIndex(questions.size());
        questions.add(question);
    }

    public void addFlashcard(Flashcard flashcard) {
        flashcard.setTopic(this);
        flashcard.setOrderIndex(flashcards.size());
        flashcards.add(flashcard);
    }

    /**
     * Moves this leaf to {@code target}, which must be the stage directly
     * after the current one.
     *
     * @throws IllegalStateException on any other transition.
     */
    public void advanceTo(WorkflowStage target) {
        if (category || workflowStage == null || !workflowStage.canAdvanceTo(target)) {
            throw new IllegalStateException("Illegal workflow transition for topic " + id
                    + ": " + workflowStage + " -> " + target);
        }
        workflowStage = target;
        if (target == WorkflowStage.COMPLETED)
            completed = true;
    }
}
