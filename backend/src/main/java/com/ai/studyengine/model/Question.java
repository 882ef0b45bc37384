package com.ai.studyengine.model;

import jakarta.persistence.*;
import lombok.*;

import java.util.List;

/**
 * A generated multiple-choice question. Never modified after creation.
 */
@Entity
@Table(name = "questions")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Question {

    @Id
    @Column(length = 36, nullable = false, updatable = false)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "topic_id", nullable = false)
    private Topic topic;

    @Column(name = "order_index", nullable = false)
    private int orderIndex;

    @Column(name = "question_text", nullable = false, columnDefinition = "TEXT")
    private String text;

    /** Exactly four options. */
    @Convert(converter = StringListConverter.class)
    @Column(nullable = false, columnDefinition = "TEXT")
    private List<String> options;

    /** 0-based index into {@link #options}. */
    @Column(name = "correct_answer", nullable = false)
    private int correctAnswer;

    @Column(columnDefinition = "TEXT")
    private String explanation;

    /** Verbatim source passage supporting the answer. */
    @Column(name = "source_text", columnDefinition = "TEXT")
    private String sourceText;

    @Column(name = "source_page")
    private Integer sourcePage;
}
