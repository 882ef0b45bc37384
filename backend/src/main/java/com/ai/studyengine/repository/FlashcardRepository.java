package com.ai.studyengine.repository;

import com.ai.studyengine.model.Flashcard;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface FlashcardRepository extends JpaRepository<Flashcard, String> {

    @Query("SELECT f.topic.id FROM Flashcard f WHERE f.id = :id")
    Optional<String> findTopicIdById(@Param("id") String id);

    /** Cards of a session that were never reviewed or whose review date has passed. */
    @Query("SELECT f FROM Flashcard f WHERE f.topic.session.id = :sessionId "
            + "AND (f.nextReviewDate IS NULL OR f.nextReviewDate <= :now) "
            + "ORDER BY f.topic.orderIndex, f.orderIndex")
    List<Flashcard> findDueInSession(@Param("sessionId") String sessionId, @Param("now") LocalDateTime now);
}
