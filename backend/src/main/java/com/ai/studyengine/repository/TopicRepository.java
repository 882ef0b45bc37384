package com.ai.studyengine.repository;

import com.ai.studyengine.model.Topic;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TopicRepository extends JpaRepository<Topic, String> {

    /** Leaf topics of a session in traversal order. */
    @Query("SELECT t FROM Topic t WHERE t.session.id = :sessionId AND t.category = false ORDER BY t.orderIndex")
    List<Topic> findLeaves(@Param("sessionId") String sessionId);

    /** Leaves without any question yet, in traversal order. */
    @Query("SELECT t FROM Topic t WHERE t.session.id = :sessionId AND t.category = false "
            + "AND t.questions IS EMPTY ORDER BY t.orderIndex")
    List<Topic> findLeavesWithoutContent(@Param("sessionId") String sessionId);

    @Query("SELECT COUNT(t) FROM Topic t WHERE t.session.id = :sessionId AND t.category = false "
            + "AND t.questions IS EMPTY")
    long countLeavesWithoutContent(@Param("sessionId") String sessionId);

    long countBySessionIdAndCategoryFalse(String sessionId);

    @Query("SELECT t.session.id FROM Topic t WHERE t.id = :id")
    Optional<String> findSessionIdById(@Param("id") String id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM Topic t WHERE t.id = :id")
    Optional<Topic> findByIdForUpdate(@Param("id") String id);
}
