package com.ai.studyengine.repository;

import com.ai.studyengine.model.StudySession;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for study sessions.
 */
@Repository
public interface StudySessionRepository extends JpaRepository<StudySession, String> {

    List<StudySession> findByUserIdOrderByCreatedAtDesc(String userId);

    /**
     * Loads the session row with a write lock held until the surrounding
     * transaction ends. Serializes batch selection across instances.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM StudySession s WHERE s.id = :id")
    Optional<StudySession> findByIdForUpdate(@Param("id") String id);
}
