package com.ai.studyengine.repository;

import com.ai.studyengine.model.QuizAttempt;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public interface QuizAttemptRepository extends JpaRepository<QuizAttempt, String> {

    List<QuizAttempt> findByTopicIdOrderByAttemptedAtDesc(String topicId);

    List<QuizAttempt> findBySessionIdOrderByAttemptedAtDesc(String sessionId);

    @Modifying
    @Transactional
    void deleteBySessionId(String sessionId);
}
