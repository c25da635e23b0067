package com.studyassistant.repository;

import com.studyassistant.entity.QuizResult;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for QuizResult entity.
 */
@Repository
public interface QuizResultRepository extends JpaRepository<QuizResult, Long> {

    Optional<QuizResult> findByIdAndOwnerId(Long id, Long ownerId);

    List<QuizResult> findByOwnerIdOrderByTakenAtDesc(Long ownerId);

    List<QuizResult> findByOwnerIdOrderByTakenAtDesc(Long ownerId, Pageable pageable);

    long countByOwnerId(Long ownerId);

    /**
     * Mean of score/total over an owner's quizzes.
     *
     * @param ownerId the owner's user id
     * @return average ratio between 0.0 and 1.0, or null when no quiz was taken
     */
    @Query("SELECT AVG(q.score * 1.0 / q.totalQuestions) FROM QuizResult q WHERE q.ownerId = :ownerId")
    Double averageScoreRatio(@Param("ownerId") Long ownerId);
}
