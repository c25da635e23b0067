package com.studyassistant.repository;

import com.studyassistant.entity.StudyLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for StudyLog entity.
 *
 * Besides owner-scoped listing it carries the aggregate queries behind the
 * analytics screen.
 */
@Repository
public interface StudyLogRepository extends JpaRepository<StudyLog, Long> {

    Optional<StudyLog> findByIdAndOwnerId(Long id, Long ownerId);

    List<StudyLog> findByOwnerIdOrderByLoggedAtDesc(Long ownerId);

    List<StudyLog> findByOwnerIdOrderByLoggedAtDesc(Long ownerId, Pageable pageable);

    long countByOwnerId(Long ownerId);

    /**
     * Sum of all study minutes of an owner.
     *
     * @param ownerId the owner's user id
     * @return total minutes, 0 when there are no logs
     */
    @Query("SELECT COALESCE(SUM(s.durationMinutes), 0) FROM StudyLog s WHERE s.ownerId = :ownerId")
    long sumDurationMinutes(@Param("ownerId") Long ownerId);

    /**
     * All log timestamps of an owner, newest first.
     *
     * @param ownerId the owner's user id
     * @return log timestamps
     */
    @Query("SELECT s.loggedAt FROM StudyLog s WHERE s.ownerId = :ownerId ORDER BY s.loggedAt DESC")
    List<LocalDateTime> findAllLogTimes(@Param("ownerId") Long ownerId);

    /**
     * Minutes per subject, largest first. Each row is {subject, minutes}.
     *
     * @param ownerId the owner's user id
     * @param pageable limit of rows
     * @return subject totals
     */
    @Query("SELECT s.subject, SUM(s.durationMinutes) FROM StudyLog s " +
           "WHERE s.ownerId = :ownerId " +
           "GROUP BY s.subject " +
           "ORDER BY SUM(s.durationMinutes) DESC")
    List<Object[]> sumMinutesBySubject(@Param("ownerId") Long ownerId, Pageable pageable);
}
