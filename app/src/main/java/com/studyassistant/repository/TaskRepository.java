package com.studyassistant.repository;

import com.studyassistant.entity.Task;
import com.studyassistant.entity.Task.TaskStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Task entity.
 *
 * Provides owner-scoped CRUD plus the aggregate counts used by the
 * analytics screen.
 */
@Repository
public interface TaskRepository extends JpaRepository<Task, Long> {

    /**
     * Find a task by id, only if it belongs to the given owner.
     *
     * @param id the task id
     * @param ownerId the owner's user id
     * @return Optional containing the task if found for this owner
     */
    Optional<Task> findByIdAndOwnerId(Long id, Long ownerId);

    /**
     * Find all tasks of an owner in display order: tasks with a due date
     * first (earliest first), then tasks without one; newest created first
     * within the same due date.
     *
     * @param ownerId the owner's user id
     * @return ordered list of the owner's tasks
     */
    @Query("SELECT t FROM Task t " +
           "WHERE t.ownerId = :ownerId " +
           "ORDER BY CASE WHEN t.dueDate IS NULL THEN 1 ELSE 0 END, t.dueDate ASC, t.createdAt DESC, t.id DESC")
    List<Task> findAllForDisplay(@Param("ownerId") Long ownerId);

    /**
     * Detach every task of a category, moving them to "Uncategorized".
     *
     * @param categoryId the category being removed
     * @param ownerId the owner's user id
     * @return number of tasks reassigned
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Task t SET t.category = NULL WHERE t.category.id = :categoryId AND t.ownerId = :ownerId")
    int clearCategory(@Param("categoryId") Long categoryId, @Param("ownerId") Long ownerId);

    long countByOwnerId(Long ownerId);

    long countByOwnerIdAndStatus(Long ownerId, TaskStatus status);

    /**
     * Count an owner's tasks created within [from, to).
     *
     * @param ownerId the owner's user id
     * @param from inclusive lower bound
     * @param to exclusive upper bound
     * @return number of tasks created in the range
     */
    @Query("SELECT COUNT(t) FROM Task t " +
           "WHERE t.ownerId = :ownerId AND t.createdAt >= :from AND t.createdAt < :to")
    long countCreatedBetween(@Param("ownerId") Long ownerId,
                             @Param("from") LocalDateTime from,
                             @Param("to") LocalDateTime to);

    /**
     * Count an owner's tasks with the given status created within [from, to).
     *
     * @param ownerId the owner's user id
     * @param status the status to match
     * @param from inclusive lower bound
     * @param to exclusive upper bound
     * @return number of matching tasks created in the range
     */
    @Query("SELECT COUNT(t) FROM Task t " +
           "WHERE t.ownerId = :ownerId AND t.status = :status " +
           "AND t.createdAt >= :from AND t.createdAt < :to")
    long countByStatusCreatedBetween(@Param("ownerId") Long ownerId,
                                     @Param("status") TaskStatus status,
                                     @Param("from") LocalDateTime from,
                                     @Param("to") LocalDateTime to);
}
