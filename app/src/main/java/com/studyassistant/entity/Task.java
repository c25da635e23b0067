package com.studyassistant.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Task entity for the task manager.
 *
 * A task belongs to one user and optionally to one of that user's categories.
 * The only state change is the status flip: PENDING → COMPLETED sets
 * {@code completedAt}, COMPLETED → PENDING clears it.
 *
 * Database Table: tasks
 */
@Entity
@Table(name = "tasks", indexes = {
    @Index(name = "idx_tasks_owner", columnList = "owner_user_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Task {

    /**
     * Primary key, assigned by SQLite on insert.
     */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    /**
     * Owning user. Every query on tasks is filtered by this column.
     */
    @Column(name = "owner_user_id", nullable = false, updatable = false)
    private Long ownerId;

    /**
     * What needs to be done. Never blank.
     */
    @Column(name = "title", nullable = false, columnDefinition = "TEXT")
    private String title;

    /**
     * Category of the task, or null for "Uncategorized".
     * Always a category of the same owner.
     */
    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "category_id", foreignKey = @ForeignKey(name = "fk_task_category"))
    private Category category;

    /**
     * Optional due date (date only, no time of day).
     */
    @Column(name = "due_date")
    private LocalDate dueDate;

    /**
     * Current status of the task.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private TaskStatus status = TaskStatus.PENDING;

    /**
     * Creation time, taken from the application clock by TaskService.
     */
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    /**
     * Completion time. Set only while status is COMPLETED.
     */
    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    /**
     * Constructor for a new pending task.
     *
     * @param ownerId the owning user's id
     * @param title the task title
     * @param category the category, or null for "Uncategorized"
     * @param dueDate the optional due date
     * @param createdAt the creation time
     */
    public Task(Long ownerId, String title, Category category, LocalDate dueDate, LocalDateTime createdAt) {
        this.ownerId = ownerId;
        this.title = title;
        this.category = category;
        this.dueDate = dueDate;
        this.createdAt = createdAt;
        this.status = TaskStatus.PENDING;
    }

    /**
     * Name of the category for display, "Uncategorized" when none.
     *
     * @return the category label
     */
    public String getCategoryName() {
        return category != null ? category.getName() : Category.UNCATEGORIZED;
    }

    public boolean isCompleted() {
        return status == TaskStatus.COMPLETED;
    }

    /**
     * Task lifecycle status.
     */
    public enum TaskStatus {
        PENDING,
        COMPLETED
    }
}
