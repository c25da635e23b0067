package com.studyassistant.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * StudyLog entity for recorded study sessions.
 *
 * Logs are immutable once written; the only other operation is delete.
 * They feed the analytics screen (total minutes, streak, consistency).
 *
 * Database Table: study_logs
 */
@Entity
@Table(name = "study_logs", indexes = {
    @Index(name = "idx_study_logs_owner", columnList = "owner_user_id, logged_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StudyLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "owner_user_id", nullable = false, updatable = false)
    private Long ownerId;

    /**
     * What was studied, e.g. "Linear Algebra".
     */
    @Column(name = "subject", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String subject;

    /**
     * Length of the session in minutes. Always greater than zero.
     */
    @Column(name = "duration_minutes", nullable = false, updatable = false)
    private Integer durationMinutes;

    @Column(name = "notes", updatable = false, columnDefinition = "TEXT")
    private String notes;

    /**
     * When the session took place. Defaults to "now" but may be back-dated
     * for manual entries.
     */
    @Column(name = "logged_at", nullable = false, updatable = false)
    private LocalDateTime loggedAt;

    public StudyLog(Long ownerId, String subject, Integer durationMinutes, String notes, LocalDateTime loggedAt) {
        this.ownerId = ownerId;
        this.subject = subject;
        this.durationMinutes = durationMinutes;
        this.notes = notes;
        this.loggedAt = loggedAt;
    }
}
