package com.studyassistant.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * QuizResult entity for completed AI quizzes.
 *
 * Append-only. Besides the score, the full question set and the answers the
 * user picked are kept as JSON in {@code questions_data} so a past quiz can
 * be reviewed question by question.
 *
 * Database Table: quiz_results
 */
@Entity
@Table(name = "quiz_results")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QuizResult {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "owner_user_id", nullable = false, updatable = false)
    private Long ownerId;

    @Column(name = "topic", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String topic;

    /**
     * Number of correct answers, between 0 and {@link #totalQuestions}.
     */
    @Column(name = "score", nullable = false, updatable = false)
    private Integer score;

    @Column(name = "total_questions", nullable = false, updatable = false)
    private Integer totalQuestions;

    /**
     * JSON array of answered questions (see QuizService).
     */
    @ToString.Exclude
    @Column(name = "questions_data", updatable = false, columnDefinition = "TEXT")
    private String questionsData;

    @Column(name = "taken_at", nullable = false, updatable = false)
    private LocalDateTime takenAt;

    public QuizResult(Long ownerId, String topic, Integer score, Integer totalQuestions,
                      String questionsData, LocalDateTime takenAt) {
        this.ownerId = ownerId;
        this.topic = topic;
        this.score = score;
        this.totalQuestions = totalQuestions;
        this.questionsData = questionsData;
        this.takenAt = takenAt;
    }

    /**
     * Score as a fraction of the total, between 0.0 and 1.0.
     *
     * @return the score ratio
     */
    public double getScoreRatio() {
        return (double) score / totalQuestions;
    }
}
