package com.studyassistant.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * AIContent entity for the archive of saved AI responses.
 *
 * Append-only. The user decides which responses (explanations, summaries,
 * practice questions, chat snapshots) are worth keeping; they are browsed
 * in the Review Hub.
 *
 * Database Table: ai_content
 */
@Entity
@Table(name = "ai_content")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AIContent {

    /**
     * Primary key, assigned by SQLite on insert.
     */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "owner_user_id", nullable = false, updatable = false)
    private Long ownerId;

    /**
     * What kind of response this is.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, updatable = false, length = 20)
    private ContentKind kind;

    /**
     * Short label for listings, derived from the prompt when not given.
     */
    @Column(name = "title", updatable = false, columnDefinition = "TEXT")
    private String title;

    /**
     * The user's input that produced the response.
     */
    @ToString.Exclude
    @Column(name = "prompt", updatable = false, columnDefinition = "TEXT")
    private String prompt;

    /**
     * The AI response text as displayed to the user.
     */
    @ToString.Exclude
    @Column(name = "response_text", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String responseText;

    /**
     * Timestamp of when the content was archived.
     * Automatically set by Hibernate on entity creation.
     */
    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public AIContent(Long ownerId, ContentKind kind, String title, String prompt, String responseText) {
        this.ownerId = ownerId;
        this.kind = kind;
        this.title = title;
        this.prompt = prompt;
        this.responseText = responseText;
    }

    /**
     * Kinds of archived AI content.
     */
    public enum ContentKind {
        EXPLANATION,
        SUMMARY,
        QUESTIONS,
        CHAT_SNAPSHOT
    }
}
