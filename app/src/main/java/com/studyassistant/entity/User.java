package com.studyassistant.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * User entity for local username/password authentication.
 *
 * Represents the people who share one installation of the assistant. Every
 * other table is owned by a user and is removed with it (ON DELETE CASCADE).
 *
 * Database Table: users
 */
@Entity
@Table(name = "users")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class User {

    /**
     * Primary key, assigned by SQLite on insert.
     */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    /**
     * Login name. Unique across the installation.
     */
    @Column(name = "username", nullable = false, unique = true)
    private String username;

    /**
     * BCrypt hash of the password (salt embedded in the hash string).
     * The plaintext password is never stored.
     */
    @ToString.Exclude
    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    /**
     * Timestamp of when the user registered.
     * Automatically set by Hibernate on entity creation.
     */
    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    /**
     * Constructor for registering a new user.
     *
     * @param username the login name
     * @param passwordHash the already-hashed password
     */
    public User(String username, String passwordHash) {
        this.username = username;
        this.passwordHash = passwordHash;
    }
}
