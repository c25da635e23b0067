package com.studyassistant.repository;

import com.studyassistant.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository interface for User entity operations.
 *
 * Provides lookup by username for login and the uniqueness check used by
 * registration. Spring Data JPA will automatically implement this interface
 * at runtime.
 */
@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    /**
     * Find a user by their username.
     *
     * @param username the exact username
     * @return Optional containing the user if found, empty otherwise
     */
    Optional<User> findByUsername(String username);

    /**
     * Check if a user with the given username exists.
     *
     * @param username the username to check
     * @return true if the username is taken
     */
    boolean existsByUsername(String username);
}
