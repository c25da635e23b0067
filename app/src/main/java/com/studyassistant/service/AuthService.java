package com.studyassistant.service;

import com.studyassistant.entity.User;
import com.studyassistant.exception.DuplicateUsernameException;
import com.studyassistant.exception.InvalidCredentialsException;
import com.studyassistant.exception.ResourceNotFoundException;
import com.studyassistant.exception.ValidationException;
import com.studyassistant.repository.UserRepository;
import com.studyassistant.session.Session;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.regex.Pattern;

/**
 * Service for local accounts: registration, login, password change and
 * account deletion.
 *
 * Passwords are never stored or compared in plaintext. Registration stores
 * a BCrypt hash; login fetches the hash for the username and checks the
 * candidate with {@link PasswordEncoder#matches}. An unknown username and a
 * wrong password fail the same way, so the login form does not reveal which
 * usernames exist.
 *
 * Flow:
 * 1. register(username, password): validate, reject duplicates, store the
 *    hash and seed the default categories
 * 2. authenticate(username, password): return the User or fail with
 *    InvalidCredentialsException
 * 3. changePassword / deleteAccount: require the current password again
 *
 * @see com.studyassistant.config.SecurityConfig
 * @see com.studyassistant.session.NavigationController
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AuthService {

    static final int USERNAME_MIN_LENGTH = 3;
    static final int USERNAME_MAX_LENGTH = 32;
    static final int PASSWORD_MIN_LENGTH = 3;
    private static final Pattern USERNAME_PATTERN = Pattern.compile("[A-Za-z0-9_.-]+");

    private final UserRepository userRepository;
    private final CategoryService categoryService;
    private final PasswordEncoder passwordEncoder;

    /**
     * Create a new account.
     *
     * The username is trimmed and compared exactly (case-sensitive). The
     * default categories are created in the same transaction, so a failed
     * registration leaves nothing behind.
     *
     * @param username the requested username
     * @param password the plaintext password
     * @return the stored user
     * @throws ValidationException if the username or password is not acceptable
     * @throws DuplicateUsernameException if the username is taken
     */
    @Transactional
    public User register(String username, String password) {
        String normalized = validateUsername(username);
        validatePassword(password, "password");

        if (userRepository.existsByUsername(normalized)) {
            log.info("Registration rejected, username already taken: {}", normalized);
            throw new DuplicateUsernameException(normalized);
        }

        User user;
        try {
            user = userRepository.saveAndFlush(new User(normalized, passwordEncoder.encode(password)));
        } catch (DataIntegrityViolationException e) {
            // Unique constraint on users.username
            throw new DuplicateUsernameException(normalized);
        }

        categoryService.seedDefaults(user.getId());
        log.info("Registered user {} (ID: {})", user.getUsername(), user.getId());
        return user;
    }

    /**
     * Check a username/password pair.
     *
     * @param username the username as typed
     * @param password the plaintext password
     * @return the authenticated user
     * @throws InvalidCredentialsException if the user is unknown or the password is wrong
     */
    @Transactional(readOnly = true)
    public User authenticate(String username, String password) {
        if (username == null || username.trim().isEmpty() || password == null || password.isEmpty()) {
            throw InvalidCredentialsException.loginFailed();
        }
        String normalized = username.trim();

        User user = userRepository.findByUsername(normalized)
                .orElseThrow(() -> {
                    log.info("Login failed for unknown username: {}", normalized);
                    return InvalidCredentialsException.loginFailed();
                });

        if (!passwordEncoder.matches(password, user.getPasswordHash())) {
            log.info("Login failed for user {}: wrong password", normalized);
            throw InvalidCredentialsException.loginFailed();
        }

        log.info("User {} authenticated", normalized);
        return user;
    }

    /**
     * Replace the password of the logged-in user.
     *
     * @param session the active session
     * @param currentPassword the password in use now
     * @param newPassword the replacement
     * @throws InvalidCredentialsException if the current password does not match
     */
    @Transactional
    public void changePassword(Session session, String currentPassword, String newPassword) {
        User user = loadAndVerify(session, currentPassword);
        validatePassword(newPassword, "new password");

        user.setPasswordHash(passwordEncoder.encode(newPassword));
        userRepository.save(user);
        log.info("Password changed for user {}", user.getUsername());
    }

    /**
     * Delete the logged-in user and, through the foreign keys, everything
     * they own: categories, tasks, study logs, quiz results, AI content,
     * chat history and settings.
     *
     * @param session the active session
     * @param currentPassword the password in use now
     * @throws InvalidCredentialsException if the password does not match
     */
    @Transactional
    public void deleteAccount(Session session, String currentPassword) {
        User user = loadAndVerify(session, currentPassword);
        userRepository.delete(user);
        log.warn("Deleted account {} (ID: {}) and all of its data", user.getUsername(), user.getId());
    }

    private User loadAndVerify(Session session, String currentPassword) {
        User user = userRepository.findById(session.getUserId())
                .orElseThrow(() -> ResourceNotFoundException.user(session.getUserId()));
        if (currentPassword == null || !passwordEncoder.matches(currentPassword, user.getPasswordHash())) {
            log.info("Current password check failed for user {}", user.getUsername());
            throw InvalidCredentialsException.currentPasswordMismatch();
        }
        return user;
    }

    private String validateUsername(String username) {
        if (username == null || username.trim().isEmpty()) {
            throw ValidationException.blank("username");
        }
        String normalized = username.trim();
        if (normalized.length() < USERNAME_MIN_LENGTH || normalized.length() > USERNAME_MAX_LENGTH
                || !USERNAME_PATTERN.matcher(normalized).matches()) {
            throw ValidationException.invalidFormat("username", normalized,
                    USERNAME_MIN_LENGTH + "-" + USERNAME_MAX_LENGTH + " letters, digits, '_', '.' or '-'");
        }
        return normalized;
    }

    private void validatePassword(String password, String field) {
        if (password == null || password.trim().isEmpty()) {
            throw ValidationException.blank(field);
        }
        if (password.length() < PASSWORD_MIN_LENGTH) {
            throw new ValidationException(field,
                    String.format("Password must be at least %d characters.", PASSWORD_MIN_LENGTH));
        }
    }
}
