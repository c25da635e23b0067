package com.studyassistant.exception;

import com.studyassistant.exception.UserFacingError.ErrorCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

/**
 * Central translation of exceptions into messages for the user.
 *
 * Every screen routes its failures through {@link #handle(Throwable)} so the
 * same exception always produces the same message, severity and navigation
 * outcome. Each failure is logged here once; nothing is swallowed.
 *
 * <p>Handled Exception Categories:
 * <ul>
 *   <li>Validation errors: shown inline, user stays on the screen</li>
 *   <li>Not found errors: logged as data errors, generic message</li>
 *   <li>Authentication errors: invalid credentials, duplicate username</li>
 *   <li>Missing API key: points the user to Settings</li>
 *   <li>AI errors: network, upstream and malformed quiz responses; the AI
 *       screen stays usable for a retry</li>
 *   <li>Store errors: database and backup file failures; back to the main menu</li>
 *   <li>Anything else: logged with stack trace, generic message, back to the main menu</li>
 * </ul>
 */
@Component
@Slf4j
public class GlobalExceptionHandler {

    private static final String GENERIC_MESSAGE =
            "Something went wrong. The details were written to the application log.";

    /**
     * Map an exception to the error shown to the user.
     *
     * @param ex the failure raised by a service or screen
     * @return the user-facing error
     */
    public UserFacingError handle(Throwable ex) {
        if (ex instanceof ValidationException) {
            log.debug("Validation failed: {}", ex.getMessage());
            return error(ErrorCategory.VALIDATION, "Invalid input", ex.getMessage(), false);
        }
        if (ex instanceof InvalidCredentialsException) {
            log.info("Authentication failed: {}", ex.getMessage());
            return error(ErrorCategory.AUTHENTICATION, "Login failed", ex.getMessage(), false);
        }
        if (ex instanceof DuplicateUsernameException) {
            log.info("Registration rejected: {}", ex.getMessage());
            return error(ErrorCategory.AUTHENTICATION, "Registration failed", ex.getMessage(), false);
        }
        if (ex instanceof ResourceNotFoundException) {
            log.warn("Referenced entity missing: {}", ex.getMessage());
            return error(ErrorCategory.NOT_FOUND, "Not found",
                    "The selected item no longer exists. Refresh the list and try again.", false);
        }
        if (ex instanceof MissingApiKeyException) {
            log.info("AI feature used without an API key");
            return error(ErrorCategory.MISSING_API_KEY, "API key required", ex.getMessage(), false);
        }
        if (ex instanceof NetworkException) {
            log.warn("AI request failed on the network: {}", ex.getMessage(), ex.getCause());
            return error(ErrorCategory.AI_SERVICE, "Network error", ex.getMessage(), false);
        }
        if (ex instanceof AIServiceException) {
            log.warn("AI service error: {}", ex.getMessage());
            return error(ErrorCategory.AI_SERVICE, "AI service error", ex.getMessage(), false);
        }
        if (ex instanceof MalformedQuizResponseException) {
            log.warn("AI quiz response rejected: {}", ex.getMessage());
            return error(ErrorCategory.AI_SERVICE, "Quiz generation failed",
                    ex.getMessage() + " Try generating the quiz again.", false);
        }
        if (ex instanceof StoreException) {
            log.error("Store operation failed: {}", ex.getMessage(), ex);
            return error(ErrorCategory.STORE, "Storage error", ex.getMessage(), true);
        }
        if (ex instanceof DataAccessException || ex instanceof TransactionException) {
            log.error("Database access failed: {}", ex.getMessage(), ex);
            return error(ErrorCategory.STORE, "Storage error",
                    "The local database could not complete the operation. No changes were saved.", true);
        }

        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return error(ErrorCategory.UNEXPECTED, "Unexpected error", GENERIC_MESSAGE, true);
    }

    private UserFacingError error(ErrorCategory category, String title, String message, boolean returnToMainMenu) {
        return new UserFacingError(category, title, message, returnToMainMenu);
    }
}
