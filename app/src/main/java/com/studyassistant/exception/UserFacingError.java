package com.studyassistant.exception;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * What the front end shows for a failed operation.
 *
 * Produced by {@link GlobalExceptionHandler}; the front end prints
 * {@code title} and {@code message} and, when {@code returnToMainMenu} is set,
 * leaves the current screen.
 */
@Data
@AllArgsConstructor
public class UserFacingError {

    private ErrorCategory category;
    private String title;
    private String message;
    private boolean returnToMainMenu;

    /**
     * Broad error classes, one per row of the error taxonomy.
     */
    public enum ErrorCategory {
        VALIDATION,
        NOT_FOUND,
        AUTHENTICATION,
        MISSING_API_KEY,
        AI_SERVICE,
        STORE,
        UNEXPECTED
    }
}
