package com.studyassistant.ui;

import com.studyassistant.exception.UserFacingError;

/**
 * Leaves the current screen after an error that requires returning to the
 * main menu. The error has already been logged.
 */
public class ScreenAbortedException extends RuntimeException {

    private final transient UserFacingError error;

    public ScreenAbortedException(UserFacingError error, Throwable cause) {
        super(error.getMessage(), cause);
        this.error = error;
    }

    public UserFacingError getError() {
        return error;
    }
}
