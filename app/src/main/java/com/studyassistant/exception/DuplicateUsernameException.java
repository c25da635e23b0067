package com.studyassistant.exception;

/**
 * Exception thrown when registering a username that is already taken.
 */
public class DuplicateUsernameException extends RuntimeException {

    private final String username;

    public DuplicateUsernameException(String username) {
        super(String.format("Username '%s' is already taken. Please choose another.", username));
        this.username = username;
    }

    public String getUsername() {
        return username;
    }
}
