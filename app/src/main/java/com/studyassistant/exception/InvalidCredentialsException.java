package com.studyassistant.exception;

/**
 * Exception thrown when a username/password pair does not match a stored user.
 *
 * The same message is used for an unknown username and a wrong password so
 * the login form does not reveal which usernames exist.
 */
public class InvalidCredentialsException extends RuntimeException {

    public InvalidCredentialsException(String message) {
        super(message);
    }

    /**
     * Constructs the standard login failure.
     *
     * @return an InvalidCredentialsException with the login-form message
     */
    public static InvalidCredentialsException loginFailed() {
        return new InvalidCredentialsException("Invalid username or password.");
    }

    /**
     * Constructs the failure for a wrong current password on a sensitive action
     * (password change, account deletion).
     *
     * @return an InvalidCredentialsException with a formatted message
     */
    public static InvalidCredentialsException currentPasswordMismatch() {
        return new InvalidCredentialsException("Current password is incorrect.");
    }
}
