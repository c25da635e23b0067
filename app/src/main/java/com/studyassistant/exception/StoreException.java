package com.studyassistant.exception;

/**
 * Exception thrown when the local database or a database file cannot be used.
 *
 * Fatal to the current operation but never to the application: the front
 * end shows the error and returns to the main menu.
 *
 * Usage examples:
 * - SQLite I/O failure or locked database
 * - Backup target not writable
 * - Restore source that is not a valid assistant database
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a StoreException for a failed backup export.
     *
     * @param target the backup destination
     * @param cause the I/O failure
     * @return a StoreException with a formatted message
     */
    public static StoreException backupFailed(String target, Throwable cause) {
        return new StoreException(String.format("Backup to '%s' failed: %s", target, cause.getMessage()), cause);
    }

    /**
     * Constructs a StoreException for a restore source that fails validation.
     *
     * @param source the file the user picked
     * @param reason why it was rejected
     * @return a StoreException with a formatted message
     */
    public static StoreException invalidBackup(String source, String reason) {
        return new StoreException(
                String.format("'%s' is not a valid study assistant backup: %s. Current data was left unchanged.",
                        source, reason));
    }

    /**
     * Constructs a StoreException for a restore that failed while copying.
     *
     * @param source the file being restored
     * @param cause the failure
     * @return a StoreException with a formatted message
     */
    public static StoreException restoreFailed(String source, Throwable cause) {
        return new StoreException(String.format("Restore from '%s' failed: %s", source, cause.getMessage()), cause);
    }
}
