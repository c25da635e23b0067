package com.studyassistant.exception;

/**
 * Exception thrown when user input fails validation before persistence.
 *
 * Recoverable: the screen shows the message inline and the user stays on
 * the same screen to correct the input.
 *
 * Usage examples:
 * - Blank task title, study subject, quiz topic or category name
 * - Study duration of zero or less
 * - Quiz score greater than the number of questions
 * - Malformed date or number typed into a form
 *
 * @see com.studyassistant.exception.GlobalExceptionHandler
 */
public class ValidationException extends RuntimeException {

    private final String field;

    /**
     * Constructs a new ValidationException with the specified detail message.
     *
     * @param message the detail message
     */
    public ValidationException(String message) {
        super(message);
        this.field = null;
    }

    /**
     * Constructs a new ValidationException for a specific input field.
     *
     * @param field the name of the offending field
     * @param message the detail message
     */
    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    /**
     * Gets the name of the field that failed validation.
     *
     * @return the field name, or null if not specified
     */
    public String getField() {
        return field;
    }

    /**
     * Constructs a ValidationException for a required text field left blank.
     *
     * @param field the field name (e.g., "title", "subject")
     * @return a ValidationException with a formatted message
     */
    public static ValidationException blank(String field) {
        return new ValidationException(field, String.format("%s cannot be empty.", capitalize(field)));
    }

    /**
     * Constructs a ValidationException for text longer than allowed.
     *
     * @param field the field name
     * @param maxLength maximum number of characters
     * @return a ValidationException with a formatted message
     */
    public static ValidationException tooLong(String field, int maxLength) {
        return new ValidationException(field,
                String.format("%s must be at most %d characters.", capitalize(field), maxLength));
    }

    /**
     * Constructs a ValidationException for a number outside its allowed range.
     *
     * @param field the field name
     * @param value the rejected value
     * @param min inclusive minimum
     * @param max inclusive maximum
     * @return a ValidationException with a formatted message
     */
    public static ValidationException outOfRange(String field, long value, long min, long max) {
        return new ValidationException(field,
                String.format("%s must be between %d and %d (was %d).", capitalize(field), min, max, value));
    }

    /**
     * Constructs a ValidationException for a value that could not be parsed.
     *
     * @param field the field name
     * @param input the raw input
     * @param expected description of the expected format
     * @return a ValidationException with a formatted message
     */
    public static ValidationException invalidFormat(String field, String input, String expected) {
        return new ValidationException(field,
                String.format("'%s' is not a valid %s. Expected %s.", input, field, expected));
    }

    private static String capitalize(String field) {
        if (field == null || field.isEmpty()) {
            return "Value";
        }
        return Character.toUpperCase(field.charAt(0)) + field.substring(1);
    }
}
