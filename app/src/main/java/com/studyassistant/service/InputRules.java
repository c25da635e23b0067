package com.studyassistant.service;

import com.studyassistant.exception.ValidationException;

/**
 * Shared input checks used by the services before anything is persisted.
 */
final class InputRules {

    private InputRules() {
    }

    /**
     * Trim a required text value.
     *
     * @param value the raw input
     * @param field the field name used in the error message
     * @param maxLength maximum length after trimming
     * @return the trimmed value
     * @throws ValidationException if the value is blank or too long
     */
    static String requireText(String value, String field, int maxLength) {
        if (value == null || value.trim().isEmpty()) {
            throw ValidationException.blank(field);
        }
        String trimmed = value.trim();
        if (trimmed.length() > maxLength) {
            throw ValidationException.tooLong(field, maxLength);
        }
        return trimmed;
    }

    /**
     * Trim an optional text value; blank becomes null.
     */
    static String optionalText(String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return value.trim();
    }

    static int requireRange(Integer value, String field, int min, int max) {
        if (value == null) {
            throw ValidationException.blank(field);
        }
        if (value < min || value > max) {
            throw ValidationException.outOfRange(field, value, min, max);
        }
        return value;
    }
}
