package com.studyassistant.ui;

/**
 * Ends the interactive loop: the user chose Exit or the input stream closed.
 */
public class ConsoleExitException extends RuntimeException {

    public ConsoleExitException(String message) {
        super(message);
    }
}
