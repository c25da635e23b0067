package com.studyassistant.exception;

/**
 * Exception thrown when an AI feature is used before a Gemini API key is configured.
 *
 * Raised by the AI gateway before any network activity. The front end uses
 * it to point the user at the Settings screen.
 *
 * @see com.studyassistant.service.ai.AIGateway
 */
public class MissingApiKeyException extends RuntimeException {

    public MissingApiKeyException() {
        super("Gemini API key is not configured. Add it under Settings to enable AI features.");
    }
}
