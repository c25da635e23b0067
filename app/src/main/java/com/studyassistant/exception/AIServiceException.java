package com.studyassistant.exception;

/**
 * Exception thrown when the AI service answers with an error or with an
 * unusable response.
 *
 * Carries the upstream message (for example the API's "API key not valid"
 * text) so it can be shown to the user.
 *
 * Usage examples:
 * - HTTP 400/401/403 for a rejected API key
 * - HTTP 429 rate limiting, HTTP 5xx outages
 * - A success response with no text in it
 *
 * @see com.studyassistant.service.ai.AIGateway
 */
public class AIServiceException extends RuntimeException {

    private final String errorCode;

    public AIServiceException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Gets the error code for categorization.
     *
     * @return the error code (e.g., "UPSTREAM_ERROR", "EMPTY_RESPONSE")
     */
    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Constructs an AIServiceException for an error reported by the service.
     *
     * @param upstreamMessage the message returned by the service
     * @param cause the client exception
     * @return an AIServiceException with a formatted message
     */
    public static AIServiceException upstream(String upstreamMessage, Throwable cause) {
        return new AIServiceException(
                "UPSTREAM_ERROR",
                String.format("Gemini API error: %s", upstreamMessage),
                cause);
    }

    /**
     * Constructs an AIServiceException for a response without usable text.
     *
     * @return an AIServiceException with a formatted message
     */
    public static AIServiceException emptyResponse() {
        return new AIServiceException(
                "EMPTY_RESPONSE",
                "Gemini returned an empty or malformed response. Please try again.",
                null);
    }
}
