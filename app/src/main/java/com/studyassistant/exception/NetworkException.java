package com.studyassistant.exception;

/**
 * Exception thrown when the AI service cannot be reached.
 *
 * Covers DNS/connection failures and request timeouts. The AI screens stay
 * usable so the user can retry.
 *
 * @see com.studyassistant.service.ai.AIGateway
 */
public class NetworkException extends RuntimeException {

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a NetworkException for an unreachable or timed-out endpoint.
     *
     * @param service the service name (e.g., "Gemini")
     * @param cause the underlying I/O failure
     * @return a NetworkException with a formatted message
     */
    public static NetworkException unreachable(String service, Throwable cause) {
        return new NetworkException(
                String.format("Could not reach %s. Check your internet connection and try again.", service),
                cause);
    }
}
