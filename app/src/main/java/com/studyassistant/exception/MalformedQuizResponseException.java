package com.studyassistant.exception;

/**
 * Exception thrown when an AI quiz response cannot be turned into quiz items.
 *
 * Raised instead of showing a half-parsed quiz.
 *
 * @see com.studyassistant.service.ai.QuizResponseParser
 */
public class MalformedQuizResponseException extends RuntimeException {

    public MalformedQuizResponseException(String message) {
        super(message);
    }

    public MalformedQuizResponseException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs the exception for an invalid question.
     *
     * @param index zero-based position of the question in the response
     * @param reason what is wrong with it
     * @return a MalformedQuizResponseException with a formatted message
     */
    public static MalformedQuizResponseException invalidItem(int index, String reason) {
        return new MalformedQuizResponseException(
                String.format("AI quiz question %d is invalid: %s", index + 1, reason));
    }
}
