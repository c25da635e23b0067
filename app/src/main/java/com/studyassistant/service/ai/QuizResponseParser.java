package com.studyassistant.service.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.studyassistant.dto.response.QuizQuestion;
import com.studyassistant.exception.MalformedQuizResponseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the model's quiz answer into validated {@link QuizQuestion}s.
 *
 * Accepted shapes:
 * <pre>
 * [ {question, choices, correct_index, explanation}, ... ]
 * { "questions": [ ... ] }
 * </pre>
 * optionally wrapped in a markdown code fence. Field name aliases are
 * handled by {@link QuizQuestion}.
 *
 * The whole quiz is rejected if any item is invalid: blank question, not
 * exactly four non-blank choices, an index outside 0..3, or a missing
 * explanation. An empty list is rejected too.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class QuizResponseParser {

    private final ObjectMapper objectMapper;

    /**
     * Parse and validate a quiz response.
     *
     * @param response raw text returned by the model
     * @return the questions, in the order received
     * @throws MalformedQuizResponseException if the text is not a valid quiz
     */
    public List<QuizQuestion> parse(String response) {
        if (response == null || response.trim().isEmpty()) {
            throw new MalformedQuizResponseException("The AI returned an empty quiz.");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFence(response));
        } catch (JsonProcessingException e) {
            log.warn("Quiz response is not valid JSON: {}", e.getOriginalMessage());
            throw new MalformedQuizResponseException("The AI quiz response is not valid JSON.", e);
        }

        JsonNode items = root != null && root.isObject() ? root.get("questions") : root;
        if (items == null || !items.isArray()) {
            throw new MalformedQuizResponseException("The AI quiz response does not contain a list of questions.");
        }
        if (items.isEmpty()) {
            throw new MalformedQuizResponseException("The AI returned a quiz without questions.");
        }

        List<QuizQuestion> questions = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            QuizQuestion question;
            try {
                question = objectMapper.treeToValue(items.get(i), QuizQuestion.class);
            } catch (JsonProcessingException e) {
                throw MalformedQuizResponseException.invalidItem(i, "unexpected structure");
            }
            validate(i, question);
            questions.add(question);
        }

        log.debug("Parsed {} quiz question(s)", questions.size());
        return questions;
    }

    private void validate(int index, QuizQuestion question) {
        if (question == null || isBlank(question.getQuestion())) {
            throw MalformedQuizResponseException.invalidItem(index, "missing question text");
        }
        List<String> choices = question.getChoices();
        if (choices == null || choices.size() != QuizQuestion.CHOICE_COUNT) {
            throw MalformedQuizResponseException.invalidItem(index,
                    String.format("expected %d choices", QuizQuestion.CHOICE_COUNT));
        }
        if (choices.stream().anyMatch(QuizResponseParser::isBlank)) {
            throw MalformedQuizResponseException.invalidItem(index, "blank choice");
        }
        Integer correct = question.getCorrectIndex();
        if (correct == null || correct < 0 || correct >= QuizQuestion.CHOICE_COUNT) {
            throw MalformedQuizResponseException.invalidItem(index, "correct answer index out of range");
        }
        if (isBlank(question.getExplanation())) {
            throw MalformedQuizResponseException.invalidItem(index, "missing explanation");
        }
    }

    /**
     * Remove a surrounding markdown code fence (```json ... ```), if present.
     */
    static String stripCodeFence(String text) {
        String cleaned = text.trim();
        if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
            if (cleaned.regionMatches(true, 0, "json", 0, 4)) {
                cleaned = cleaned.substring(4);
            }
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
