package com.studyassistant.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.studyassistant.dto.response.AnsweredQuestion;
import com.studyassistant.dto.response.QuizQuestion;
import com.studyassistant.dto.response.QuizReview;
import com.studyassistant.entity.QuizResult;
import com.studyassistant.exception.ResourceNotFoundException;
import com.studyassistant.exception.ValidationException;
import com.studyassistant.repository.QuizResultRepository;
import com.studyassistant.service.ai.AIGateway;
import com.studyassistant.service.ai.AiMode;
import com.studyassistant.service.ai.QuizResponseParser;
import com.studyassistant.session.Session;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.List;

/**
 * Service for AI quizzes: generation, grading and the result history.
 *
 * Processing Flow:
 * 1. generate(): ask the gateway in QUIZ mode, parse the JSON answer into
 *    questions (no database access, runs on the AI executor)
 * 2. The user answers on the quiz screen
 * 3. record(): store score, total and the answered questions as JSON in
 *    {@code quiz_results.questions_data}
 * 4. review(): read a stored result back with its questions
 *
 * Results are append-only.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class QuizService {

    static final int MIN_QUESTIONS = 1;
    static final int MAX_QUESTIONS = 20;
    private static final int TOPIC_MAX_LENGTH = 200;

    private final QuizResultRepository quizResultRepository;
    private final AIGateway aiGateway;
    private final QuizResponseParser quizResponseParser;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Generate a multiple-choice quiz.
     *
     * @param session the active session
     * @param topic the quiz topic
     * @param questionCount number of questions to ask for, 1..20
     * @return validated questions
     * @throws com.studyassistant.exception.MalformedQuizResponseException if the answer is not a usable quiz
     */
    public List<QuizQuestion> generate(Session session, String topic, int questionCount) {
        String normalizedTopic = InputRules.requireText(topic, "topic", TOPIC_MAX_LENGTH);
        InputRules.requireRange(questionCount, "number of questions", MIN_QUESTIONS, MAX_QUESTIONS);

        String prompt = String.format("Create %d multiple-choice questions about: %s", questionCount, normalizedTopic);
        String response = aiGateway.ask(session, prompt, AiMode.QUIZ);
        List<QuizQuestion> questions = quizResponseParser.parse(response);

        log.info("Generated quiz on '{}' with {} question(s) for user {}",
                normalizedTopic, questions.size(), session.getUserId());
        return questions;
    }

    /**
     * Count correct answers.
     */
    public static int grade(List<AnsweredQuestion> answers) {
        return (int) answers.stream().filter(AnsweredQuestion::isCorrect).count();
    }

    /**
     * Store a quiz result.
     *
     * @param session the active session
     * @param topic the quiz topic
     * @param score correct answers, 0..totalQuestions
     * @param totalQuestions number of questions, greater than zero
     * @param answers the questions with the user's choices; may be empty
     * @return the stored result
     * @throws ValidationException if the topic is blank or the score is out of range
     */
    @Transactional
    public QuizResult record(Session session, String topic, Integer score, Integer totalQuestions,
                             List<AnsweredQuestion> answers) {
        String normalizedTopic = InputRules.requireText(topic, "topic", TOPIC_MAX_LENGTH);
        if (totalQuestions == null || totalQuestions <= 0) {
            throw new ValidationException("total questions", "A quiz must have at least one question.");
        }
        InputRules.requireRange(score, "score", 0, totalQuestions);

        QuizResult result = new QuizResult(session.getUserId(), normalizedTopic, score, totalQuestions,
                serialize(answers), LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS));
        QuizResult saved = quizResultRepository.save(result);
        log.info("Recorded quiz '{}' {}/{} for user {}", normalizedTopic, score, totalQuestions, session.getUserId());
        return saved;
    }

    /**
     * List results, newest first.
     *
     * @param limit maximum number of results; null for all
     */
    @Transactional(readOnly = true)
    public List<QuizResult> list(Session session, Integer limit) {
        if (limit == null) {
            return quizResultRepository.findByOwnerIdOrderByTakenAtDesc(session.getUserId());
        }
        return quizResultRepository.findByOwnerIdOrderByTakenAtDesc(session.getUserId(),
                PageRequest.of(0, Math.max(1, limit)));
    }

    /**
     * Load a stored result with its questions and answers.
     */
    @Transactional(readOnly = true)
    public QuizReview review(Session session, Long resultId) {
        QuizResult result = quizResultRepository.findByIdAndOwnerId(resultId, session.getUserId())
                .orElseThrow(() -> ResourceNotFoundException.quizResult(resultId));
        return new QuizReview(result, deserialize(result));
    }

    private String serialize(List<AnsweredQuestion> answers) {
        if (answers == null || answers.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(answers);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Quiz answers could not be serialized", e);
        }
    }

    private List<AnsweredQuestion> deserialize(QuizResult result) {
        String data = result.getQuestionsData();
        if (data == null || data.isBlank()) {
            return Collections.emptyList();
        }
        try {
            return objectMapper.readValue(data, new TypeReference<List<AnsweredQuestion>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Stored questions of quiz result {} are unreadable: {}", result.getId(), e.getOriginalMessage());
            return Collections.emptyList();
        }
    }
}
