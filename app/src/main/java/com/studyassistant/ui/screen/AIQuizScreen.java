package com.studyassistant.ui.screen;

import com.studyassistant.dto.response.AnsweredQuestion;
import com.studyassistant.dto.response.QuizQuestion;
import com.studyassistant.entity.QuizResult;
import com.studyassistant.service.QuizService;
import com.studyassistant.session.Screen;
import com.studyassistant.session.Session;
import com.studyassistant.ui.AsyncAiCall;
import com.studyassistant.ui.ConsoleIO;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Generate a multiple-choice quiz, take it, and store the result.
 */
@Component
@RequiredArgsConstructor
public class AIQuizScreen implements ScreenHandler {

    private static final int DEFAULT_QUESTIONS = 5;
    private static final char[] LETTERS = {'A', 'B', 'C', 'D'};

    private final ScreenSupport support;
    private final QuizService quizService;
    private final AsyncAiCall asyncAiCall;

    @Override
    public Screen screen() {
        return Screen.AI_QUIZ;
    }

    @Override
    public void show() {
        Session session = support.session();
        while (true) {
            int choice = support.choose(Screen.AI_QUIZ.getTitle(), List.of("New quiz"), "Back");
            if (choice == 0) {
                support.navigation().back();
                return;
            }
            support.attempt(() -> runQuiz(session));
        }
    }

    private void runQuiz(Session session) {
        ConsoleIO io = support.io();
        String topic = io.readLine("Quiz topic");
        int count = io.readIntOrDefault("Number of questions", DEFAULT_QUESTIONS);

        Optional<List<QuizQuestion>> generated = asyncAiCall.await("Generating quiz",
                () -> quizService.generate(session, topic, count));
        if (generated.isEmpty()) {
            return;
        }

        List<QuizQuestion> questions = generated.get();
        List<AnsweredQuestion> answers = new ArrayList<>(questions.size());
        for (int i = 0; i < questions.size(); i++) {
            QuizQuestion question = questions.get(i);
            io.printf("%nQuestion %d of %d: %s%n", i + 1, questions.size(), question.getQuestion());
            for (int c = 0; c < question.getChoices().size(); c++) {
                io.printf("  %c) %s%n", LETTERS[c], question.getChoices().get(c));
            }
            Integer chosen = readAnswer(io);
            AnsweredQuestion answered = new AnsweredQuestion(question, chosen);
            answers.add(answered);

            if (answered.isCorrect()) {
                io.println("Correct!");
            } else {
                io.printf("Not quite. The answer is %c.%n", LETTERS[question.getCorrectIndex()]);
            }
            io.println(question.getExplanation());
        }

        int score = QuizService.grade(answers);
        QuizResult result = quizService.record(session, topic, score, questions.size(), answers);
        io.printf("%nYou scored %d/%d (%.0f%%).%n", score, questions.size(), result.getScoreRatio() * 100);
    }

    /**
     * Read A-D; an empty line skips the question.
     */
    private Integer readAnswer(ConsoleIO io) {
        while (true) {
            String raw = io.readLine("Your answer (A-D, empty to skip)").toUpperCase();
            if (raw.isEmpty()) {
                return null;
            }
            if (raw.length() == 1 && raw.charAt(0) >= 'A' && raw.charAt(0) <= 'D') {
                return raw.charAt(0) - 'A';
            }
            io.println("Please answer with A, B, C or D.");
        }
    }
}
