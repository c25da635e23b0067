package com.studyassistant.ui.screen;

import com.studyassistant.dto.response.AnsweredQuestion;
import com.studyassistant.dto.response.QuizReview;
import com.studyassistant.entity.AIContent;
import com.studyassistant.entity.AIContent.ContentKind;
import com.studyassistant.entity.QuizResult;
import com.studyassistant.service.AIContentService;
import com.studyassistant.service.QuizService;
import com.studyassistant.session.Screen;
import com.studyassistant.session.Session;
import com.studyassistant.ui.ConsoleIO;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Saved AI answers and past quizzes.
 */
@Component
@RequiredArgsConstructor
public class ReviewHubScreen implements ScreenHandler {

    private static final DateTimeFormatter WHEN = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final ScreenSupport support;
    private final AIContentService aiContentService;
    private final QuizService quizService;

    @Override
    public Screen screen() {
        return Screen.REVIEW_HUB;
    }

    @Override
    public void show() {
        Session session = support.session();
        while (true) {
            int choice = support.choose(Screen.REVIEW_HUB.getTitle(), List.of(
                    "Saved AI content", "Saved AI content of one kind", "Open saved content",
                    "Delete saved content", "Past quizzes", "Review a quiz"), "Back");
            switch (choice) {
                case 0:
                    support.navigation().back();
                    return;
                case 1:
                    support.attempt(() -> listContent(session, null));
                    break;
                case 2:
                    support.attempt(() -> listContent(session, readKind()));
                    break;
                case 3:
                    support.attempt(() -> openContent(session));
                    break;
                case 4:
                    support.attempt(() -> deleteContent(session));
                    break;
                case 5:
                    support.attempt(() -> listQuizzes(session));
                    break;
                default:
                    support.attempt(() -> reviewQuiz(session));
                    break;
            }
        }
    }

    private ContentKind readKind() {
        ConsoleIO io = support.io();
        ContentKind[] kinds = ContentKind.values();
        for (int i = 0; i < kinds.length; i++) {
            io.printf("  %d) %s%n", i + 1, label(kinds[i]));
        }
        return kinds[io.readInt("Kind", 1, kinds.length) - 1];
    }

    private void listContent(Session session, ContentKind kind) {
        ConsoleIO io = support.io();
        List<AIContent> items = aiContentService.list(session, kind);
        io.header(kind == null ? "Saved AI content" : "Saved " + label(kind).toLowerCase());
        if (items.isEmpty()) {
            io.println("  Nothing saved yet.");
            return;
        }
        for (AIContent item : items) {
            io.printf("  #%d [%s] %s (%s)%n", item.getId(), label(item.getKind()), item.getTitle(),
                    item.getCreatedAt().format(WHEN));
        }
    }

    private void openContent(Session session) {
        ConsoleIO io = support.io();
        AIContent item = aiContentService.get(session, io.readId("Content #"));
        io.header(label(item.getKind()) + ": " + item.getTitle());
        io.println("Prompt:");
        io.println(item.getPrompt());
        io.println();
        io.println(item.getResponseText());
    }

    private void deleteContent(Session session) {
        ConsoleIO io = support.io();
        AIContent item = aiContentService.get(session, io.readId("Content #"));
        if (io.confirm("Delete '" + item.getTitle() + "'?")) {
            aiContentService.delete(session, item.getId());
            io.println("Deleted.");
        }
    }

    private void listQuizzes(Session session) {
        ConsoleIO io = support.io();
        List<QuizResult> results = quizService.list(session, null);
        io.header("Past quizzes");
        if (results.isEmpty()) {
            io.println("  No quizzes taken yet.");
            return;
        }
        for (QuizResult result : results) {
            io.printf("  #%d %s: %d/%d (%s)%n", result.getId(), result.getTopic(), result.getScore(),
                    result.getTotalQuestions(), result.getTakenAt().format(WHEN));
        }
    }

    private void reviewQuiz(Session session) {
        ConsoleIO io = support.io();
        QuizReview review = quizService.review(session, io.readId("Quiz #"));
        QuizResult result = review.getResult();
        io.header(String.format("%s: %d/%d", result.getTopic(), result.getScore(), result.getTotalQuestions()));
        if (review.getAnswers().isEmpty()) {
            io.println("  No question details were stored for this quiz.");
            return;
        }
        int number = 1;
        for (AnsweredQuestion answer : review.getAnswers()) {
            io.printf("%n%d. %s%n", number++, answer.getQuestion().getQuestion());
            List<String> choices = answer.getQuestion().getChoices();
            for (int i = 0; i < choices.size(); i++) {
                String marker = i == answer.getQuestion().getCorrectIndex() ? "*"
                        : Integer.valueOf(i).equals(answer.getChosenIndex()) ? "x" : " ";
                io.printf("  [%s] %s%n", marker, choices.get(i));
            }
            io.println("  " + (answer.isCorrect() ? "Correct. " : "") + answer.getQuestion().getExplanation());
        }
    }

    private static String label(ContentKind kind) {
        switch (kind) {
            case EXPLANATION:
                return "Explanation";
            case SUMMARY:
                return "Summary";
            case QUESTIONS:
                return "Practice questions";
            case CHAT_SNAPSHOT:
            default:
                return "Chat";
        }
    }
}
