package com.studyassistant.ui.screen;

import com.studyassistant.dto.response.AnalyticsReport;
import com.studyassistant.dto.response.AnalyticsReport.SubjectTotal;
import com.studyassistant.entity.QuizResult;
import com.studyassistant.service.AnalyticsService;
import com.studyassistant.session.Screen;
import com.studyassistant.session.Session;
import com.studyassistant.ui.ConsoleIO;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * Progress report.
 */
@Component
@RequiredArgsConstructor
public class AnalyticsScreen implements ScreenHandler {

    private final ScreenSupport support;
    private final AnalyticsService analyticsService;

    @Override
    public Screen screen() {
        return Screen.ANALYTICS;
    }

    @Override
    public void show() {
        Session session = support.session();
        support.attempt(() -> print(analyticsService.report(session)));

        while (true) {
            int choice = support.choose(Screen.ANALYTICS.getTitle(),
                    List.of("Refresh", "Task completion for a date range"), "Back");
            switch (choice) {
                case 0:
                    support.navigation().back();
                    return;
                case 1:
                    support.attempt(() -> print(analyticsService.report(session)));
                    break;
                default:
                    support.attempt(() -> {
                        ConsoleIO io = support.io();
                        LocalDate start = io.readOptionalDate("From");
                        LocalDate end = io.readOptionalDate("To");
                        print(analyticsService.report(session, start, end));
                    });
                    break;
            }
        }
    }

    private void print(AnalyticsReport report) {
        ConsoleIO io = support.io();
        io.header("Your progress");

        String range = report.getRangeStart() == null
                ? "all tasks"
                : "tasks created " + report.getRangeStart() + " to " + report.getRangeEnd();
        io.printf("Tasks (%s): %d total, %d completed, %d pending, %.0f%% done%n",
                range, report.getTotalTasks(), report.getCompletedTasks(), report.getPendingTasks(),
                report.getCompletionRate() * 100);

        io.printf("Study: %d minutes over %d session(s)%n", report.getTotalStudyMinutes(), report.getStudySessions());
        io.printf("Streak: %d day(s); studied on %d of the last 7 days and %d of the last 30%n",
                report.getStudyStreakDays(), report.getStudyDaysLast7(), report.getStudyDaysLast30());
        if (!report.getTopSubjects().isEmpty()) {
            io.println("Top subjects:");
            for (SubjectTotal subject : report.getTopSubjects()) {
                io.printf("  %s: %d min%n", subject.getSubject(), subject.getMinutes());
            }
        }

        io.printf("Quizzes: %d taken, average score %.0f%%%n",
                report.getQuizzesTaken(), report.getAverageQuizScore() * 100);
        for (QuizResult quiz : report.getRecentQuizzes()) {
            io.printf("  %s: %d/%d on %s%n", quiz.getTopic(), quiz.getScore(), quiz.getTotalQuestions(),
                    quiz.getTakenAt().toLocalDate());
        }

        io.printf("Learning points: %d%n", report.getLearningPoints());
    }
}
