package com.studyassistant.ui.screen;

import com.studyassistant.dto.response.TaskReminders;
import com.studyassistant.entity.Task;
import com.studyassistant.service.AnalyticsService;
import com.studyassistant.service.TaskService;
import com.studyassistant.session.NavigationController;
import com.studyassistant.session.Screen;
import com.studyassistant.session.Session;
import com.studyassistant.ui.ConsoleExitException;
import com.studyassistant.ui.ConsoleIO;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Hub listing every feature screen, the reminder check and logout.
 */
@Component
@RequiredArgsConstructor
public class MainMenuScreen implements ScreenHandler {

    private static final List<Screen> FEATURES = List.of(
            Screen.TASK_MANAGER, Screen.STUDY_TRACKER, Screen.AI_HELPER, Screen.AI_QUIZ,
            Screen.AI_CHAT, Screen.ANALYTICS, Screen.REVIEW_HUB, Screen.SETTINGS);
    private static final int REMINDERS_SHOWN = 3;

    private final ScreenSupport support;
    private final AnalyticsService analyticsService;
    private final TaskService taskService;

    @Override
    public Screen screen() {
        return Screen.MAIN_MENU;
    }

    @Override
    public void show() {
        ConsoleIO io = support.io();
        NavigationController navigation = support.navigation();
        Session session = support.session();

        support.attempt(() -> {
            int streak = analyticsService.studyStreak(session);
            io.printf("%nHello, %s. Study streak: %d day%s.%n", session.getUsername(), streak, streak == 1 ? "" : "s");
        });

        List<String> labels = FEATURES.stream().map(Screen::getTitle).collect(Collectors.toCollection(ArrayList::new));
        labels.add("Check reminders");
        labels.add("Logout");

        int choice = support.choose(Screen.MAIN_MENU.getTitle(), labels, "Exit");
        if (choice == 0) {
            throw new ConsoleExitException("Exit chosen on the main menu");
        }
        if (choice == labels.size() - 1) {
            support.attempt(() -> reminderLines(taskService.reminders(session)).forEach(io::println));
            return;
        }
        if (choice == labels.size()) {
            navigation.logout();
            io.println("Logged out.");
            return;
        }
        navigation.open(FEATURES.get(choice - 1));
    }

    static List<String> reminderLines(TaskReminders reminders) {
        List<String> lines = new ArrayList<>();
        if (reminders.isEmpty()) {
            lines.add("No urgent tasks.");
            return lines;
        }
        if (!reminders.getDueToday().isEmpty()) {
            lines.add("Tasks due TODAY:");
            appendTasks(lines, reminders.getDueToday(), task -> "- " + task.getTitle() + " (" + task.getCategoryName() + ")");
        }
        if (!reminders.getOverdue().isEmpty()) {
            if (!lines.isEmpty()) {
                lines.add("");
            }
            lines.add("OVERDUE tasks:");
            appendTasks(lines, reminders.getOverdue(), task -> "- " + task.getTitle() + " (due " + task.getDueDate() + ")");
        }
        return lines;
    }

    private static void appendTasks(List<String> lines, List<Task> tasks, Function<Task, String> format) {
        tasks.stream().limit(REMINDERS_SHOWN).map(format).forEach(lines::add);
        if (tasks.size() > REMINDERS_SHOWN) {
            lines.add(String.format("...and %d more.", tasks.size() - REMINDERS_SHOWN));
        }
    }
}
