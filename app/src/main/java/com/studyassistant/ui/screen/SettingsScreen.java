package com.studyassistant.ui.screen;

import com.studyassistant.dto.response.PomodoroDurations;
import com.studyassistant.entity.Category;
import com.studyassistant.exception.ValidationException;
import com.studyassistant.service.AuthService;
import com.studyassistant.service.BackupService;
import com.studyassistant.service.CategoryService;
import com.studyassistant.service.SettingsService;
import com.studyassistant.service.ai.AIGateway;
import com.studyassistant.session.Screen;
import com.studyassistant.session.Session;
import com.studyassistant.ui.ConsoleIO;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * API key, Pomodoro durations, categories, account and backups.
 *
 * Restoring a backup or deleting the account ends the session.
 */
@Component
@RequiredArgsConstructor
public class SettingsScreen implements ScreenHandler {

    private final ScreenSupport support;
    private final SettingsService settingsService;
    private final CategoryService categoryService;
    private final AuthService authService;
    private final BackupService backupService;
    private final AIGateway aiGateway;

    @Override
    public Screen screen() {
        return Screen.SETTINGS;
    }

    @Override
    public void show() {
        Session session = support.session();
        while (support.navigation().getCurrentScreen() == Screen.SETTINGS) {
            int choice = support.choose(Screen.SETTINGS.getTitle(), List.of(
                    "Gemini API key", "Pomodoro durations", "Categories", "Change password",
                    "Export backup", "Restore backup", "Delete account"), "Back");
            switch (choice) {
                case 0:
                    support.navigation().back();
                    return;
                case 1:
                    support.attempt(() -> editApiKey(session));
                    break;
                case 2:
                    support.attempt(() -> editPomodoro(session));
                    break;
                case 3:
                    manageCategories(session);
                    break;
                case 4:
                    support.attempt(() -> changePassword(session));
                    break;
                case 5:
                    support.attempt(this::exportBackup);
                    break;
                case 6:
                    support.attempt(this::restoreBackup);
                    break;
                default:
                    support.attempt(() -> deleteAccount(session));
                    break;
            }
        }
    }

    private void editApiKey(Session session) {
        ConsoleIO io = support.io();
        io.println(settingsService.hasApiKey(session)
                ? "An API key is configured."
                : "No API key configured. AI features are disabled.");
        String key = io.readSecret("New API key (empty to keep, - to remove)");
        if (key.trim().isEmpty()) {
            return;
        }
        if (key.trim().equals("-")) {
            settingsService.clearApiKey(session);
            io.println("API key removed.");
        } else {
            settingsService.setApiKey(session, key);
            io.println("API key saved.");
        }
    }

    private void editPomodoro(Session session) {
        ConsoleIO io = support.io();
        PomodoroDurations current = settingsService.getPomodoroDurations(session);
        PomodoroDurations updated = new PomodoroDurations(
                io.readIntOrDefault("Work minutes", current.getWorkMinutes()),
                io.readIntOrDefault("Short break minutes", current.getShortBreakMinutes()),
                io.readIntOrDefault("Long break minutes", current.getLongBreakMinutes()));
        settingsService.setPomodoroDurations(session, updated);
        io.println("Pomodoro durations saved.");
    }

    private void manageCategories(Session session) {
        ConsoleIO io = support.io();
        while (true) {
            support.attempt(() -> {
                io.header("Categories");
                for (Category category : categoryService.list(session)) {
                    io.printf("  #%d %s%n", category.getId(), category.getName());
                }
            });
            int choice = support.choose("Categories", List.of("Add", "Rename", "Delete"), "Back");
            switch (choice) {
                case 0:
                    return;
                case 1:
                    support.attempt(() -> {
                        Category created = categoryService.create(session, io.readLine("Name"));
                        io.println("Added '" + created.getName() + "'.");
                    });
                    break;
                case 2:
                    support.attempt(() -> {
                        Long id = io.readId("Category #");
                        Category renamed = categoryService.rename(session, id, io.readLine("New name"));
                        io.println("Renamed to '" + renamed.getName() + "'.");
                    });
                    break;
                default:
                    support.attempt(() -> {
                        Category category = categoryService.get(session, io.readId("Category #"));
                        if (io.confirm("Delete '" + category.getName() + "'? Its tasks become "
                                + Category.UNCATEGORIZED + ".")) {
                            int moved = categoryService.delete(session, category.getId());
                            io.println("Deleted. " + moved + " task(s) moved to " + Category.UNCATEGORIZED + ".");
                        }
                    });
                    break;
            }
        }
    }

    private void changePassword(Session session) {
        ConsoleIO io = support.io();
        String current = io.readSecret("Current password");
        String replacement = io.readSecret("New password");
        if (!replacement.equals(io.readSecret("Repeat the new password"))) {
            io.println("The passwords do not match.");
            return;
        }
        authService.changePassword(session, current, replacement);
        io.println("Password changed.");
    }

    private void exportBackup() {
        ConsoleIO io = support.io();
        Path written = backupService.exportTo(readPath("Backup file"));
        io.println("Backup written to " + written);
    }

    private void restoreBackup() {
        ConsoleIO io = support.io();
        Path source = readPath("Backup file to restore");
        if (!io.confirm("All current data will be replaced and you will be logged out. Continue?")) {
            return;
        }
        backupService.restoreFrom(source);
        aiGateway.evictAll();
        support.navigation().logout();
        io.println("Backup restored. Please log in again.");
    }

    private void deleteAccount(Session session) {
        ConsoleIO io = support.io();
        if (!io.confirm("Delete your account and ALL of your data? This cannot be undone.")) {
            return;
        }
        authService.deleteAccount(session, io.readSecret("Password"));
        support.navigation().logout();
        io.println("Account deleted.");
    }

    private Path readPath(String prompt) {
        String raw = support.io().readLine(prompt);
        if (raw.isEmpty()) {
            throw ValidationException.blank("file path");
        }
        try {
            return Paths.get(raw);
        } catch (InvalidPathException e) {
            throw ValidationException.invalidFormat("file path", raw, "a valid file path");
        }
    }
}
