package com.studyassistant.ui.screen;

import com.studyassistant.entity.StudyLog;
import com.studyassistant.service.PomodoroTimer;
import com.studyassistant.service.PomodoroTimer.Phase;
import com.studyassistant.service.SettingsService;
import com.studyassistant.service.StudyLogService;
import com.studyassistant.session.Screen;
import com.studyassistant.session.Session;
import com.studyassistant.ui.ConsoleIO;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Study logs and the Pomodoro timer.
 *
 * The countdown runs on this thread, one tick per second. While it runs,
 * typing "p" pauses or resumes and "s" stops the timer.
 */
@Component
@RequiredArgsConstructor
public class StudyTrackerScreen implements ScreenHandler {

    private static final int RECENT_LOGS = 10;
    private static final long TICK_MILLIS = 1000;
    private static final DateTimeFormatter WHEN = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final ScreenSupport support;
    private final StudyLogService studyLogService;
    private final SettingsService settingsService;

    @Override
    public Screen screen() {
        return Screen.STUDY_TRACKER;
    }

    @Override
    public void show() {
        Session session = support.session();
        while (true) {
            int choice = support.choose(Screen.STUDY_TRACKER.getTitle(), List.of(
                    "Start Pomodoro", "Log a study session", "Recent sessions", "Delete a session"), "Back");
            switch (choice) {
                case 0:
                    support.navigation().back();
                    return;
                case 1:
                    support.attempt(() -> runPomodoro(session));
                    break;
                case 2:
                    support.attempt(() -> logManually(session));
                    break;
                case 3:
                    support.attempt(() -> printRecent(session));
                    break;
                default:
                    support.attempt(() -> deleteLog(session));
                    break;
            }
        }
    }

    private void logManually(Session session) {
        ConsoleIO io = support.io();
        String subject = io.readLine("Subject");
        int minutes = io.readInt("Minutes", 1, 24 * 60);
        String notes = io.readLine("Notes (optional)");
        studyLogService.log(session, subject, minutes, notes, null);
        io.println("Session logged.");
    }

    private void printRecent(Session session) {
        ConsoleIO io = support.io();
        List<StudyLog> logs = studyLogService.list(session, RECENT_LOGS);
        io.header("Recent study sessions");
        if (logs.isEmpty()) {
            io.println("  Nothing logged yet.");
            return;
        }
        for (StudyLog studyLog : logs) {
            io.printf("  #%d %s  %s, %d min%s%n", studyLog.getId(), studyLog.getLoggedAt().format(WHEN),
                    studyLog.getSubject(), studyLog.getDurationMinutes(),
                    studyLog.getNotes() == null ? "" : " - " + studyLog.getNotes());
        }
    }

    private void deleteLog(Session session) {
        ConsoleIO io = support.io();
        Long logId = io.readId("Session #");
        if (io.confirm("Delete session #" + logId + "?")) {
            studyLogService.delete(session, logId);
            io.println("Session deleted.");
        }
    }

    private void runPomodoro(Session session) {
        ConsoleIO io = support.io();
        PomodoroTimer timer = new PomodoroTimer(settingsService.getPomodoroDurations(session));

        while (true) {
            io.printf("%n%s phase, %s. Commands while running: p = pause/resume, s = stop%n",
                    timer.getPhase().getLabel(), format(timer.getRemainingSeconds()));
            timer.start();
            if (!countDown(timer)) {
                io.println("Pomodoro stopped.");
                return;
            }

            Phase finished = timer.getLastFinishedPhase();
            io.printf("%n%s finished!%n", finished.getLabel());
            if (finished == Phase.WORK && io.confirm("Log " + timer.getWorkMinutes() + " minutes of study?")) {
                support.attempt(() -> {
                    String subject = io.readLine("Subject");
                    studyLogService.log(session, subject, timer.getWorkMinutes(), "Pomodoro session", null);
                    io.println("Session logged.");
                });
            }
            if (!io.confirm("Start " + timer.getPhase().getLabel().toLowerCase() + "?")) {
                return;
            }
        }
    }

    /**
     * Count the running phase down to zero.
     *
     * @return false if the user stopped the timer
     */
    private boolean countDown(PomodoroTimer timer) {
        ConsoleIO io = support.io();
        while (true) {
            if (io.inputAvailable()) {
                String command = io.takePendingLine();
                if (command.equalsIgnoreCase("s")) {
                    timer.reset();
                    return false;
                }
                if (command.equalsIgnoreCase("p")) {
                    if (timer.isRunning()) {
                        timer.pause();
                        io.println("Paused. Type p to resume.");
                    } else {
                        timer.resume();
                    }
                }
            }
            try {
                Thread.sleep(TICK_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                timer.reset();
                return false;
            }
            if (timer.tick(1)) {
                return true;
            }
            if (timer.isRunning()) {
                io.print("\r  " + timer.getPhase().getLabel() + " " + format(timer.getRemainingSeconds()) + "   ");
            }
        }
    }

    private static String format(int seconds) {
        return String.format("%02d:%02d", seconds / 60, seconds % 60);
    }
}
