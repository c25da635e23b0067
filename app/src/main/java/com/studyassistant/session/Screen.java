package com.studyassistant.session;

/**
 * Screens of the application; the states of {@link NavigationController}.
 */
public enum Screen {

    LOGGED_OUT("Login", false),
    MAIN_MENU("Main Menu", true),
    TASK_MANAGER("Task Manager", true),
    STUDY_TRACKER("Study Tracker & Pomodoro", true),
    AI_HELPER("AI Study Helper", true),
    AI_QUIZ("AI Quiz", true),
    AI_CHAT("AI Chat", true),
    ANALYTICS("Analytics", true),
    REVIEW_HUB("Review Hub", true),
    SETTINGS("Settings", true);

    private final String title;
    private final boolean requiresSession;

    Screen(String title, boolean requiresSession) {
        this.title = title;
        this.requiresSession = requiresSession;
    }

    public String getTitle() {
        return title;
    }

    public boolean requiresSession() {
        return requiresSession;
    }
}
