package com.studyassistant;

import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

/**
 * Main entry point for the AI Study Assistant.
 *
 * A single-user desktop application for students, featuring:
 * - Local accounts with BCrypt-hashed passwords
 * - Tasks with categories and due dates
 * - Study logs and a Pomodoro timer
 * - Gemini-backed explanations, summaries, quizzes and chat
 * - Analytics with study streak and learning points
 * - A review hub for saved AI content and past quizzes
 * - Backup and restore of the local SQLite database
 *
 * The application runs in the terminal, not as a web server; the
 * interactive loop is started by {@link com.studyassistant.ui.ConsoleRunner}.
 *
 * @version 1.4.0
 */
@SpringBootApplication
public class StudyAssistantApplication {

    public static void main(String[] args) {
        new SpringApplicationBuilder(StudyAssistantApplication.class)
                .web(WebApplicationType.NONE)
                .run(args);
    }
}
