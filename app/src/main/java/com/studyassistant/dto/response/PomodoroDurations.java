package com.studyassistant.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Pomodoro phase lengths in minutes.
 */
@Data
@AllArgsConstructor
public class PomodoroDurations {

    public static final int DEFAULT_WORK = 25;
    public static final int DEFAULT_SHORT_BREAK = 5;
    public static final int DEFAULT_LONG_BREAK = 15;
    public static final int MIN_MINUTES = 1;
    public static final int MAX_MINUTES = 180;

    private int workMinutes;

    private int shortBreakMinutes;

    private int longBreakMinutes;

    public static PomodoroDurations defaults() {
        return new PomodoroDurations(DEFAULT_WORK, DEFAULT_SHORT_BREAK, DEFAULT_LONG_BREAK);
    }
}
