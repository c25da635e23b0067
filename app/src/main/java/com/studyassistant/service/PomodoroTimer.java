package com.studyassistant.service;

import com.studyassistant.dto.response.PomodoroDurations;
import lombok.extern.slf4j.Slf4j;

/**
 * Pomodoro countdown.
 *
 * Cycles WORK, SHORT_BREAK, WORK, ... with a LONG_BREAK after every fourth
 * completed work phase. Time only advances through {@link #tick(int)} while
 * the timer is running; the caller decides how real time maps to ticks.
 * When a phase runs out the timer moves to the next phase and stops, so
 * each phase is started explicitly.
 *
 * Not thread-safe; driven from the interactive thread.
 */
@Slf4j
public class PomodoroTimer {

    public static final int WORK_PHASES_BEFORE_LONG_BREAK = 4;

    private final PomodoroDurations durations;

    private Phase phase = Phase.WORK;
    private int remainingSeconds;
    private boolean running;
    private int completedWorkPhases;
    private Phase lastFinishedPhase;

    public PomodoroTimer(PomodoroDurations durations) {
        this.durations = durations;
        this.remainingSeconds = secondsFor(Phase.WORK);
    }

    public void start() {
        running = true;
        log.debug("Pomodoro {} started with {}s remaining", phase, remainingSeconds);
    }

    public void pause() {
        running = false;
    }

    public void resume() {
        if (remainingSeconds > 0) {
            running = true;
        }
    }

    /**
     * Stop and return to the start of a work phase. The count of completed
     * work phases is cleared as well.
     */
    public void reset() {
        running = false;
        phase = Phase.WORK;
        remainingSeconds = secondsFor(Phase.WORK);
        completedWorkPhases = 0;
        lastFinishedPhase = null;
    }

    /**
     * Advance the countdown.
     *
     * @param seconds elapsed seconds, not negative
     * @return true if the current phase finished during this tick
     */
    public boolean tick(int seconds) {
        if (seconds < 0) {
            throw new IllegalArgumentException("seconds must not be negative");
        }
        if (!running || seconds == 0) {
            return false;
        }
        remainingSeconds = Math.max(0, remainingSeconds - seconds);
        if (remainingSeconds > 0) {
            return false;
        }

        lastFinishedPhase = phase;
        if (phase == Phase.WORK) {
            completedWorkPhases++;
            phase = completedWorkPhases % WORK_PHASES_BEFORE_LONG_BREAK == 0 ? Phase.LONG_BREAK : Phase.SHORT_BREAK;
        } else {
            phase = Phase.WORK;
        }
        remainingSeconds = secondsFor(phase);
        running = false;
        log.debug("Pomodoro {} finished, next phase {}", lastFinishedPhase, phase);
        return true;
    }

    public Phase getPhase() {
        return phase;
    }

    public int getRemainingSeconds() {
        return remainingSeconds;
    }

    public boolean isRunning() {
        return running;
    }

    public int getCompletedWorkPhases() {
        return completedWorkPhases;
    }

    /**
     * Phase that finished on the most recent tick that returned true.
     */
    public Phase getLastFinishedPhase() {
        return lastFinishedPhase;
    }

    /**
     * Length of the work phase in minutes, the duration logged for a finished work phase.
     */
    public int getWorkMinutes() {
        return durations.getWorkMinutes();
    }

    private int secondsFor(Phase target) {
        switch (target) {
            case SHORT_BREAK:
                return durations.getShortBreakMinutes() * 60;
            case LONG_BREAK:
                return durations.getLongBreakMinutes() * 60;
            case WORK:
            default:
                return durations.getWorkMinutes() * 60;
        }
    }

    public enum Phase {
        WORK("Work"),
        SHORT_BREAK("Short break"),
        LONG_BREAK("Long break");

        private final String label;

        Phase(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }
}
