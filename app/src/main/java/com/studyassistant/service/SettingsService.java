package com.studyassistant.service;

import com.studyassistant.dto.response.PomodoroDurations;
import com.studyassistant.entity.Setting;
import com.studyassistant.exception.ValidationException;
import com.studyassistant.repository.SettingRepository;
import com.studyassistant.session.Session;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Per-user key/value settings: the Gemini API key and Pomodoro durations.
 *
 * Values are upserted. Changing or removing the API key publishes an
 * {@link ApiKeyChangedEvent} so the AI gateway drops any client built with
 * the old key.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SettingsService {

    private final SettingRepository settingRepository;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional(readOnly = true)
    public Optional<String> get(Session session, String key) {
        return read(session.getUserId(), key);
    }

    /**
     * Insert or replace a setting.
     */
    @Transactional
    public void set(Session session, String key, String value) {
        if (key == null || key.trim().isEmpty()) {
            throw ValidationException.blank("setting key");
        }
        Setting setting = settingRepository.findByOwnerIdAndKey(session.getUserId(), key)
                .orElseGet(() -> new Setting(session.getUserId(), key, null));
        setting.setValue(value);
        settingRepository.save(setting);
        log.debug("Setting '{}' updated for user {}", key, session.getUserId());
    }

    /**
     * The stored Gemini API key of a user, if any. Read by the AI gateway.
     *
     * @param userId the owner
     * @return the key, or empty when none is configured
     */
    @Transactional(readOnly = true)
    public Optional<String> findApiKey(Long userId) {
        return read(userId, Setting.GEMINI_API_KEY);
    }

    @Transactional(readOnly = true)
    public boolean hasApiKey(Session session) {
        return findApiKey(session.getUserId()).isPresent();
    }

    @Transactional
    public void setApiKey(Session session, String apiKey) {
        if (apiKey == null || apiKey.trim().isEmpty()) {
            throw ValidationException.blank("API key");
        }
        set(session, Setting.GEMINI_API_KEY, apiKey.trim());
        eventPublisher.publishEvent(new ApiKeyChangedEvent(session.getUserId()));
        log.info("API key updated for user {}", session.getUserId());
    }

    @Transactional
    public void clearApiKey(Session session) {
        settingRepository.findByOwnerIdAndKey(session.getUserId(), Setting.GEMINI_API_KEY)
                .ifPresent(settingRepository::delete);
        eventPublisher.publishEvent(new ApiKeyChangedEvent(session.getUserId()));
        log.info("API key removed for user {}", session.getUserId());
    }

    /**
     * Pomodoro durations, falling back to the defaults for missing or
     * unusable stored values.
     */
    @Transactional(readOnly = true)
    public PomodoroDurations getPomodoroDurations(Session session) {
        Long userId = session.getUserId();
        return new PomodoroDurations(
                readMinutes(userId, Setting.POMODORO_WORK_MINUTES, PomodoroDurations.DEFAULT_WORK),
                readMinutes(userId, Setting.POMODORO_BREAK_MINUTES, PomodoroDurations.DEFAULT_SHORT_BREAK),
                readMinutes(userId, Setting.POMODORO_LONG_BREAK_MINUTES, PomodoroDurations.DEFAULT_LONG_BREAK));
    }

    /**
     * Store new Pomodoro durations; each must be within 1..180 minutes.
     */
    @Transactional
    public PomodoroDurations setPomodoroDurations(Session session, PomodoroDurations durations) {
        int work = InputRules.requireRange(durations.getWorkMinutes(), "work minutes",
                PomodoroDurations.MIN_MINUTES, PomodoroDurations.MAX_MINUTES);
        int shortBreak = InputRules.requireRange(durations.getShortBreakMinutes(), "break minutes",
                PomodoroDurations.MIN_MINUTES, PomodoroDurations.MAX_MINUTES);
        int longBreak = InputRules.requireRange(durations.getLongBreakMinutes(), "long break minutes",
                PomodoroDurations.MIN_MINUTES, PomodoroDurations.MAX_MINUTES);

        set(session, Setting.POMODORO_WORK_MINUTES, String.valueOf(work));
        set(session, Setting.POMODORO_BREAK_MINUTES, String.valueOf(shortBreak));
        set(session, Setting.POMODORO_LONG_BREAK_MINUTES, String.valueOf(longBreak));
        log.info("Pomodoro durations set to {}/{}/{} for user {}", work, shortBreak, longBreak, session.getUserId());
        return new PomodoroDurations(work, shortBreak, longBreak);
    }

    private Optional<String> read(Long userId, String key) {
        return settingRepository.findByOwnerIdAndKey(userId, key)
                .map(Setting::getValue)
                .filter(value -> !value.trim().isEmpty());
    }

    private int readMinutes(Long userId, String key, int defaultValue) {
        Optional<String> stored = read(userId, key);
        if (stored.isEmpty()) {
            return defaultValue;
        }
        try {
            int minutes = Integer.parseInt(stored.get().trim());
            if (minutes >= PomodoroDurations.MIN_MINUTES && minutes <= PomodoroDurations.MAX_MINUTES) {
                return minutes;
            }
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric value for setting '{}' of user {}", key, userId);
            return defaultValue;
        }
        log.warn("Ignoring out-of-range value for setting '{}' of user {}", key, userId);
        return defaultValue;
    }

    /**
     * Published when a user's API key is set or removed.
     */
    public static class ApiKeyChangedEvent {

        private final Long userId;

        public ApiKeyChangedEvent(Long userId) {
            this.userId = userId;
        }

        public Long getUserId() {
            return userId;
        }
    }
}
