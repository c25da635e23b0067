package com.studyassistant.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.io.Serializable;

/**
 * Per-user key/value setting (API key, Pomodoro durations).
 *
 * The primary key is (owner_user_id, setting_key), so writing a key that
 * already exists replaces its value.
 *
 * Database Table: settings
 */
@Entity
@Table(name = "settings")
@IdClass(Setting.SettingId.class)
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Setting {

    public static final String GEMINI_API_KEY = "gemini_api_key";
    public static final String POMODORO_WORK_MINUTES = "pomodoro_work_minutes";
    public static final String POMODORO_BREAK_MINUTES = "pomodoro_break_minutes";
    public static final String POMODORO_LONG_BREAK_MINUTES = "pomodoro_long_break_minutes";

    @Id
    @Column(name = "owner_user_id", nullable = false, updatable = false)
    private Long ownerId;

    @Id
    @Column(name = "setting_key", nullable = false, updatable = false)
    private String key;

    /**
     * Stored as text; typed accessors live in SettingsService.
     */
    @ToString.Exclude
    @Column(name = "setting_value", columnDefinition = "TEXT")
    private String value;

    /**
     * Composite primary key of {@link Setting}.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode
    public static class SettingId implements Serializable {
        private Long ownerId;
        private String key;
    }
}
