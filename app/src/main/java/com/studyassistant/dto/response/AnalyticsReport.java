package com.studyassistant.dto.response;

import com.studyassistant.entity.QuizResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * Snapshot of a user's progress, rendered by the Analytics screen.
 *
 * Fields:
 * - Tasks: total, completed, pending and the completion rate (0..1) over
 *   tasks created in the optional {@code rangeStart}..{@code rangeEnd}
 * - Study: total minutes, number of sessions, streak in days, distinct
 *   study days in the last 7 and 30 days, top subjects by minutes
 * - Quizzes: number taken, average score ratio (0..1), most recent results
 * - Learning points: weighted sum of completed tasks, study minutes and quizzes
 *
 * Task counts for the date range do not affect the points, which are
 * always computed over all tasks.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyticsReport {

    private LocalDate rangeStart;
    private LocalDate rangeEnd;

    private long totalTasks;
    private long completedTasks;
    private long pendingTasks;
    private double completionRate;

    private long totalStudyMinutes;
    private long studySessions;
    private int studyStreakDays;
    private int studyDaysLast7;
    private int studyDaysLast30;
    private List<SubjectTotal> topSubjects;

    private long quizzesTaken;
    private double averageQuizScore;
    private List<QuizResult> recentQuizzes;

    private long learningPoints;

    /**
     * Minutes studied for one subject.
     */
    @Data
    @AllArgsConstructor
    public static class SubjectTotal {
        private String subject;
        private long minutes;
    }
}
