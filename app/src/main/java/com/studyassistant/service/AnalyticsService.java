package com.studyassistant.service;

import com.studyassistant.dto.response.AnalyticsReport;
import com.studyassistant.dto.response.AnalyticsReport.SubjectTotal;
import com.studyassistant.entity.Task.TaskStatus;
import com.studyassistant.exception.ValidationException;
import com.studyassistant.repository.QuizResultRepository;
import com.studyassistant.repository.StudyLogRepository;
import com.studyassistant.repository.TaskRepository;
import com.studyassistant.session.Session;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only progress statistics for the Analytics screen.
 *
 * Metrics:
 * - Task completion rate: completed / total, optionally over tasks created
 *   in a date range; 0 when there are no tasks
 * - Study time: total minutes and number of sessions
 * - Quizzes: count and mean of score/total
 * - Study streak: consecutive days with at least one log, ending today, or
 *   yesterday when nothing has been logged today yet
 * - Consistency: distinct study days in the last 7 and 30 days
 * - Top subjects by minutes and the most recent quizzes
 * - Learning points: completed tasks, study minutes and quizzes taken,
 *   weighted by {@code app.analytics.points.*}
 *
 * Dates are calendar days in the clock's zone.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AnalyticsService {

    private static final int TOP_SUBJECTS = 3;
    private static final int RECENT_QUIZZES = 3;

    private final TaskRepository taskRepository;
    private final StudyLogRepository studyLogRepository;
    private final QuizResultRepository quizResultRepository;
    private final Clock clock;

    @Value("${app.analytics.points.task-completed:10}")
    private long pointsPerCompletedTask;

    @Value("${app.analytics.points.study-minute:1}")
    private long pointsPerStudyMinute;

    @Value("${app.analytics.points.quiz-taken:5}")
    private long pointsPerQuiz;

    /**
     * Build the report over all tasks.
     */
    @Transactional(readOnly = true)
    public AnalyticsReport report(Session session) {
        return report(session, null, null);
    }

    /**
     * Build the report; task counts are limited to tasks created from
     * {@code rangeStart} to {@code rangeEnd}, both inclusive, when both are given.
     *
     * @throws ValidationException if only one bound is given or the range is reversed
     */
    @Transactional(readOnly = true)
    public AnalyticsReport report(Session session, LocalDate rangeStart, LocalDate rangeEnd) {
        Long userId = session.getUserId();
        LocalDate today = LocalDate.now(clock);

        long totalTasks;
        long completedTasks;
        if (rangeStart != null || rangeEnd != null) {
            validateRange(rangeStart, rangeEnd);
            LocalDateTime from = rangeStart.atStartOfDay();
            LocalDateTime to = rangeEnd.plusDays(1).atStartOfDay();
            totalTasks = taskRepository.countCreatedBetween(userId, from, to);
            completedTasks = taskRepository.countByStatusCreatedBetween(userId, TaskStatus.COMPLETED, from, to);
        } else {
            totalTasks = taskRepository.countByOwnerId(userId);
            completedTasks = taskRepository.countByOwnerIdAndStatus(userId, TaskStatus.COMPLETED);
        }

        long allCompletedTasks = taskRepository.countByOwnerIdAndStatus(userId, TaskStatus.COMPLETED);
        long studyMinutes = studyLogRepository.sumDurationMinutes(userId);
        long quizzesTaken = quizResultRepository.countByOwnerId(userId);
        Double averageRatio = quizResultRepository.averageScoreRatio(userId);

        Set<LocalDate> studyDays = toDays(studyLogRepository.findAllLogTimes(userId));

        List<SubjectTotal> topSubjects = studyLogRepository
                .sumMinutesBySubject(userId, PageRequest.of(0, TOP_SUBJECTS)).stream()
                .map(row -> new SubjectTotal((String) row[0], ((Number) row[1]).longValue()))
                .collect(Collectors.toList());

        AnalyticsReport report = AnalyticsReport.builder()
                .rangeStart(rangeStart)
                .rangeEnd(rangeEnd)
                .totalTasks(totalTasks)
                .completedTasks(completedTasks)
                .pendingTasks(totalTasks - completedTasks)
                .completionRate(totalTasks == 0 ? 0.0 : (double) completedTasks / totalTasks)
                .totalStudyMinutes(studyMinutes)
                .studySessions(studyLogRepository.countByOwnerId(userId))
                .studyStreakDays(computeStreak(studyDays, today))
                .studyDaysLast7(countDaysWithin(studyDays, today, 7))
                .studyDaysLast30(countDaysWithin(studyDays, today, 30))
                .topSubjects(topSubjects)
                .quizzesTaken(quizzesTaken)
                .averageQuizScore(averageRatio != null ? averageRatio : 0.0)
                .recentQuizzes(quizResultRepository.findByOwnerIdOrderByTakenAtDesc(userId,
                        PageRequest.of(0, RECENT_QUIZZES)))
                .learningPoints(learningPoints(allCompletedTasks, studyMinutes, quizzesTaken))
                .build();

        log.debug("Analytics for user {}: {} task(s), {} min, streak {}, {} points",
                userId, totalTasks, studyMinutes, report.getStudyStreakDays(), report.getLearningPoints());
        return report;
    }

    /**
     * Current study streak of the user.
     */
    @Transactional(readOnly = true)
    public int studyStreak(Session session) {
        Set<LocalDate> days = toDays(studyLogRepository.findAllLogTimes(session.getUserId()));
        return computeStreak(days, LocalDate.now(clock));
    }

    long learningPoints(long completedTasks, long studyMinutes, long quizzesTaken) {
        return completedTasks * pointsPerCompletedTask
                + studyMinutes * pointsPerStudyMinute
                + quizzesTaken * pointsPerQuiz;
    }

    /**
     * Count consecutive study days backwards. The streak starts today if
     * there is a log today, otherwise yesterday; with neither it is 0.
     *
     * @param studyDays distinct days with at least one log
     * @param today the current day
     * @return streak length in days
     */
    static int computeStreak(Set<LocalDate> studyDays, LocalDate today) {
        LocalDate day;
        if (studyDays.contains(today)) {
            day = today;
        } else if (studyDays.contains(today.minusDays(1))) {
            day = today.minusDays(1);
        } else {
            return 0;
        }

        int streak = 0;
        while (studyDays.contains(day)) {
            streak++;
            day = day.minusDays(1);
        }
        return streak;
    }

    /**
     * Distinct study days among the last {@code days} days, today included.
     */
    static int countDaysWithin(Set<LocalDate> studyDays, LocalDate today, int days) {
        LocalDate first = today.minusDays(days - 1L);
        return (int) studyDays.stream()
                .filter(day -> !day.isBefore(first) && !day.isAfter(today))
                .count();
    }

    private static Set<LocalDate> toDays(Collection<LocalDateTime> times) {
        Set<LocalDate> days = new HashSet<>();
        for (LocalDateTime time : times) {
            days.add(time.toLocalDate());
        }
        return days;
    }

    private static void validateRange(LocalDate rangeStart, LocalDate rangeEnd) {
        if (rangeStart == null || rangeEnd == null) {
            throw new ValidationException("date range", "Give both a start and an end date, or neither.");
        }
        if (rangeEnd.isBefore(rangeStart)) {
            throw new ValidationException("date range", "The end date must not be before the start date.");
        }
    }
}
