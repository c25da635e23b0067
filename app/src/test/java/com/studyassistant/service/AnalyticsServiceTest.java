package com.studyassistant.service;

import com.studyassistant.dto.response.AnalyticsReport;
import com.studyassistant.entity.Task.TaskStatus;
import com.studyassistant.exception.ValidationException;
import com.studyassistant.repository.QuizResultRepository;
import com.studyassistant.repository.StudyLogRepository;
import com.studyassistant.repository.TaskRepository;
import com.studyassistant.session.Session;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AnalyticsService.
 *
 * Streak and consistency counting are tested directly on the static
 * helpers; the report is assembled over mocked repositories.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("AnalyticsService Unit Tests")
class AnalyticsServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);

    @Mock
    private TaskRepository taskRepository;

    @Mock
    private StudyLogRepository studyLogRepository;

    @Mock
    private QuizResultRepository quizResultRepository;

    private AnalyticsService analyticsService;
    private Session session;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-10T12:00:00Z"), ZoneId.of("UTC"));
        analyticsService = new AnalyticsService(taskRepository, studyLogRepository, quizResultRepository, clock);
        ReflectionTestUtils.setField(analyticsService, "pointsPerCompletedTask", 10L);
        ReflectionTestUtils.setField(analyticsService, "pointsPerStudyMinute", 1L);
        ReflectionTestUtils.setField(analyticsService, "pointsPerQuiz", 5L);
        session = new Session(1L, "alice", LocalDateTime.of(2026, 3, 10, 9, 0));
    }

    @Test
    @DisplayName("A streak counts back from today")
    void testStreakFromToday() {
        Set<LocalDate> days = Set.of(TODAY, TODAY.minusDays(1), TODAY.minusDays(2));

        assertEquals(3, AnalyticsService.computeStreak(days, TODAY));
    }

    @Test
    @DisplayName("A gap ends the streak")
    void testStreakWithGap() {
        Set<LocalDate> days = Set.of(TODAY, TODAY.minusDays(2));

        assertEquals(1, AnalyticsService.computeStreak(days, TODAY));
    }

    @Test
    @DisplayName("Without a log today the streak counts back from yesterday")
    void testStreakFromYesterday() {
        Set<LocalDate> days = Set.of(TODAY.minusDays(1), TODAY.minusDays(2));

        assertEquals(2, AnalyticsService.computeStreak(days, TODAY));
    }

    @Test
    @DisplayName("No log today or yesterday means no streak")
    void testNoStreak() {
        assertEquals(0, AnalyticsService.computeStreak(Set.of(), TODAY));
        assertEquals(0, AnalyticsService.computeStreak(Set.of(TODAY.minusDays(2), TODAY.minusDays(3)), TODAY));
    }

    @Test
    @DisplayName("Consistency counts distinct days inside the window, today included")
    void testCountDaysWithin() {
        Set<LocalDate> days = Set.of(TODAY, TODAY.minusDays(6), TODAY.minusDays(7), TODAY.minusDays(29));

        assertEquals(2, AnalyticsService.countDaysWithin(days, TODAY, 7));
        assertEquals(4, AnalyticsService.countDaysWithin(days, TODAY, 30));
    }

    @Test
    @DisplayName("report should combine tasks, study time, quizzes and learning points")
    void testReport() {
        // Arrange
        when(taskRepository.countByOwnerId(1L)).thenReturn(4L);
        when(taskRepository.countByOwnerIdAndStatus(1L, TaskStatus.COMPLETED)).thenReturn(2L);
        when(studyLogRepository.sumDurationMinutes(1L)).thenReturn(90L);
        when(studyLogRepository.countByOwnerId(1L)).thenReturn(3L);
        when(studyLogRepository.findAllLogTimes(1L)).thenReturn(List.of(
                LocalDateTime.of(2026, 3, 10, 8, 0),
                LocalDateTime.of(2026, 3, 9, 20, 0),
                LocalDateTime.of(2026, 3, 9, 7, 30)));
        when(studyLogRepository.sumMinutesBySubject(eq(1L), any(Pageable.class)))
                .thenReturn(List.<Object[]>of(new Object[]{"Biology", 60L}, new Object[]{"Math", 30L}));
        when(quizResultRepository.countByOwnerId(1L)).thenReturn(2L);
        when(quizResultRepository.averageScoreRatio(1L)).thenReturn(0.75);
        when(quizResultRepository.findByOwnerIdOrderByTakenAtDesc(eq(1L), any(Pageable.class)))
                .thenReturn(List.of());

        // Act
        AnalyticsReport report = analyticsService.report(session);

        // Assert
        assertEquals(4L, report.getTotalTasks());
        assertEquals(2L, report.getCompletedTasks());
        assertEquals(2L, report.getPendingTasks());
        assertEquals(0.5, report.getCompletionRate(), 1e-9);
        assertEquals(90L, report.getTotalStudyMinutes());
        assertEquals(3L, report.getStudySessions());
        assertEquals(2, report.getStudyStreakDays());
        assertEquals(2, report.getStudyDaysLast7());
        assertEquals("Biology", report.getTopSubjects().get(0).getSubject());
        assertEquals(60L, report.getTopSubjects().get(0).getMinutes());
        assertEquals(0.75, report.getAverageQuizScore(), 1e-9);
        assertEquals(2 * 10 + 90 + 2 * 5, report.getLearningPoints());
    }

    @Test
    @DisplayName("report should return zeros for a user without any data")
    void testReport_Empty() {
        when(studyLogRepository.findAllLogTimes(1L)).thenReturn(List.of());
        when(studyLogRepository.sumMinutesBySubject(eq(1L), any(Pageable.class))).thenReturn(List.of());
        when(quizResultRepository.findByOwnerIdOrderByTakenAtDesc(eq(1L), any(Pageable.class)))
                .thenReturn(List.of());

        AnalyticsReport report = analyticsService.report(session);

        assertEquals(0L, report.getTotalTasks());
        assertEquals(0.0, report.getCompletionRate());
        assertEquals(0, report.getStudyStreakDays());
        assertEquals(0.0, report.getAverageQuizScore());
        assertEquals(0L, report.getLearningPoints());
    }

    @Test
    @DisplayName("report with a date range should count tasks created inside it")
    void testReport_DateRange() {
        LocalDate start = LocalDate.of(2026, 3, 1);
        LocalDate end = LocalDate.of(2026, 3, 7);
        when(taskRepository.countCreatedBetween(1L, start.atStartOfDay(), LocalDate.of(2026, 3, 8).atStartOfDay()))
                .thenReturn(5L);
        when(taskRepository.countByStatusCreatedBetween(1L, TaskStatus.COMPLETED,
                start.atStartOfDay(), LocalDate.of(2026, 3, 8).atStartOfDay()))
                .thenReturn(1L);
        when(taskRepository.countByOwnerIdAndStatus(1L, TaskStatus.COMPLETED)).thenReturn(3L);
        when(studyLogRepository.findAllLogTimes(1L)).thenReturn(List.of());
        when(studyLogRepository.sumMinutesBySubject(eq(1L), any(Pageable.class))).thenReturn(List.of());
        when(quizResultRepository.findByOwnerIdOrderByTakenAtDesc(eq(1L), any(Pageable.class)))
                .thenReturn(List.of());

        AnalyticsReport report = analyticsService.report(session, start, end);

        assertEquals(5L, report.getTotalTasks());
        assertEquals(1L, report.getCompletedTasks());
        assertEquals(0.2, report.getCompletionRate(), 1e-9);
        assertEquals(30L, report.getLearningPoints());
        verify(taskRepository, never()).countByOwnerId(anyLong());
    }

    @Test
    @DisplayName("report should reject a half-open or reversed range")
    void testReport_InvalidRange() {
        LocalDate start = LocalDate.of(2026, 3, 7);

        assertThrows(ValidationException.class, () -> analyticsService.report(session, start, null));
        assertThrows(ValidationException.class, () -> analyticsService.report(session, null, start));
        assertThrows(ValidationException.class,
                () -> analyticsService.report(session, start, start.minusDays(1)));
        verifyNoInteractions(taskRepository);
    }
}
