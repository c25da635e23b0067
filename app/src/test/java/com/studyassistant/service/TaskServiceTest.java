package com.studyassistant.service;

import com.studyassistant.dto.request.TaskFilter;
import com.studyassistant.dto.request.TaskFilter.DueFilter;
import com.studyassistant.dto.request.TaskRequest;
import com.studyassistant.dto.response.TaskReminders;
import com.studyassistant.entity.Category;
import com.studyassistant.entity.Task;
import com.studyassistant.entity.Task.TaskStatus;
import com.studyassistant.exception.ResourceNotFoundException;
import com.studyassistant.exception.ValidationException;
import com.studyassistant.repository.TaskRepository;
import com.studyassistant.session.Session;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TaskService.
 *
 * Covers creation, owner scoping, status changes and the list filters
 * against a fixed clock.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("TaskService Unit Tests")
class TaskServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);

    @Mock
    private TaskRepository taskRepository;

    @Mock
    private CategoryService categoryService;

    private TaskService taskService;
    private Session session;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-10T12:00:00.123Z"), ZoneId.of("UTC"));
        taskService = new TaskService(taskRepository, categoryService, clock);
        session = new Session(1L, "alice", LocalDateTime.of(2026, 3, 10, 9, 0));
    }

    @Test
    @DisplayName("create should store a pending task with the resolved category")
    void testCreate() {
        // Arrange
        Category biology = new Category(1L, "Biology");
        biology.setId(3L);
        when(categoryService.findOwned(1L, 3L)).thenReturn(biology);
        when(taskRepository.save(any(Task.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // Act
        Task task = taskService.create(session, TaskRequest.builder()
                .title("  Read chapter 4  ")
                .categoryId(3L)
                .dueDate(TODAY.plusDays(2))
                .build());

        // Assert
        assertEquals("Read chapter 4", task.getTitle());
        assertEquals(1L, task.getOwnerId());
        assertSame(biology, task.getCategory());
        assertEquals(TaskStatus.PENDING, task.getStatus());
        assertNull(task.getCompletedAt());
        assertEquals(LocalDateTime.of(2026, 3, 10, 12, 0, 0), task.getCreatedAt());
    }

    @Test
    @DisplayName("create should reject a blank title without saving")
    void testCreate_BlankTitle() {
        assertThrows(ValidationException.class,
                () -> taskService.create(session, TaskRequest.builder().title("   ").build()));
        verify(taskRepository, never()).save(any());
    }

    @Test
    @DisplayName("A task of another user is reported as not found")
    void testGet_OtherOwner() {
        when(taskRepository.findByIdAndOwnerId(9L, 1L)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> taskService.get(session, 9L));
    }

    @Test
    @DisplayName("complete sets completedAt and reopen clears it")
    void testCompleteAndReopen() {
        Task task = task(5L, "Essay", null);
        when(taskRepository.findByIdAndOwnerId(5L, 1L)).thenReturn(Optional.of(task));
        when(taskRepository.save(task)).thenReturn(task);

        taskService.complete(session, 5L);
        assertEquals(TaskStatus.COMPLETED, task.getStatus());
        assertEquals(LocalDateTime.of(2026, 3, 10, 12, 0, 0), task.getCompletedAt());

        taskService.reopen(session, 5L);
        assertEquals(TaskStatus.PENDING, task.getStatus());
        assertNull(task.getCompletedAt());
        verify(taskRepository, times(2)).save(task);
    }

    @Test
    @DisplayName("Completing a completed task changes nothing")
    void testComplete_AlreadyCompleted() {
        Task task = task(5L, "Essay", null);
        task.setStatus(TaskStatus.COMPLETED);
        task.setCompletedAt(LocalDateTime.of(2026, 3, 1, 8, 0));
        when(taskRepository.findByIdAndOwnerId(5L, 1L)).thenReturn(Optional.of(task));

        taskService.complete(session, 5L);

        assertEquals(LocalDateTime.of(2026, 3, 1, 8, 0), task.getCompletedAt());
        verify(taskRepository, never()).save(any());
    }

    @Test
    @DisplayName("list should apply due-date windows relative to today")
    void testList_DueFilters() {
        Task dueToday = task(1L, "today", TODAY);
        Task dueTomorrow = task(2L, "tomorrow", TODAY.plusDays(1));
        Task dueInAWeek = task(3L, "week", TODAY.plusDays(7));
        Task dueLater = task(4L, "later", TODAY.plusDays(8));
        Task overdue = task(5L, "overdue", TODAY.minusDays(1));
        Task overdueDone = task(6L, "overdue done", TODAY.minusDays(3));
        overdueDone.setStatus(TaskStatus.COMPLETED);
        Task noDate = task(7L, "no date", null);
        when(taskRepository.findAllForDisplay(1L)).thenReturn(
                List.of(overdueDone, overdue, dueToday, dueTomorrow, dueInAWeek, dueLater, noDate));

        assertEquals(List.of("today"), titles(TaskFilter.builder().due(DueFilter.TODAY).build()));
        assertEquals(List.of("tomorrow", "week"), titles(TaskFilter.builder().due(DueFilter.UPCOMING).build()));
        assertEquals(List.of("overdue"), titles(TaskFilter.builder().due(DueFilter.OVERDUE).build()));
        assertEquals(7, taskService.list(session, TaskFilter.all()).size());
        assertEquals(6, taskService.list(session, TaskFilter.builder().includeCompleted(false).build()).size());
    }

    @Test
    @DisplayName("list should filter by category or show only uncategorized tasks")
    void testList_CategoryFilters() {
        Category math = new Category(1L, "Math");
        math.setId(2L);
        Category history = new Category(1L, "History");
        history.setId(4L);
        when(taskRepository.findAllForDisplay(1L)).thenReturn(List.of(
                task(1L, "algebra", null, math),
                task(2L, "wars", null, history),
                task(3L, "loose", null, null)));

        assertEquals(List.of("algebra"), titles(TaskFilter.builder().categoryId(2L).build()));
        assertEquals(List.of("loose"), titles(TaskFilter.builder().uncategorizedOnly(true).build()));
        assertEquals(List.of("algebra", "wars", "loose"), titles(null));
    }

    @Test
    @DisplayName("reminders should list pending tasks due today and overdue pending tasks")
    void testReminders() {
        // Arrange
        Task dueToday = task(1L, "today", TODAY);
        Task doneToday = task(2L, "done today", TODAY);
        doneToday.setStatus(TaskStatus.COMPLETED);
        Task overdue = task(3L, "overdue", TODAY.minusDays(4));
        Task upcoming = task(4L, "upcoming", TODAY.plusDays(2));
        when(taskRepository.findAllForDisplay(1L)).thenReturn(List.of(overdue, dueToday, doneToday, upcoming));

        // Act
        TaskReminders reminders = taskService.reminders(session);

        // Assert
        assertEquals(List.of(dueToday), reminders.getDueToday());
        assertEquals(List.of(overdue), reminders.getOverdue());
        assertFalse(reminders.isEmpty());
    }

    private List<String> titles(TaskFilter filter) {
        return taskService.list(session, filter).stream()
                .map(Task::getTitle)
                .collect(Collectors.toList());
    }

    private static Task task(Long id, String title, LocalDate dueDate) {
        return task(id, title, dueDate, null);
    }

    private static Task task(Long id, String title, LocalDate dueDate, Category category) {
        Task task = new Task(1L, title, category, dueDate, LocalDateTime.of(2026, 3, 1, 10, 0));
        task.setId(id);
        return task;
    }
}
