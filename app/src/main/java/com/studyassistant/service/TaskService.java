package com.studyassistant.service;

import com.studyassistant.dto.request.TaskFilter;
import com.studyassistant.dto.request.TaskRequest;
import com.studyassistant.dto.response.TaskReminders;
import com.studyassistant.entity.Category;
import com.studyassistant.entity.Task;
import com.studyassistant.entity.Task.TaskStatus;
import com.studyassistant.exception.ResourceNotFoundException;
import com.studyassistant.repository.TaskRepository;
import com.studyassistant.session.Session;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Service for the Task Manager.
 *
 * Tasks move between PENDING and COMPLETED; completing sets
 * {@code completedAt}, reopening clears it. Every lookup is scoped to the
 * session's user: a task ID belonging to someone else is reported as not
 * found.
 *
 * Listing order: tasks with a due date first, soonest due first, then the
 * newest created. Filters are applied to that ordered list.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TaskService {

    private static final int TITLE_MAX_LENGTH = 500;
    private static final int UPCOMING_DAYS = 7;

    private final TaskRepository taskRepository;
    private final CategoryService categoryService;
    private final Clock clock;

    @Transactional
    public Task create(Session session, TaskRequest request) {
        String title = InputRules.requireText(request.getTitle(), "title", TITLE_MAX_LENGTH);
        Category category = resolveCategory(session, request.getCategoryId());

        Task task = new Task(session.getUserId(), title, category, request.getDueDate(), now());
        Task saved = taskRepository.save(task);
        log.info("Created task {} for user {} (category: {}, due: {})",
                saved.getId(), session.getUserId(), saved.getCategoryName(), saved.getDueDate());
        return saved;
    }

    @Transactional(readOnly = true)
    public Task get(Session session, Long taskId) {
        return findOwned(session, taskId);
    }

    /**
     * List the user's tasks.
     *
     * @param session the active session
     * @param filter completion, category and due-date filters
     * @return matching tasks in display order
     */
    @Transactional(readOnly = true)
    public List<Task> list(Session session, TaskFilter filter) {
        TaskFilter effective = filter != null ? filter : TaskFilter.all();
        LocalDate today = LocalDate.now(clock);

        Predicate<Task> matches = task -> effective.isIncludeCompleted() || !task.isCompleted();
        matches = matches.and(categoryPredicate(effective));
        matches = matches.and(duePredicate(effective.getDue(), today));

        List<Task> tasks = taskRepository.findAllForDisplay(session.getUserId()).stream()
                .filter(matches)
                .collect(Collectors.toList());
        log.debug("Listed {} task(s) for user {} with {}", tasks.size(), session.getUserId(), effective);
        return tasks;
    }

    /**
     * Pending tasks due today and pending overdue tasks.
     */
    @Transactional(readOnly = true)
    public TaskReminders reminders(Session session) {
        TaskFilter dueToday = TaskFilter.builder().includeCompleted(false).due(TaskFilter.DueFilter.TODAY).build();
        TaskFilter overdue = TaskFilter.builder().includeCompleted(false).due(TaskFilter.DueFilter.OVERDUE).build();
        return new TaskReminders(list(session, dueToday), list(session, overdue));
    }

    /**
     * Replace title, category and due date of a task. Status is unchanged.
     */
    @Transactional
    public Task update(Session session, Long taskId, TaskRequest request) {
        Task task = findOwned(session, taskId);
        task.setTitle(InputRules.requireText(request.getTitle(), "title", TITLE_MAX_LENGTH));
        task.setCategory(resolveCategory(session, request.getCategoryId()));
        task.setDueDate(request.getDueDate());

        log.info("Updated task {} for user {}", taskId, session.getUserId());
        return taskRepository.save(task);
    }

    @Transactional
    public Task complete(Session session, Long taskId) {
        return setCompleted(session, taskId, true);
    }

    @Transactional
    public Task reopen(Session session, Long taskId) {
        return setCompleted(session, taskId, false);
    }

    @Transactional
    public void delete(Session session, Long taskId) {
        Task task = findOwned(session, taskId);
        taskRepository.delete(task);
        log.info("Deleted task {} for user {}", taskId, session.getUserId());
    }

    private Task setCompleted(Session session, Long taskId, boolean completed) {
        Task task = findOwned(session, taskId);
        if (task.isCompleted() == completed) {
            return task;
        }
        if (completed) {
            task.setStatus(TaskStatus.COMPLETED);
            task.setCompletedAt(now());
        } else {
            task.setStatus(TaskStatus.PENDING);
            task.setCompletedAt(null);
        }
        log.info("Task {} marked {} for user {}", taskId, task.getStatus(), session.getUserId());
        return taskRepository.save(task);
    }

    /**
     * Current time at the precision the store keeps.
     */
    private LocalDateTime now() {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
    }

    private Task findOwned(Session session, Long taskId) {
        return taskRepository.findByIdAndOwnerId(taskId, session.getUserId())
                .orElseThrow(() -> ResourceNotFoundException.task(taskId));
    }

    private Category resolveCategory(Session session, Long categoryId) {
        return categoryId == null ? null : categoryService.findOwned(session.getUserId(), categoryId);
    }

    private static Predicate<Task> categoryPredicate(TaskFilter filter) {
        if (filter.isUncategorizedOnly()) {
            return task -> task.getCategory() == null;
        }
        if (filter.getCategoryId() != null) {
            Long categoryId = filter.getCategoryId();
            return task -> task.getCategory() != null && categoryId.equals(task.getCategory().getId());
        }
        return task -> true;
    }

    private static Predicate<Task> duePredicate(TaskFilter.DueFilter due, LocalDate today) {
        if (due == null) {
            return task -> true;
        }
        switch (due) {
            case TODAY:
                return task -> today.equals(task.getDueDate());
            case UPCOMING:
                LocalDate horizon = today.plusDays(UPCOMING_DAYS);
                return task -> task.getDueDate() != null
                        && task.getDueDate().isAfter(today)
                        && !task.getDueDate().isAfter(horizon);
            case OVERDUE:
                return task -> task.getDueDate() != null
                        && task.getDueDate().isBefore(today)
                        && !task.isCompleted();
            default:
                return task -> true;
        }
    }
}
