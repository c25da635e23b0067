package com.studyassistant.ui.screen;

import com.studyassistant.dto.request.TaskFilter;
import com.studyassistant.dto.request.TaskFilter.DueFilter;
import com.studyassistant.dto.request.TaskRequest;
import com.studyassistant.entity.Category;
import com.studyassistant.entity.Task;
import com.studyassistant.exception.ValidationException;
import com.studyassistant.service.CategoryService;
import com.studyassistant.service.TaskService;
import com.studyassistant.session.Screen;
import com.studyassistant.session.Session;
import com.studyassistant.ui.ConsoleIO;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Task list with filters, and task create/edit/complete/delete.
 */
@Component
@RequiredArgsConstructor
public class TaskManagerScreen implements ScreenHandler {

    private final ScreenSupport support;
    private final TaskService taskService;
    private final CategoryService categoryService;
    private final Clock clock;

    private TaskFilter filter = TaskFilter.all();

    @Override
    public Screen screen() {
        return Screen.TASK_MANAGER;
    }

    @Override
    public void show() {
        Session session = support.session();
        filter = TaskFilter.all();

        while (true) {
            support.attempt(() -> printTasks(session));

            int choice = support.choose(Screen.TASK_MANAGER.getTitle(), List.of(
                    "Add task", "Edit task", "Mark completed / pending", "Delete task", "Change filter"), "Back");
            switch (choice) {
                case 0:
                    support.navigation().back();
                    return;
                case 1:
                    support.attempt(() -> addTask(session));
                    break;
                case 2:
                    support.attempt(() -> editTask(session));
                    break;
                case 3:
                    support.attempt(() -> toggleTask(session));
                    break;
                case 4:
                    support.attempt(() -> deleteTask(session));
                    break;
                default:
                    support.attempt(() -> filter = readFilter(session));
                    break;
            }
        }
    }

    private void printTasks(Session session) {
        ConsoleIO io = support.io();
        List<Task> tasks = taskService.list(session, filter);
        io.header("Tasks (" + describe(filter) + ")");
        if (tasks.isEmpty()) {
            io.println("  No tasks.");
            return;
        }
        LocalDate today = LocalDate.now(clock);
        for (Task task : tasks) {
            String due = task.getDueDate() == null ? "" : " due " + task.getDueDate()
                    + (!task.isCompleted() && task.getDueDate().isBefore(today) ? " (overdue)" : "");
            io.printf("  [%s] #%d %s  <%s>%s%n",
                    task.isCompleted() ? "x" : " ", task.getId(), task.getTitle(), task.getCategoryName(), due);
        }
    }

    private void addTask(Session session) {
        ConsoleIO io = support.io();
        String title = io.readLine("Title");
        Long categoryId = readCategory(session, null);
        LocalDate dueDate = io.readOptionalDate("Due date");
        Task task = taskService.create(session, new TaskRequest(title, categoryId, dueDate));
        io.println("Added task #" + task.getId() + ".");
    }

    private void editTask(Session session) {
        ConsoleIO io = support.io();
        Task task = taskService.get(session, io.readId("Task #"));
        String title = io.readLine("Title [" + task.getTitle() + "]");
        Long categoryId = readCategory(session, task.getCategory());
        LocalDate dueDate = io.readDate("Due date", task.getDueDate());

        TaskRequest request = new TaskRequest(
                title.isEmpty() ? task.getTitle() : title,
                categoryId,
                dueDate);
        taskService.update(session, task.getId(), request);
        io.println("Task updated.");
    }

    private void toggleTask(Session session) {
        Long taskId = support.io().readId("Task #");
        Task task = taskService.get(session, taskId);
        Task updated = task.isCompleted() ? taskService.reopen(session, taskId) : taskService.complete(session, taskId);
        support.io().println("Task #" + taskId + " is now " + updated.getStatus().name().toLowerCase() + ".");
    }

    private void deleteTask(Session session) {
        Long taskId = support.io().readId("Task #");
        Task task = taskService.get(session, taskId);
        if (support.io().confirm("Delete '" + task.getTitle() + "'?")) {
            taskService.delete(session, taskId);
            support.io().println("Task deleted.");
        }
    }

    /**
     * Let the user pick a category by number; 0 means Uncategorized and an
     * empty line keeps {@code current}.
     */
    private Long readCategory(Session session, Category current) {
        ConsoleIO io = support.io();
        List<Category> categories = categoryService.list(session);
        io.println("  0) " + Category.UNCATEGORIZED);
        for (int i = 0; i < categories.size(); i++) {
            io.printf("  %d) %s%n", i + 1, categories.get(i).getName());
        }
        String keep = current == null ? Category.UNCATEGORIZED : current.getName();
        String raw = io.readLine("Category [" + keep + "]");
        if (raw.isEmpty()) {
            return current == null ? null : current.getId();
        }
        int index;
        try {
            index = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw ValidationException.invalidFormat("category", raw, "a number from the list");
        }
        if (index < 0 || index > categories.size()) {
            throw ValidationException.outOfRange("category", index, 0, categories.size());
        }
        return index == 0 ? null : categories.get(index - 1).getId();
    }

    private TaskFilter readFilter(Session session) {
        ConsoleIO io = support.io();
        TaskFilter.TaskFilterBuilder builder = TaskFilter.builder();
        builder.includeCompleted(io.confirm("Show completed tasks?"));

        List<Category> categories = categoryService.list(session);
        io.println("  0) All categories");
        io.println("  1) " + Category.UNCATEGORIZED);
        for (int i = 0; i < categories.size(); i++) {
            io.printf("  %d) %s%n", i + 2, categories.get(i).getName());
        }
        int category = io.readInt("Category", 0, categories.size() + 1);
        if (category == 1) {
            builder.uncategorizedOnly(true);
        } else if (category > 1) {
            builder.categoryId(categories.get(category - 2).getId());
        }

        DueFilter[] dueFilters = DueFilter.values();
        for (int i = 0; i < dueFilters.length; i++) {
            io.printf("  %d) %s%n", i, dueFilters[i].name().toLowerCase());
        }
        builder.due(dueFilters[io.readInt("Due", 0, dueFilters.length - 1)]);
        return builder.build();
    }

    private static String describe(TaskFilter filter) {
        StringBuilder text = new StringBuilder(filter.isIncludeCompleted() ? "all" : "pending");
        if (filter.isUncategorizedOnly()) {
            text.append(", uncategorized");
        } else if (filter.getCategoryId() != null) {
            text.append(", one category");
        }
        if (filter.getDue() != DueFilter.ANY) {
            text.append(", due ").append(filter.getDue().name().toLowerCase());
        }
        return text.toString();
    }
}
