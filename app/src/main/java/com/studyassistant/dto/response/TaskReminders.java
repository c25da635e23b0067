package com.studyassistant.dto.response;

import com.studyassistant.entity.Task;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * Pending tasks that need attention now: due today and overdue, each in
 * task-list order.
 */
@Data
@AllArgsConstructor
public class TaskReminders {

    private List<Task> dueToday;

    private List<Task> overdue;

    public boolean isEmpty() {
        return dueToday.isEmpty() && overdue.isEmpty();
    }
}
