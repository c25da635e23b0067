package com.studyassistant.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Filter for the task list.
 *
 * Category selection: {@code uncategorizedOnly} shows tasks without a
 * category; otherwise a non-null {@code categoryId} restricts the list to
 * that category and null shows every category.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskFilter {

    @Builder.Default
    private boolean includeCompleted = true;

    private Long categoryId;

    private boolean uncategorizedOnly;

    @Builder.Default
    private DueFilter due = DueFilter.ANY;

    public static TaskFilter all() {
        return TaskFilter.builder().build();
    }

    /**
     * Due-date windows, relative to today.
     */
    public enum DueFilter {
        ANY,
        TODAY,
        /** The next seven days, excluding today. */
        UPCOMING,
        /** Pending tasks due before today. */
        OVERDUE
    }
}
