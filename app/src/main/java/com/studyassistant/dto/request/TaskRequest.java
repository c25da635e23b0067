package com.studyassistant.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Input for creating or updating a task.
 *
 * A null {@code categoryId} files the task under "Uncategorized"; a null
 * {@code dueDate} means the task has no deadline.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskRequest {

    private String title;

    private Long categoryId;

    private LocalDate dueDate;
}
