package dev.newsroom.service;

import dev.newsroom.entity.ContentRef;
import dev.newsroom.entity.TaskPriority;
import dev.newsroom.entity.TaskType;
import lombok.Builder;

import java.time.LocalDateTime;

/**
 * Parameters for opening a task. Only type, content and creator are required;
 * a null due date falls back to the SLA threshold of the task's stage.
 */
@Builder
public record NewTask(
        TaskType type,
        ContentRef content,
        Long assigneeId,
        Long createdById,
        TaskPriority priority,
        LocalDateTime dueDate,
        String title,
        String description,
        String targetLanguage,
        String metadataJson) {
}
