package dev.newsroom.dto;

import dev.newsroom.entity.TaskPriority;
import dev.newsroom.entity.TaskType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateTaskRequest {

    @NotNull(message = "Task type is required")
    private TaskType type;

    @NotNull(message = "Content id is required")
    private Long contentId;

    private Long assigneeId;

    private TaskPriority priority;

    private LocalDateTime dueDate;

    @Size(max = 255, message = "Title must be at most 255 characters")
    private String title;

    @Size(max = 2000, message = "Description must be at most 2000 characters")
    private String description;

    private String targetLanguage;
}
