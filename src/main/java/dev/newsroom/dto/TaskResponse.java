package dev.newsroom.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.newsroom.entity.Task;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskResponse {
    private String id;
    private String type;
    private String status;
    private String priority;
    private String title;
    private String description;
    private String assignedToId;
    private String createdById;
    private String contentType;
    private String contentId;
    private String targetLanguage;
    private LocalDateTime dueDate;
    private LocalDateTime completedAt;
    private String metadata;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static TaskResponse from(Task task) {
        return TaskResponse.builder()
                .id(String.valueOf(task.getId()))
                .type(task.getType())
                .status(task.getStatus())
                .priority(task.getPriority())
                .title(task.getTitle())
                .description(task.getDescription())
                .assignedToId(StoryResponse.toStr(task.getAssignedToId()))
                .createdById(StoryResponse.toStr(task.getCreatedById()))
                .contentType(task.getContentType())
                .contentId(StoryResponse.toStr(task.getContentId()))
                .targetLanguage(task.getTargetLanguage())
                .dueDate(task.getDueDate())
                .completedAt(task.getCompletedAt())
                .metadata(task.getMetadata())
                .createdAt(task.getCreatedAt())
                .updatedAt(task.getUpdatedAt())
                .build();
    }
}
