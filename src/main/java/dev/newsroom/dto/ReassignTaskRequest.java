package dev.newsroom.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReassignTaskRequest {

    @NotNull(message = "Assignee is required")
    private Long assigneeId;

    @Size(max = 1000, message = "Note must be at most 1000 characters")
    private String note;
}
