package dev.newsroom.dto;

import dev.newsroom.service.workflow.TaskOutcome;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Completion payload. Which fields matter depends on the task type: stage steps
 * need an outcome, the translation dispatch step takes the list of translations,
 * and a translation review takes APPROVE or REJECT with notes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompleteTaskRequest {

    private TaskOutcome outcome;

    @Size(max = 2000, message = "Reason must be at most 2000 characters")
    private String reason;

    /** Overrides automatic assignee selection for the next step. */
    private Long nextAssigneeId;

    @Valid
    @Size(max = 10, message = "Maximum 10 translations per story")
    private List<TranslationTarget> translations;

    private Map<String, Object> metadata;
}
