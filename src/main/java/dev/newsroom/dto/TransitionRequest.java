package dev.newsroom.dto;

import dev.newsroom.service.workflow.StageTransition;
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
public class TransitionRequest {

    @NotNull(message = "Transition is required")
    private StageTransition transition;

    /** Required when the transition sends the story back. */
    @Size(max = 2000, message = "Reason must be at most 2000 characters")
    private String reason;
}
