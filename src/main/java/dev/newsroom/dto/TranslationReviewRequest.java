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
public class TranslationReviewRequest {

    @NotNull(message = "Approve flag is required")
    private Boolean approve;

    @Size(max = 2000, message = "Notes must be at most 2000 characters")
    private String notes;
}
