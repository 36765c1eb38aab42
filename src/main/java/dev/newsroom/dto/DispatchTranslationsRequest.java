package dev.newsroom.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * An empty list means the story needs no translation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DispatchTranslationsRequest {

    @NotNull(message = "Translations list is required")
    @Size(max = 10, message = "Maximum 10 translations per story")
    private List<@Valid TranslationTarget> translations;
}
