package dev.newsroom.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One requested translation: target language and the translator who will do it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TranslationTarget {

    @NotBlank(message = "Language is required")
    private String language;

    @NotNull(message = "Translator is required")
    private Long translatorId;
}
