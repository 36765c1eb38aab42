package dev.newsroom.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TranslationDraftRequest {

    @Size(max = 500, message = "Title must be at most 500 characters")
    private String title;

    @Size(max = 200000, message = "Content must be at most 200000 characters")
    private String content;

    @Size(max = 2000, message = "Notes must be at most 2000 characters")
    private String translatorNotes;
}
