package dev.newsroom.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoryRequest {

    @NotBlank(message = "Title is required")
    @Size(max = 500, message = "Title must be at most 500 characters")
    private String title;

    @Size(max = 200000, message = "Content must be at most 200000 characters")
    private String content;

    @Pattern(regexp = "^(ENGLISH|AFRIKAANS|XHOSA)?$", message = "Language must be ENGLISH, AFRIKAANS or XHOSA")
    private String language;

    private Long categoryId;

    @Size(max = 20, message = "Maximum 20 audio clips allowed")
    private List<Long> audioClipIds;
}
