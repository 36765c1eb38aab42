package dev.newsroom.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.newsroom.entity.Story;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StoryResponse {
    private String id;
    private String slug;
    private String title;
    private String content;
    private String stage;
    private String language;
    private boolean translation;
    private String originalStoryId;
    private String categoryId;
    private String authorId;
    private String authorRole;
    private String assignedReviewerId;
    private String assignedApproverId;
    private List<String> audioClipIds;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime publishedAt;

    public static StoryResponse from(Story story) {
        return StoryResponse.builder()
                .id(String.valueOf(story.getId()))
                .slug(story.getSlug())
                .title(story.getTitle())
                .content(story.getContent())
                .stage(story.getStage())
                .language(story.getLanguage())
                .translation(story.isTranslationItem())
                .originalStoryId(toStr(story.getOriginalStoryId()))
                .categoryId(toStr(story.getCategoryId()))
                .authorId(toStr(story.getAuthorId()))
                .authorRole(story.getAuthorRole())
                .assignedReviewerId(toStr(story.getAssignedReviewerId()))
                .assignedApproverId(toStr(story.getAssignedApproverId()))
                .createdAt(story.getCreatedAt())
                .updatedAt(story.getUpdatedAt())
                .publishedAt(story.getPublishedAt())
                .build();
    }

    public StoryResponse withAudioClipIds(List<Long> clipIds) {
        this.audioClipIds = clipIds.stream().map(String::valueOf).toList();
        return this;
    }

    static String toStr(Long value) {
        return value != null ? String.valueOf(value) : null;
    }
}
