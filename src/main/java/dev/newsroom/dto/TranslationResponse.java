package dev.newsroom.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.newsroom.entity.Translation;
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
public class TranslationResponse {
    private String id;
    private String status;
    private String targetLanguage;
    private String originalStoryId;
    private String translatedStoryId;
    private String assignedToId;
    private String reviewerId;
    private String translatorNotes;
    private String reviewerNotes;
    private String rejectionReason;
    private LocalDateTime startedAt;
    private LocalDateTime submittedAt;
    private LocalDateTime reviewedAt;
    private LocalDateTime approvedAt;
    private LocalDateTime rejectedAt;
    private LocalDateTime createdAt;

    public static TranslationResponse from(Translation translation) {
        return TranslationResponse.builder()
                .id(String.valueOf(translation.getId()))
                .status(translation.getStatus())
                .targetLanguage(translation.getTargetLanguage())
                .originalStoryId(StoryResponse.toStr(translation.getOriginalStoryId()))
                .translatedStoryId(StoryResponse.toStr(translation.getTranslatedStoryId()))
                .assignedToId(StoryResponse.toStr(translation.getAssignedToId()))
                .reviewerId(StoryResponse.toStr(translation.getReviewerId()))
                .translatorNotes(translation.getTranslatorNotes())
                .reviewerNotes(translation.getReviewerNotes())
                .rejectionReason(translation.getRejectionReason())
                .startedAt(translation.getStartedAt())
                .submittedAt(translation.getSubmittedAt())
                .reviewedAt(translation.getReviewedAt())
                .approvedAt(translation.getApprovedAt())
                .rejectedAt(translation.getRejectedAt())
                .createdAt(translation.getCreatedAt())
                .build();
    }
}
