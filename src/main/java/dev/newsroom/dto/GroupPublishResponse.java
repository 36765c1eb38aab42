package dev.newsroom.dto;

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
public class GroupPublishResponse {
    private String originalStoryId;
    private List<String> translatedStoryIds;
    private LocalDateTime publishedAt;
    private String publishedBy;
}
