package dev.newsroom.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueItem {
    private String storyId;
    private String title;
    private String authorId;
    private String assigneeId;
    private LocalDateTime stageEnteredAt;
    private Long daysInStage;
    private boolean overSla;
}
