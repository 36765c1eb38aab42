package dev.newsroom.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowHealth {
    private long totalInPipeline;
    private long publishedToday;
    private long publishedThisWeek;
    /** Originals published per day over the last 30 days, one decimal. */
    private double throughputPerDay;
    /** Stage holding the most items; null when the pipeline is empty. */
    private String bottleneckStage;
    private long bottleneckCount;
}
