package dev.newsroom.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Occupancy and dwell figures for one stage. Dwell values are whole days.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StageMetrics {
    private String stage;
    private long count;
    private Integer thresholdDays;
    /** Null when no item in the stage has a usable timestamp. */
    private Long oldestDays;
    /** Rounded to one decimal; null when nothing is measurable. */
    private Double averageDays;
    private long storiesExceedingSla;
    /** Items left out of the averages because their stage-entry time is missing or in the future. */
    private long unmeasurableCount;
}
