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
public class PipelineMetricsResponse {
    private List<StageMetrics> stages;
    private long totalInPipeline;
    private long totalExceedingSla;
    private LocalDateTime generatedAt;

    public StageMetrics forStage(String stage) {
        return stages.stream()
                .filter(s -> s.getStage().equals(stage))
                .findFirst()
                .orElse(null);
    }
}
