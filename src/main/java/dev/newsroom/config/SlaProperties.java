package dev.newsroom.config;

import dev.newsroom.entity.StoryStage;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-stage dwell thresholds in days, bound from {@code newsroom.sla.thresholds.<STAGE>}.
 * PUBLISHED never has a threshold.
 */
@Data
@ConfigurationProperties(prefix = "newsroom.sla")
public class SlaProperties {

    private Map<StoryStage, Integer> thresholds = defaults();

    public Optional<Integer> thresholdDays(StoryStage stage) {
        if (stage == null || stage.isTerminal()) {
            return Optional.empty();
        }
        return Optional.ofNullable(thresholds.get(stage));
    }

    public static Map<StoryStage, Integer> defaults() {
        Map<StoryStage, Integer> map = new EnumMap<>(StoryStage.class);
        map.put(StoryStage.DRAFT, 7);
        map.put(StoryStage.NEEDS_JOURNALIST_REVIEW, 2);
        map.put(StoryStage.NEEDS_SUB_EDITOR_APPROVAL, 2);
        map.put(StoryStage.APPROVED, 7);
        map.put(StoryStage.TRANSLATED, 1);
        return map;
    }
}
