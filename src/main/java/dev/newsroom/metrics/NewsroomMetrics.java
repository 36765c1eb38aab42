package dev.newsroom.metrics;

import dev.newsroom.dto.PipelineMetricsResponse;
import dev.newsroom.dto.StageMetrics;
import dev.newsroom.entity.StoryStage;
import dev.newsroom.entity.TaskType;
import dev.newsroom.service.PipelineMetricsService;
import dev.newsroom.service.workflow.StageTransition;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pipeline gauges are pulled on demand: reading a gauge asks {@link PipelineMetricsService}
 * for a fresh snapshot once the cached one is older than {@code newsroom.metrics.max-age-ms}.
 * The query runs without blocking the reader, which sees the cached values until it lands.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NewsroomMetrics {

    private final MeterRegistry meterRegistry;
    private final PipelineMetricsService pipelineMetricsService;

    private final Map<StoryStage, AtomicLong> stageCounts = new EnumMap<>(StoryStage.class);
    private final Map<StoryStage, AtomicLong> stageOverSla = new EnumMap<>(StoryStage.class);

    private final AtomicLong refreshedAtMillis = new AtomicLong(Long.MIN_VALUE);
    private final AtomicBoolean refreshing = new AtomicBoolean(false);

    @Value("${newsroom.metrics.max-age-ms:60000}")
    private long maxAgeMs = 60000;

    private Clock clock = Clock.systemUTC();

    private Counter groupPublishedCounter;

    @PostConstruct
    public void init() {
        for (StoryStage stage : PipelineMetricsService.PIPELINE_STAGES) {
            AtomicLong count = new AtomicLong(0);
            AtomicLong overSla = new AtomicLong(0);
            stageCounts.put(stage, count);
            stageOverSla.put(stage, overSla);

            Gauge.builder("newsroom.pipeline.stage.count", count, this::read)
                    .description("Original stories currently in the stage")
                    .tag("stage", stage.name())
                    .register(meterRegistry);

            Gauge.builder("newsroom.pipeline.stage.over_sla", overSla, this::read)
                    .description("Original stories in the stage longer than its SLA threshold")
                    .tag("stage", stage.name())
                    .register(meterRegistry);
        }

        groupPublishedCounter = meterRegistry.counter("newsroom.group.published");
    }

    private double read(AtomicLong value) {
        refreshIfStale();
        return value.get();
    }

    /**
     * Starts a snapshot query when the cached values have expired and no query is already running.
     */
    void refreshIfStale() {
        long now = clock.millis();
        long last = refreshedAtMillis.get();
        if (last != Long.MIN_VALUE && now - last < maxAgeMs) {
            return;
        }
        if (!refreshing.compareAndSet(false, true)) {
            return;
        }
        pipelineMetricsService.pipelineMetrics()
                .doFinally(signal -> refreshing.set(false))
                .subscribe(
                        response -> {
                            apply(response);
                            refreshedAtMillis.set(clock.millis());
                        },
                        error -> log.warn("Failed to refresh pipeline gauges: {}", error.getMessage())
                );
    }

    void apply(PipelineMetricsResponse response) {
        for (StageMetrics stageMetrics : response.getStages()) {
            StoryStage stage = StoryStage.valueOf(stageMetrics.getStage());
            AtomicLong count = stageCounts.get(stage);
            if (count != null) {
                count.set(stageMetrics.getCount());
                stageOverSla.get(stage).set(stageMetrics.getStoriesExceedingSla());
            }
        }
    }

    void setClock(Clock clock) {
        this.clock = clock;
    }

    void setMaxAgeMs(long maxAgeMs) {
        this.maxAgeMs = maxAgeMs;
    }

    public void recordTransition(StageTransition transition) {
        meterRegistry.counter("newsroom.stage.transitions", "transition", transition.name()).increment();
    }

    public void recordTaskCompleted(TaskType type) {
        meterRegistry.counter("newsroom.tasks.completed", "type", type.name()).increment();
    }

    public void recordGroupPublished() {
        groupPublishedCounter.increment();
    }
}
