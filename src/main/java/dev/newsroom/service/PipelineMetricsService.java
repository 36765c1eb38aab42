package dev.newsroom.service;

import dev.newsroom.config.SlaProperties;
import dev.newsroom.dto.PipelineMetricsResponse;
import dev.newsroom.dto.QueueItem;
import dev.newsroom.dto.ReviewerWorkload;
import dev.newsroom.dto.StageMetrics;
import dev.newsroom.dto.WorkflowHealth;
import dev.newsroom.entity.StaffRole;
import dev.newsroom.entity.StaffUser;
import dev.newsroom.entity.Story;
import dev.newsroom.entity.StoryStage;
import dev.newsroom.exception.ValidationFailedException;
import dev.newsroom.repository.StaffUserRepository;
import dev.newsroom.repository.StoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only pipeline figures computed from current story state. Nothing here
 * locks or writes; results may be slightly stale under concurrent transitions.
 * Dwell time is measured from a story's last update, in whole days.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PipelineMetricsService {

    /** Non-terminal stages reported by the pipeline view, in pipeline order. */
    public static final List<StoryStage> PIPELINE_STAGES = List.of(
            StoryStage.DRAFT,
            StoryStage.NEEDS_JOURNALIST_REVIEW,
            StoryStage.NEEDS_SUB_EDITOR_APPROVAL,
            StoryStage.APPROVED,
            StoryStage.TRANSLATED);

    private static final Set<StoryStage> QUEUE_STAGES =
            EnumSet.of(StoryStage.NEEDS_JOURNALIST_REVIEW, StoryStage.NEEDS_SUB_EDITOR_APPROVAL);

    private static final int THROUGHPUT_WINDOW_DAYS = 30;

    private final StoryRepository storyRepository;
    private final StaffUserRepository staffUserRepository;
    private final SlaProperties slaProperties;

    /**
     * Occupancy, dwell and SLA breach counts per stage, from a single scan of the
     * unpublished originals.
     */
    public Mono<PipelineMetricsResponse> pipelineMetrics() {
        return storyRepository.findPipelineItems()
                .collectList()
                .map(items -> buildPipelineMetrics(items, LocalDateTime.now()))
                .doOnNext(metrics -> log.debug("Pipeline metrics: {} item(s), {} over SLA",
                        metrics.getTotalInPipeline(), metrics.getTotalExceedingSla()));
    }

    PipelineMetricsResponse buildPipelineMetrics(List<Story> items, LocalDateTime now) {
        Map<StoryStage, List<Story>> byStage = items.stream()
                .filter(story -> story.stageValue() != null)
                .collect(Collectors.groupingBy(Story::stageValue));

        List<StageMetrics> stages = new ArrayList<>();
        long totalExceeding = 0;
        for (StoryStage stage : PIPELINE_STAGES) {
            StageMetrics metrics = stageMetrics(stage, byStage.getOrDefault(stage, List.of()), now);
            totalExceeding += metrics.getStoriesExceedingSla();
            stages.add(metrics);
        }

        return PipelineMetricsResponse.builder()
                .stages(stages)
                .totalInPipeline(stages.stream().mapToLong(StageMetrics::getCount).sum())
                .totalExceedingSla(totalExceeding)
                .generatedAt(now)
                .build();
    }

    private StageMetrics stageMetrics(StoryStage stage, List<Story> stories, LocalDateTime now) {
        Optional<Integer> threshold = slaProperties.thresholdDays(stage);
        long unmeasurable = 0;
        long exceeding = 0;
        long sum = 0;
        long measured = 0;
        Long oldest = null;

        for (Story story : stories) {
            Long days = daysInStage(story, now);
            if (days == null) {
                unmeasurable++;
                continue;
            }
            measured++;
            sum += days;
            oldest = oldest == null ? days : Math.max(oldest, days);
            if (threshold.isPresent() && days > threshold.get()) {
                exceeding++;
            }
        }

        return StageMetrics.builder()
                .stage(stage.name())
                .count(stories.size())
                .thresholdDays(threshold.orElse(null))
                .oldestDays(oldest)
                .averageDays(measured > 0 ? roundOneDecimal((double) sum / measured) : null)
                .storiesExceedingSla(exceeding)
                .unmeasurableCount(unmeasurable)
                .build();
    }

    /**
     * Per-person load for journalists (items awaiting their review) or the sub-editor
     * tier (items awaiting their approval), busiest first.
     */
    public Flux<ReviewerWorkload> reviewerWorkload(StaffRole role) {
        final StoryStage stage;
        final Set<StaffRole> population;
        final Function<Story, Long> assignee;
        if (role == StaffRole.JOURNALIST) {
            stage = StoryStage.NEEDS_JOURNALIST_REVIEW;
            population = EnumSet.of(StaffRole.JOURNALIST);
            assignee = Story::getAssignedReviewerId;
        } else if (role != null && StaffRole.APPROVERS.contains(role)) {
            stage = StoryStage.NEEDS_SUB_EDITOR_APPROVAL;
            population = StaffRole.APPROVERS;
            assignee = Story::getAssignedApproverId;
        } else {
            return Flux.error(new ValidationFailedException("role",
                    "Workload is reported for JOURNALIST or SUB_EDITOR and above"));
        }

        LocalDateTime now = LocalDateTime.now();
        return Mono.zip(
                        staffUserRepository.findActiveByRoles(StaffRole.names(population)).collectList(),
                        storyRepository.findOriginalsInStageOldestFirst(stage.name()).collectList())
                .flatMapMany(tuple -> Flux.fromIterable(buildWorkload(tuple.getT1(), tuple.getT2(), assignee, now)));
    }

    List<ReviewerWorkload> buildWorkload(List<StaffUser> staff, List<Story> stories,
                                         Function<Story, Long> assignee, LocalDateTime now) {
        Map<Long, List<Story>> byAssignee = stories.stream()
                .filter(story -> assignee.apply(story) != null)
                .collect(Collectors.groupingBy(assignee));

        return staff.stream()
                .map(member -> {
                    List<Story> assigned = byAssignee.getOrDefault(member.getId(), List.of());
                    Long oldest = assigned.stream()
                            .map(story -> daysInStage(story, now))
                            .filter(Objects::nonNull)
                            .max(Long::compare)
                            .orElse(null);
                    return ReviewerWorkload.builder()
                            .staffId(String.valueOf(member.getId()))
                            .name(member.displayName())
                            .role(member.getStaffRole())
                            .assignedCount(assigned.size())
                            .oldestAssignedDays(oldest)
                            .build();
                })
                .sorted(Comparator.comparingLong(ReviewerWorkload::getAssignedCount).reversed()
                        .thenComparingLong(w -> Long.parseLong(w.getStaffId())))
                .toList();
    }

    /**
     * Pipeline size, recent publishing volume and the stage holding the most items.
     * The four reads run concurrently.
     */
    public Mono<WorkflowHealth> workflowHealth() {
        LocalDateTime now = LocalDateTime.now();
        LocalDateTime startOfToday = LocalDate.now().atStartOfDay();
        return Mono.zip(
                        storyRepository.findPipelineItems().collectList(),
                        storyRepository.countOriginalsPublishedSince(startOfToday),
                        storyRepository.countOriginalsPublishedSince(now.minusDays(7)),
                        storyRepository.countOriginalsPublishedSince(now.minusDays(THROUGHPUT_WINDOW_DAYS)))
                .map(tuple -> {
                    List<Story> pipeline = tuple.getT1();
                    Map<StoryStage, Long> occupancy = pipeline.stream()
                            .filter(story -> story.stageValue() != null)
                            .collect(Collectors.groupingBy(Story::stageValue, Collectors.counting()));
                    Optional<Map.Entry<StoryStage, Long>> bottleneck = PIPELINE_STAGES.stream()
                            .filter(occupancy::containsKey)
                            .map(stage -> Map.entry(stage, occupancy.get(stage)))
                            .max(Map.Entry.comparingByValue());

                    return WorkflowHealth.builder()
                            .totalInPipeline(pipeline.size())
                            .publishedToday(tuple.getT2())
                            .publishedThisWeek(tuple.getT3())
                            .throughputPerDay(roundOneDecimal((double) tuple.getT4() / THROUGHPUT_WINDOW_DAYS))
                            .bottleneckStage(bottleneck.map(e -> e.getKey().name()).orElse(null))
                            .bottleneckCount(bottleneck.map(Map.Entry::getValue).orElse(0L))
                            .build();
                });
    }

    /**
     * Items waiting in a review or approval queue, oldest first.
     */
    public Flux<QueueItem> stageQueue(StoryStage stage) {
        if (stage == null || !QUEUE_STAGES.contains(stage)) {
            return Flux.error(new ValidationFailedException("stage",
                    "Queues exist for NEEDS_JOURNALIST_REVIEW and NEEDS_SUB_EDITOR_APPROVAL"));
        }
        LocalDateTime now = LocalDateTime.now();
        Optional<Integer> threshold = slaProperties.thresholdDays(stage);
        return storyRepository.findOriginalsInStageOldestFirst(stage.name())
                .map(story -> {
                    Long days = daysInStage(story, now);
                    Long assignee = stage == StoryStage.NEEDS_JOURNALIST_REVIEW
                            ? story.getAssignedReviewerId()
                            : story.getAssignedApproverId();
                    return QueueItem.builder()
                            .storyId(String.valueOf(story.getId()))
                            .title(story.getTitle())
                            .authorId(story.getAuthorId() != null ? String.valueOf(story.getAuthorId()) : null)
                            .assigneeId(assignee != null ? String.valueOf(assignee) : null)
                            .stageEnteredAt(story.stageEnteredAt())
                            .daysInStage(days)
                            .overSla(days != null && threshold.isPresent() && days > threshold.get())
                            .build();
                });
    }

    /**
     * Whole days since the story entered its stage, or null when the entry time is
     * missing or lies in the future.
     */
    static Long daysInStage(Story story, LocalDateTime now) {
        LocalDateTime entered = story.stageEnteredAt();
        if (entered == null || entered.isAfter(now)) {
            return null;
        }
        return Duration.between(entered, now).toDays();
    }

    private static double roundOneDecimal(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
