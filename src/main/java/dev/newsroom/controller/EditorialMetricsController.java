package dev.newsroom.controller;

import dev.newsroom.dto.PipelineMetricsResponse;
import dev.newsroom.dto.QueueItem;
import dev.newsroom.dto.ReviewerWorkload;
import dev.newsroom.dto.WorkflowHealth;
import dev.newsroom.entity.StaffRole;
import dev.newsroom.entity.StoryStage;
import dev.newsroom.service.PipelineMetricsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;

/**
 * Pipeline occupancy, SLA breaches and reviewer load for editors.
 */
@RestController
@RequestMapping("/api/v1/editorial-metrics")
@RequiredArgsConstructor
@PreAuthorize("hasAnyRole('SUB_EDITOR', 'EDITOR', 'ADMIN', 'SUPERADMIN')")
@Tag(name = "Editorial Metrics", description = "Pipeline, workload and SLA figures")
@SecurityRequirement(name = "staffId")
@Slf4j
public class EditorialMetricsController {

    private final PipelineMetricsService pipelineMetricsService;

    @GetMapping("/pipeline")
    @Operation(summary = "Pipeline metrics", description = "Per-stage count, dwell time and SLA breaches")
    public Mono<PipelineMetricsResponse> getPipelineMetrics() {
        log.debug("Fetching pipeline metrics");
        return pipelineMetricsService.pipelineMetrics();
    }

    @GetMapping("/workload")
    @Operation(summary = "Reviewer workload", description = "role=JOURNALIST or SUB_EDITOR, busiest first")
    public Mono<List<ReviewerWorkload>> getReviewerWorkload(@RequestParam(defaultValue = "JOURNALIST") String role) {
        log.debug("Fetching reviewer workload: role={}", role);
        return pipelineMetricsService.reviewerWorkload(StaffRole.from(role.toUpperCase(Locale.ROOT))).collectList();
    }

    @GetMapping("/health")
    @Operation(summary = "Workflow health", description = "Pipeline size, publishing volume and bottleneck stage")
    public Mono<WorkflowHealth> getWorkflowHealth() {
        return pipelineMetricsService.workflowHealth();
    }

    @GetMapping("/queue/{stage}")
    @Operation(summary = "Stage queue", description = "Items waiting for review or approval, oldest first")
    public Mono<List<QueueItem>> getStageQueue(@PathVariable String stage) {
        return pipelineMetricsService.stageQueue(StoryStage.from(stage.toUpperCase(Locale.ROOT))).collectList();
    }
}
