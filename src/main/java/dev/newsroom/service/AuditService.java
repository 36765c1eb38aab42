package dev.newsroom.service;

import dev.newsroom.entity.AuditLog;
import dev.newsroom.entity.Task;
import dev.newsroom.entity.Translation;
import dev.newsroom.repository.AuditLogRepository;
import dev.newsroom.service.workflow.StageTransition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * Append-only audit trail of workflow state changes. Writes join the caller's
 * transaction and failures propagate, so a change is never committed without its
 * audit row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditService {

    static final String STORY = "STORY";
    static final String TASK = "TASK";
    static final String TRANSLATION = "TRANSLATION";

    private final AuditLogRepository auditLogRepository;
    private final IdService idService;

    public Mono<Void> record(AuditEventType event, String entityType, Long entityId, Long performedBy,
                             String fromState, String toState, String details) {
        AuditLog auditLog = AuditLog.builder()
                .id(idService.nextId())
                .action(event.action())
                .entityType(entityType)
                .entityId(String.valueOf(entityId))
                .performedBy(performedBy)
                .fromState(fromState)
                .toState(toState)
                .details(details)
                .createdAt(LocalDateTime.now())
                .build();

        return auditLogRepository.save(auditLog)
                .doOnSuccess(saved -> log.debug("Audit: {} {} {} by {} ({} -> {})",
                        event, entityType, entityId, performedBy, fromState, toState))
                .doOnError(e -> log.error("Failed to save audit log for {} {} {}: {}",
                        event, entityType, entityId, e.getMessage()))
                .then();
    }

    public Mono<Void> logStageTransition(Long storyId, StageTransition transition, Long actorId, String reason) {
        return record(AuditEventType.STAGE_TRANSITION, STORY, storyId, actorId,
                transition.from().name(), transition.to().name(),
                reason != null ? transition.name() + ": " + reason : transition.name());
    }

    public Mono<Void> logStoryCreated(Long storyId, String slug, Long actorId) {
        return record(AuditEventType.STORY_CREATE, STORY, storyId, actorId, null, "DRAFT", "Created story: " + slug);
    }

    public Mono<Void> logStoryUpdated(Long storyId, Long actorId) {
        return record(AuditEventType.STORY_UPDATE, STORY, storyId, actorId, null, null, "Draft content updated");
    }

    public Mono<Void> logStoryDeleted(Long storyId, String slug, String stage, Long actorId) {
        return record(AuditEventType.STORY_DELETE, STORY, storyId, actorId, stage, null, "Deleted story: " + slug);
    }

    public Mono<Void> logGroupPublished(Long originalId, int translationCount, Long actorId) {
        return record(AuditEventType.GROUP_PUBLISH, STORY, originalId, actorId, "TRANSLATED", "PUBLISHED",
                "Published with %d translation(s)".formatted(translationCount));
    }

    public Mono<Void> logTaskCreated(Task task) {
        return record(AuditEventType.TASK_CREATE, TASK, task.getId(), task.getCreatedById(), null, task.getStatus(),
                task.getType() + " assigned to " + task.getAssignedToId());
    }

    public Mono<Void> logTaskCompleted(Task task, Long actorId) {
        return record(AuditEventType.TASK_COMPLETE, TASK, task.getId(), actorId, task.getStatus(), "COMPLETED",
                task.getType());
    }

    public Mono<Void> logTaskCancelled(Task task, Long actorId) {
        return record(AuditEventType.TASK_CANCEL, TASK, task.getId(), actorId, task.getStatus(), "CANCELLED",
                task.getType() + " superseded");
    }

    public Mono<Void> logTaskReassigned(Task task, Long newAssigneeId, Long actorId) {
        return record(AuditEventType.TASK_REASSIGN, TASK, task.getId(), actorId,
                String.valueOf(task.getAssignedToId()), String.valueOf(newAssigneeId), task.getType());
    }

    public Mono<Void> logTranslationsDispatched(Long originalId, int count, Long actorId) {
        return record(AuditEventType.TRANSLATIONS_DISPATCHED, STORY, originalId, actorId, null, null,
                count == 0 ? "No translations required" : "Dispatched %d translation(s)".formatted(count));
    }

    public Mono<Void> logTranslationStatus(Translation translation, String fromStatus, Long actorId, String notes) {
        return record(AuditEventType.TRANSLATION_STATUS, TRANSLATION, translation.getId(), actorId,
                fromStatus, translation.getStatus(),
                notes != null ? translation.getTargetLanguage() + ": " + notes : translation.getTargetLanguage());
    }

    public Flux<AuditLog> getLogsByEntity(String entityType, Long entityId) {
        return auditLogRepository.findByEntityTypeAndEntityIdOrderByCreatedAtAsc(entityType, String.valueOf(entityId));
    }

    public Flux<AuditLog> getStoryHistory(Long storyId) {
        return getLogsByEntity(STORY, storyId);
    }
}
