package dev.newsroom.service;

import dev.newsroom.config.SlaProperties;
import dev.newsroom.entity.ContentRef;
import dev.newsroom.entity.StaffUser;
import dev.newsroom.entity.Story;
import dev.newsroom.entity.Task;
import dev.newsroom.entity.TaskPriority;
import dev.newsroom.entity.TaskStatus;
import dev.newsroom.entity.TaskType;
import dev.newsroom.exception.DuplicateResourceException;
import dev.newsroom.exception.StaleStateException;
import dev.newsroom.exception.ValidationFailedException;
import dev.newsroom.metrics.NewsroomMetrics;
import dev.newsroom.repository.StoryRepository;
import dev.newsroom.repository.TaskRepository;
import dev.newsroom.service.assignment.AssigneeResolver;
import dev.newsroom.service.workflow.StageTransition;
import dev.newsroom.service.workflow.TransitionContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Opens and closes the tasks that mirror a story's position in the pipeline.
 * Every method here runs inside the caller's transaction; nothing commits on its own.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TaskOrchestrator {

    private final TaskRepository taskRepository;
    private final StoryRepository storyRepository;
    private final AssigneeResolver assigneeResolver;
    private final SlaProperties slaProperties;
    private final IdService idService;
    private final AuditService auditService;
    private final NewsroomMetrics newsroomMetrics;

    /**
     * Opens a task. Fails with {@link DuplicateResourceException} when the same content
     * already has an open task for the step.
     */
    public Mono<Task> createTask(NewTask request) {
        TaskType type = request.type();
        ContentRef content = request.content();
        if (type.contentKind() != content.kind()) {
            return Mono.error(new ValidationFailedException("contentType",
                    "%s tasks apply to %s content, not %s".formatted(type, type.contentKind(), content.kind())));
        }

        long id = idService.nextId();
        LocalDateTime now = LocalDateTime.now();
        String stepKey = type.stepKey(request.targetLanguage(), id);

        Task task = Task.builder()
                .id(id)
                .type(type.name())
                .status(request.assigneeId() != null ? TaskStatus.PENDING.name() : TaskStatus.PENDING_ASSIGNMENT.name())
                .priority((request.priority() != null ? request.priority() : TaskPriority.MEDIUM).name())
                .title(request.title() != null ? request.title() : defaultTitle(type, request.targetLanguage()))
                .description(request.description())
                .assignedToId(request.assigneeId())
                .createdById(request.createdById())
                .contentType(content.kind().name())
                .contentId(content.id())
                .stepKey(stepKey)
                .targetLanguage(request.targetLanguage())
                .dueDate(request.dueDate() != null ? request.dueDate() : defaultDueDate(type, now))
                .metadata(request.metadataJson())
                .createdAt(now)
                .updatedAt(now)
                .build();

        return taskRepository.existsOpenStep(content.kind().name(), content.id(), stepKey)
                .flatMap(exists -> exists
                        ? Mono.<Task>error(new DuplicateResourceException(
                                "%s %d already has an open %s task".formatted(content.kind(), content.id(), stepKey)))
                        : taskRepository.save(task))
                .flatMap(saved -> auditService.logTaskCreated(saved).thenReturn(saved))
                .doOnNext(saved -> {
                    if (saved.getAssignedToId() == null) {
                        log.warn("Task {} ({}) for {} {} has no eligible assignee", saved.getId(), type,
                                content.kind(), content.id());
                    } else {
                        log.info("Task {} ({}) opened for {} {} and assigned to {}", saved.getId(), type,
                                content.kind(), content.id(), saved.getAssignedToId());
                    }
                });
    }

    /**
     * Closes the tasks of the stage the story just left and opens the task for the
     * stage it entered. The story passed in already carries the new stage.
     */
    public Mono<Void> onStageAdvanced(Story story, StageTransition transition, Long actorId, TransitionContext context) {
        List<String> stepKeys = TaskType.stepKeyForStage(transition.from()).stream().toList();
        return closeStep(ContentRef.story(story.getId()), stepKeys, actorId,
                        context.originatingTaskId(), context.metadataJson())
                .then(Mono.defer(() -> transition.nextTask()
                        .map(type -> openStoryStep(story, type, actorId, context.nextAssigneeId()).then())
                        .orElseGet(Mono::empty)));
    }

    /**
     * Opens the story-level task of the given type, resolving its assignee and
     * recording reviewer or approver on the story.
     */
    public Mono<Task> openStoryStep(Story story, TaskType type, Long actorId, Long explicitAssigneeId) {
        return resolveAssignee(story, type, actorId, explicitAssigneeId)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(assignee -> createTask(NewTask.builder()
                        .type(type)
                        .content(ContentRef.story(story.getId()))
                        .assigneeId(assignee.orElse(null))
                        .createdById(actorId)
                        .title(defaultTitle(type, null) + ": " + story.getTitle())
                        .build()))
                .flatMap(task -> recordStoryAssignment(story, type, task.getAssignedToId()).thenReturn(task));
    }

    private Mono<Long> resolveAssignee(Story story, TaskType type, Long actorId, Long explicitAssigneeId) {
        if (explicitAssigneeId != null) {
            return assigneeResolver.requireEligible(explicitAssigneeId, type, null).map(StaffUser::getId);
        }
        List<Long> excludeAuthor = story.getAuthorId() != null ? List.of(story.getAuthorId()) : List.of();
        return switch (type) {
            case STORY_CREATE, STORY_REVISION_TO_AUTHOR -> Mono.justOrEmpty(story.getAuthorId());
            case STORY_REVISION_TO_JOURNALIST ->
                    assigneeResolver.preferOrPick(story.getAssignedReviewerId(), type, null, excludeAuthor);
            case STORY_TRANSLATE -> assigneeResolver.preferOrPick(actorId, type, null, List.of());
            case STORY_PUBLISH -> assigneeResolver.preferOrPick(story.getAssignedApproverId(), type, null, List.of());
            default -> assigneeResolver.pick(type, null, excludeAuthor);
        };
    }

    private Mono<Void> recordStoryAssignment(Story story, TaskType type, Long assigneeId) {
        if (assigneeId == null) {
            return Mono.empty();
        }
        if (type == TaskType.STORY_REVIEW) {
            story.setAssignedReviewerId(assigneeId);
            return storyRepository.updateAssignedReviewer(story.getId(), assigneeId).then();
        }
        if (type == TaskType.STORY_APPROVAL) {
            story.setAssignedApproverId(assigneeId);
            return storyRepository.updateAssignedApprover(story.getId(), assigneeId).then();
        }
        return Mono.empty();
    }

    /**
     * Closes the open tasks of the given steps. The originating task, and any task
     * assigned to the actor, is completed; the rest are cancelled. When an originating
     * task is given it must still be open, otherwise a concurrent actor got there first.
     */
    public Mono<Void> closeStep(ContentRef content, Collection<String> stepKeys, Long actorId,
                                Long originatingTaskId, String metadataJson) {
        if (stepKeys.isEmpty()) {
            return Mono.empty();
        }
        return taskRepository.findOpenByContentAndSteps(content.kind().name(), content.id(), stepKeys)
                .collectList()
                .flatMap(open -> {
                    if (originatingTaskId != null && open.stream().noneMatch(t -> t.getId().equals(originatingTaskId))) {
                        return Mono.error(new StaleStateException(
                                "Task %d is no longer open".formatted(originatingTaskId)));
                    }
                    return Flux.fromIterable(open)
                            .concatMap(task -> {
                                boolean originating = task.getId().equals(originatingTaskId);
                                if (originating || task.isAssignedTo(actorId)) {
                                    return complete(task, actorId, originating ? metadataJson : null);
                                }
                                return cancel(task, actorId);
                            })
                            .then();
                });
    }

    /**
     * Completes a single task; zero updated rows means it was closed concurrently.
     */
    public Mono<Void> complete(Task task, Long actorId, String metadataJson) {
        LocalDateTime now = LocalDateTime.now();
        return taskRepository.completeIfOpen(task.getId(), metadataJson, now)
                .flatMap(updated -> {
                    if (updated == 0) {
                        return Mono.error(new StaleStateException(
                                "Task %d is no longer open".formatted(task.getId())));
                    }
                    return auditService.logTaskCompleted(task, actorId);
                })
                .doOnSuccess(v -> {
                    newsroomMetrics.recordTaskCompleted(task.typeValue());
                    log.debug("Task {} ({}) completed by {}", task.getId(), task.getType(), actorId);
                });
    }

    /**
     * Cancels a task if it is still open. A task closed in the meantime is left as is.
     */
    public Mono<Void> cancel(Task task, Long actorId) {
        return taskRepository.cancelIfOpen(task.getId(), LocalDateTime.now())
                .flatMap(updated -> {
                    if (updated == 0) {
                        log.debug("Task {} already closed, nothing to cancel", task.getId());
                        return Mono.<Void>empty();
                    }
                    return auditService.logTaskCancelled(task, actorId);
                });
    }

    /** Cancels every open task on the content, used when the content is deleted. */
    public Mono<Void> cancelAllOpen(ContentRef content, Long actorId) {
        return taskRepository.findOpenByContent(content.kind().name(), content.id())
                .concatMap(task -> cancel(task, actorId))
                .then();
    }

    private LocalDateTime defaultDueDate(TaskType type, LocalDateTime now) {
        return slaProperties.thresholdDays(type.stage())
                .map(now::plusDays)
                .orElse(null);
    }

    private static String defaultTitle(TaskType type, String targetLanguage) {
        String base = switch (type) {
            case STORY_CREATE -> "Write story";
            case STORY_REVIEW -> "Review story";
            case STORY_REVISION_TO_AUTHOR -> "Revise story";
            case STORY_APPROVAL -> "Approve story";
            case STORY_REVISION_TO_JOURNALIST -> "Re-review story";
            case STORY_TRANSLATE -> targetLanguage != null ? "Translate story" : "Dispatch translations";
            case STORY_TRANSLATION_REVIEW -> "Review translation";
            case STORY_PUBLISH -> "Publish story";
            case STORY_FOLLOW_UP -> "Follow up";
            default -> type.name().toLowerCase().replace('_', ' ');
        };
        return targetLanguage != null ? base + " (" + targetLanguage + ")" : base;
    }
}
