package dev.newsroom.service;

import dev.newsroom.dto.CompleteTaskRequest;
import dev.newsroom.dto.CreateTaskRequest;
import dev.newsroom.dto.TaskResponse;
import dev.newsroom.entity.ContentKind;
import dev.newsroom.entity.ContentRef;
import dev.newsroom.entity.StaffUser;
import dev.newsroom.entity.Story;
import dev.newsroom.entity.Task;
import dev.newsroom.entity.TaskStatus;
import dev.newsroom.entity.TaskType;
import dev.newsroom.exception.AlreadyTerminalException;
import dev.newsroom.exception.InvalidTransitionException;
import dev.newsroom.exception.ResourceNotFoundException;
import dev.newsroom.exception.StaleStateException;
import dev.newsroom.exception.ValidationFailedException;
import dev.newsroom.repository.StaffUserRepository;
import dev.newsroom.repository.StoryRepository;
import dev.newsroom.repository.TaskRepository;
import dev.newsroom.service.assignment.AssigneeResolver;
import dev.newsroom.service.workflow.RolePolicy;
import dev.newsroom.service.workflow.StageRouter;
import dev.newsroom.service.workflow.StageTransition;
import dev.newsroom.service.workflow.TaskOutcome;
import dev.newsroom.service.workflow.TransitionContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Task lifecycle as seen by staff: listing, starting, completing and reassigning.
 * Completing a workflow task is how a story moves; the outcome is routed to the
 * matching workflow operation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TaskService {

    private static final int MAX_PAGE_SIZE = 100;

    private final TaskRepository taskRepository;
    private final StoryRepository storyRepository;
    private final StaffUserRepository staffUserRepository;
    private final RolePolicy rolePolicy;
    private final AssigneeResolver assigneeResolver;
    private final TaskOrchestrator taskOrchestrator;
    private final StoryWorkflowService storyWorkflowService;
    private final TranslationWorkflowService translationWorkflowService;
    private final GroupPublishService groupPublishService;
    private final TaskMetadataMapper taskMetadataMapper;
    private final AuditService auditService;

    public Mono<TaskResponse> getTask(Long taskId) {
        return loadTask(taskId).map(TaskResponse::from);
    }

    public Flux<TaskResponse> tasksForAssignee(Long assigneeId, String status, int page, int size) {
        int limit = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        int offset = Math.max(page, 0) * limit;
        if (status == null) {
            return taskRepository.findByAssignee(assigneeId, limit, offset).map(TaskResponse::from);
        }
        return Flux.fromArray(TaskStatus.values())
                .filter(s -> s.name().equalsIgnoreCase(status))
                .next()
                .switchIfEmpty(Mono.error(new ValidationFailedException("status", "Unknown task status: " + status)))
                .flatMapMany(parsed -> taskRepository.findByAssigneeAndStatus(assigneeId, parsed.name(), limit, offset))
                .map(TaskResponse::from);
    }

    public Flux<TaskResponse> tasksForContent(ContentRef content) {
        return taskRepository.findByContent(content.kind().name(), content.id()).map(TaskResponse::from);
    }

    public Flux<TaskResponse> unassignedTasks() {
        return taskRepository.findUnassigned().map(TaskResponse::from);
    }

    /**
     * Manually opens a task, e.g. a follow-up or a bulletin step.
     */
    @Transactional
    public Mono<TaskResponse> createTask(CreateTaskRequest request, Long actorId) {
        TaskType type = request.getType();
        ContentRef content = ContentRef.of(type.contentKind(), request.getContentId());
        return loadActor(actorId)
                .flatMap(actor -> rolePolicy.canManageTasks(actor)
                        ? checkContentExists(content)
                        : Mono.<Void>error(new AccessDeniedException(
                                "Staff %d may not create tasks".formatted(actorId))))
                .then(Mono.defer(() -> request.getAssigneeId() != null
                        ? assigneeResolver.requireEligible(request.getAssigneeId(), type, request.getTargetLanguage())
                                .then()
                        : Mono.<Void>empty()))
                .then(Mono.defer(() -> taskOrchestrator.createTask(NewTask.builder()
                        .type(type)
                        .content(content)
                        .assigneeId(request.getAssigneeId())
                        .createdById(actorId)
                        .priority(request.getPriority())
                        .dueDate(request.getDueDate())
                        .title(request.getTitle())
                        .description(request.getDescription())
                        .targetLanguage(request.getTargetLanguage())
                        .build())))
                .map(TaskResponse::from);
    }

    private Mono<Void> checkContentExists(ContentRef content) {
        if (content.kind() != ContentKind.STORY) {
            return Mono.empty();
        }
        return storyRepository.existsById(content.id())
                .flatMap(exists -> exists
                        ? Mono.<Void>empty()
                        : Mono.<Void>error(new ResourceNotFoundException("Story", "id", content.id())));
    }

    @Transactional
    public Mono<TaskResponse> startTask(Long taskId, Long actorId) {
        return loadTask(taskId)
                .flatMap(task -> {
                    if (!task.isAssignedTo(actorId)) {
                        return Mono.error(new AccessDeniedException(
                                "Task %d is assigned to someone else".formatted(taskId)));
                    }
                    TaskStatus status = task.statusValue();
                    if (status == TaskStatus.IN_PROGRESS) {
                        return Mono.just(task);
                    }
                    if (status.isTerminal()) {
                        return Mono.error(new AlreadyTerminalException("Task", taskId, status));
                    }
                    if (status != TaskStatus.PENDING) {
                        return Mono.error(new InvalidTransitionException("Task", status, "start"));
                    }
                    return taskRepository.startIfPending(taskId, LocalDateTime.now())
                            .flatMap(updated -> updated == 0
                                    ? Mono.<Task>error(new StaleStateException(
                                            "Task %d changed while starting".formatted(taskId)))
                                    : loadTask(taskId));
                })
                .map(TaskResponse::from);
    }

    /**
     * Completes a task on behalf of its assignee and performs whatever workflow move
     * the task stands for.
     *
     * @throws AlreadyTerminalException   task already completed or cancelled
     * @throws InvalidTransitionException task not in a completable status, or outcome invalid for the step
     * @throws AccessDeniedException      actor is not the assignee
     */
    @Transactional
    public Mono<TaskResponse> completeTask(Long taskId, Long actorId, CompleteTaskRequest request) {
        CompleteTaskRequest completion = request != null ? request : new CompleteTaskRequest();
        return loadTask(taskId)
                .flatMap(task -> {
                    TaskStatus status = task.statusValue();
                    if (status.isTerminal()) {
                        return Mono.error(new AlreadyTerminalException("Task", taskId, status));
                    }
                    if (!status.isCompletable()) {
                        return Mono.error(new InvalidTransitionException("Task", status, "complete"));
                    }
                    if (!task.isAssignedTo(actorId)) {
                        return Mono.error(new AccessDeniedException(
                                "Only the assignee may complete task %d".formatted(taskId)));
                    }
                    String metadata = completionMetadata(task, actorId, completion);
                    return dispatchCompletion(task, actorId, completion, metadata)
                            .then(Mono.defer(() -> loadTask(taskId)));
                })
                .map(TaskResponse::from)
                .doOnNext(task -> log.info("Task {} ({}) completed by {}", task.getId(), task.getType(), actorId));
    }

    private Mono<Void> dispatchCompletion(Task task, Long actorId, CompleteTaskRequest request, String metadata) {
        TaskType type = task.typeValue();
        Long storyId = task.getContentId();

        if (type.isStageStep()) {
            if (request.getOutcome() == null) {
                return Mono.error(new ValidationFailedException("outcome", "An outcome is required for " + type));
            }
            return loadStory(storyId)
                    .flatMap(story -> {
                        StageTransition edge = StageRouter.requireEdge(type.stage(), story.authorRoleValue(),
                                request.getOutcome());
                        TransitionContext context = new TransitionContext(task.getId(), request.getReason(),
                                request.getNextAssigneeId(), metadata);
                        return storyWorkflowService.requestTransition(storyId, edge, actorId, context);
                    })
                    .then();
        }

        return switch (type) {
            case STORY_TRANSLATE -> task.isTranslationDispatch()
                    ? translationWorkflowService.dispatch(storyId, request.getTranslations(), actorId,
                            task.getId(), metadata).then()
                    : translationWorkflowService.findAssignment(storyId, task.getTargetLanguage())
                            .flatMap(assignment -> translationWorkflowService.submitForReview(assignment.getId(),
                                    actorId, request.getNextAssigneeId(), task.getId(), metadata))
                            .then();
            case STORY_TRANSLATION_REVIEW -> {
                TaskOutcome outcome = request.getOutcome();
                if (outcome != TaskOutcome.APPROVE && outcome != TaskOutcome.REJECT) {
                    yield Mono.error(new ValidationFailedException("outcome",
                            "Translation review needs APPROVE or REJECT"));
                }
                yield translationWorkflowService.findAssignment(storyId, task.getTargetLanguage())
                        .flatMap(assignment -> translationWorkflowService.review(assignment.getId(), actorId,
                                outcome == TaskOutcome.APPROVE, request.getReason(), task.getId(), metadata))
                        .then();
            }
            case STORY_PUBLISH -> groupPublishService.publishGroup(storyId, actorId, task.getId(), metadata).then();
            default -> taskOrchestrator.complete(task, actorId, metadata);
        };
    }

    private String completionMetadata(Task task, Long actorId, CompleteTaskRequest request) {
        Map<String, Object> additions = new LinkedHashMap<>();
        if (request.getMetadata() != null) {
            additions.putAll(request.getMetadata());
        }
        additions.put("completedBy", actorId);
        additions.put("outcome", request.getOutcome() != null ? request.getOutcome().name() : null);
        additions.put("reason", request.getReason());
        return taskMetadataMapper.merge(task.getMetadata(), additions);
    }

    /**
     * Hands an open task to someone else. The new assignee must be eligible for the
     * task type; reviewer and approver records on the story follow the task.
     */
    @Transactional
    public Mono<TaskResponse> reassignTask(Long taskId, Long newAssigneeId, Long actorId, String note) {
        return Mono.zip(loadTask(taskId), loadActor(actorId))
                .flatMap(tuple -> {
                    Task task = tuple.getT1();
                    StaffUser actor = tuple.getT2();
                    TaskStatus status = task.statusValue();
                    if (status.isTerminal()) {
                        return Mono.error(new AlreadyTerminalException("Task", taskId, status));
                    }
                    if (!rolePolicy.canReassign(actor, task.getCreatedById(), task.getAssignedToId())) {
                        return Mono.error(new AccessDeniedException(
                                "Staff %d may not reassign task %d".formatted(actorId, taskId)));
                    }
                    TaskType type = task.typeValue();
                    return assigneeResolver.requireEligible(newAssigneeId, type, task.getTargetLanguage())
                            .then(Mono.defer(() -> applyReassignment(task, type, newAssigneeId, actorId, note)));
                })
                .map(TaskResponse::from);
    }

    private Mono<Task> applyReassignment(Task task, TaskType type, Long newAssigneeId, Long actorId, String note) {
        Map<String, Object> additions = new LinkedHashMap<>();
        additions.put("reassignedFrom", task.getAssignedToId());
        additions.put("reassignedBy", actorId);
        additions.put("reassignmentNote", note);
        additions.put("reassignedAt", LocalDateTime.now().toString());
        String metadata = taskMetadataMapper.merge(task.getMetadata(), additions);

        return taskRepository.reassignIfOpen(task.getId(), newAssigneeId, metadata, LocalDateTime.now())
                .flatMap(updated -> updated == 0
                        ? Mono.<Void>error(new StaleStateException(
                                "Task %d was closed before it could be reassigned".formatted(task.getId())))
                        : followAssignment(task, type, newAssigneeId))
                .then(Mono.defer(() -> auditService.logTaskReassigned(task, newAssigneeId, actorId)))
                .then(Mono.defer(() -> loadTask(task.getId())))
                .doOnNext(updated -> log.info("Task {} reassigned from {} to {} by {}",
                        task.getId(), task.getAssignedToId(), newAssigneeId, actorId));
    }

    private Mono<Void> followAssignment(Task task, TaskType type, Long newAssigneeId) {
        return switch (type) {
            case STORY_REVIEW -> storyRepository.updateAssignedReviewer(task.getContentId(), newAssigneeId).then();
            case STORY_APPROVAL -> storyRepository.updateAssignedApprover(task.getContentId(), newAssigneeId).then();
            case STORY_TRANSLATE -> task.isTranslationDispatch()
                    ? Mono.empty()
                    : translationWorkflowService.reassignTranslator(task.getContentId(), task.getTargetLanguage(),
                            newAssigneeId);
            default -> Mono.empty();
        };
    }

    private Mono<Task> loadTask(Long taskId) {
        return taskRepository.findById(taskId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Task", "id", taskId)));
    }

    private Mono<Story> loadStory(Long storyId) {
        return storyRepository.findById(storyId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Story", "id", storyId)));
    }

    private Mono<StaffUser> loadActor(Long actorId) {
        return staffUserRepository.findById(actorId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Staff", "id", actorId)));
    }
}
