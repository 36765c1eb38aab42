package dev.newsroom.service;

import dev.newsroom.entity.StaffUser;
import dev.newsroom.entity.Story;
import dev.newsroom.entity.StoryStage;
import dev.newsroom.exception.AlreadyTerminalException;
import dev.newsroom.exception.InvalidTransitionException;
import dev.newsroom.exception.ResourceNotFoundException;
import dev.newsroom.exception.StaleStateException;
import dev.newsroom.exception.ValidationFailedException;
import dev.newsroom.metrics.NewsroomMetrics;
import dev.newsroom.repository.StaffUserRepository;
import dev.newsroom.repository.StoryRepository;
import dev.newsroom.service.workflow.RolePolicy;
import dev.newsroom.service.workflow.StageRouter;
import dev.newsroom.service.workflow.StageTransition;
import dev.newsroom.service.workflow.TransitionContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * The only way a story changes stage. A transition is validated against the stage
 * graph and the actor's role, applied with a conditional update, audited and handed
 * to the task orchestrator, all in one transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StoryWorkflowService {

    private final StoryRepository storyRepository;
    private final StaffUserRepository staffUserRepository;
    private final RolePolicy rolePolicy;
    private final TaskOrchestrator taskOrchestrator;
    private final AuditService auditService;
    private final NewsroomMetrics newsroomMetrics;

    @Transactional
    public Mono<Story> requestTransition(Long storyId, StageTransition transition, Long actorId, String reason) {
        return requestTransition(storyId, transition, actorId, TransitionContext.direct(reason));
    }

    /**
     * Moves a story along one edge on behalf of a person.
     *
     * @throws ResourceNotFoundException  story or actor missing
     * @throws AlreadyTerminalException   story already published
     * @throws InvalidTransitionException edge not valid from the current stage, not for this author, or not requestable
     * @throws AccessDeniedException      actor's role does not allow the edge
     * @throws ValidationFailedException  rejection edge without a reason
     * @throws StaleStateException        the stage changed concurrently, or already left the stage the
     *                                    originating task was opened for
     */
    @Transactional
    public Mono<Story> requestTransition(Long storyId, StageTransition transition, Long actorId,
                                         TransitionContext context) {
        return loadStory(storyId)
                .flatMap(story -> {
                    if (story.isTranslationItem()) {
                        return Mono.error(new InvalidTransitionException(
                                "Translated story %d moves only through translation review and group publish"
                                        .formatted(storyId)));
                    }
                    if (story.stageValue() == StoryStage.PUBLISHED) {
                        return Mono.error(new AlreadyTerminalException("Story", storyId, story.getStage()));
                    }
                    if (transition.isSystemOnly() || transition.isGroupOnly()) {
                        return Mono.error(new InvalidTransitionException(
                                "%s cannot be requested directly".formatted(transition)));
                    }
                    return loadActor(actorId).flatMap(actor -> validate(story, transition, actor, context)
                            .then(Mono.defer(() -> apply(story, transition, actorId, context))));
                });
    }

    private Mono<Void> validate(Story story, StageTransition transition, StaffUser actor, TransitionContext context) {
        if (!rolePolicy.canRequest(transition, actor, story)) {
            return Mono.error(new AccessDeniedException(
                    "Staff %d may not %s story %d".formatted(actor.getId(), transition, story.getId())));
        }
        if (!story.isInStage(transition.from())) {
            // An open task pins the stage it was opened for; the story moved on underneath it.
            if (context.originatingTaskId() != null) {
                return Mono.error(new StaleStateException("Story %d left %s while task %d was open; now %s"
                        .formatted(story.getId(), transition.from(), context.originatingTaskId(), story.getStage())));
            }
            return Mono.error(new InvalidTransitionException("Story", story.getStage(), transition));
        }
        if (!StageRouter.appliesTo(transition, story.authorRoleValue())) {
            return Mono.error(new InvalidTransitionException(
                    "%s does not apply to stories written by %s".formatted(transition, story.getAuthorRole())));
        }
        if (transition.isRejection() && !context.hasReason()) {
            return Mono.error(new ValidationFailedException("reason", "A reason is required to send a story back"));
        }
        return Mono.empty();
    }

    /**
     * Fired when the last translation of an approved story is approved, or when
     * translations are dispatched with an empty list. Does nothing unless the
     * story is still APPROVED, so a repeated evaluation is harmless.
     *
     * @return whether the story moved to TRANSLATED
     */
    @Transactional
    public Mono<Boolean> advanceWhenTranslated(Long originalStoryId, Long triggeredBy) {
        return loadStory(originalStoryId)
                .flatMap(story -> {
                    if (!story.isInStage(StoryStage.APPROVED)) {
                        log.debug("Story {} is {}, not advancing to TRANSLATED", originalStoryId, story.getStage());
                        return Mono.just(false);
                    }
                    return apply(story, StageTransition.MARK_TRANSLATED, triggeredBy, TransitionContext.system())
                            .thenReturn(true);
                });
    }

    /**
     * Edges the actor could request on the story right now. Group publish is listed
     * when the actor may publish; it still goes through the group publish operation.
     */
    public Flux<StageTransition> availableTransitions(Long storyId, Long actorId) {
        return Mono.zip(loadStory(storyId), loadActor(actorId))
                .flatMapMany(tuple -> {
                    Story story = tuple.getT1();
                    StaffUser actor = tuple.getT2();
                    if (story.isTranslationItem() || story.stageValue() == null || story.stageValue().isTerminal()) {
                        return Flux.empty();
                    }
                    return Flux.fromIterable(StageTransition.from(story.stageValue()))
                            .filter(t -> !t.isSystemOnly())
                            .filter(t -> StageRouter.appliesTo(t, story.authorRoleValue()))
                            .filter(t -> rolePolicy.canRequest(t, actor, story));
                });
    }

    private Mono<Story> apply(Story story, StageTransition transition, Long actorId, TransitionContext context) {
        LocalDateTime now = LocalDateTime.now();
        return storyRepository.compareAndSetStage(story.getId(), transition.from().name(), transition.to().name(), now)
                .flatMap(updated -> {
                    if (updated == 0) {
                        return Mono.error(new StaleStateException(
                                "Story %d is no longer %s".formatted(story.getId(), transition.from())));
                    }
                    story.setStage(transition.to().name());
                    story.setUpdatedAt(now);
                    return auditService.logStageTransition(story.getId(), transition, actorId, context.reason())
                            .then(taskOrchestrator.onStageAdvanced(story, transition, actorId, context))
                            .thenReturn(story);
                })
                .doOnNext(moved -> {
                    newsroomMetrics.recordTransition(transition);
                    log.info("Story {} {}: {} -> {} by {}", moved.getId(), transition,
                            transition.from(), transition.to(), actorId);
                });
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
