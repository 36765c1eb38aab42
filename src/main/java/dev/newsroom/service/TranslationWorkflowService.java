package dev.newsroom.service;

import dev.newsroom.dto.TranslationDraftRequest;
import dev.newsroom.dto.TranslationTarget;
import dev.newsroom.entity.ContentRef;
import dev.newsroom.entity.StaffUser;
import dev.newsroom.entity.Story;
import dev.newsroom.entity.StoryLanguage;
import dev.newsroom.entity.StoryStage;
import dev.newsroom.entity.TaskType;
import dev.newsroom.entity.Translation;
import dev.newsroom.entity.TranslationStatus;
import dev.newsroom.exception.AlreadyTerminalException;
import dev.newsroom.exception.DuplicateResourceException;
import dev.newsroom.exception.InvalidTransitionException;
import dev.newsroom.exception.ResourceNotFoundException;
import dev.newsroom.exception.StaleStateException;
import dev.newsroom.exception.ValidationFailedException;
import dev.newsroom.repository.StaffUserRepository;
import dev.newsroom.repository.StoryRepository;
import dev.newsroom.repository.TranslationRepository;
import dev.newsroom.service.assignment.AssigneeResolver;
import dev.newsroom.service.workflow.RolePolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Per-language translation assignments of an approved story: dispatch, drafting,
 * submission, review, and the readiness check that moves the original to TRANSLATED.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TranslationWorkflowService {

    private final TranslationRepository translationRepository;
    private final StoryRepository storyRepository;
    private final StaffUserRepository staffUserRepository;
    private final AssigneeResolver assigneeResolver;
    private final RolePolicy rolePolicy;
    private final TaskOrchestrator taskOrchestrator;
    private final StoryWorkflowService storyWorkflowService;
    private final AuditService auditService;
    private final IdService idService;

    /**
     * Creates one assignment and one translation task per requested language and
     * closes the dispatch step. An empty request means no translation is needed and
     * the story advances straight to TRANSLATED.
     */
    @Transactional
    public Mono<List<Translation>> dispatch(Long originalStoryId, List<TranslationTarget> targets, Long actorId,
                                            Long originatingTaskId, String metadataJson) {
        List<TranslationTarget> requested = targets != null ? targets : List.of();
        return loadActor(actorId)
                .flatMap(actor -> rolePolicy.canDispatchTranslations(actor)
                        ? loadStory(originalStoryId)
                        : Mono.<Story>error(new AccessDeniedException(
                                "Staff %d may not dispatch translations".formatted(actorId))))
                .flatMap(original -> checkDispatchable(original, requested).thenReturn(original))
                .flatMap(original -> taskOrchestrator.closeStep(ContentRef.story(original.getId()),
                                List.of(TaskType.STORY_TRANSLATE.step()), actorId, originatingTaskId, metadataJson)
                        .thenMany(Flux.fromIterable(requested)
                                .concatMap(target -> createAssignment(original, target, actorId)))
                        .collectList())
                .flatMap(created -> auditService.logTranslationsDispatched(originalStoryId, created.size(), actorId)
                        .then(evaluateReadiness(originalStoryId, actorId))
                        .thenReturn(created))
                .doOnNext(created -> log.info("Dispatched {} translation(s) for story {} by {}",
                        created.size(), originalStoryId, actorId));
    }

    private Mono<Void> checkDispatchable(Story original, List<TranslationTarget> targets) {
        if (original.isTranslationItem()) {
            return Mono.error(new InvalidTransitionException(
                    "Story %d is itself a translation".formatted(original.getId())));
        }
        if (!original.isInStage(StoryStage.APPROVED)) {
            return Mono.error(new InvalidTransitionException("Story", original.getStage(), "dispatch translations"));
        }
        Set<StoryLanguage> seen = EnumSet.noneOf(StoryLanguage.class);
        for (TranslationTarget target : targets) {
            StoryLanguage language = StoryLanguage.parse(target.getLanguage()).orElse(null);
            if (language == null) {
                return Mono.error(new ValidationFailedException("language",
                        "Unsupported language: " + target.getLanguage()));
            }
            if (language.matches(original.getLanguage())) {
                return Mono.error(new ValidationFailedException("language",
                        "Story is already written in " + language));
            }
            if (!seen.add(language)) {
                return Mono.error(new ValidationFailedException("language",
                        "Language requested more than once: " + language));
            }
        }
        return Flux.fromIterable(targets)
                .concatMap(target -> {
                    String language = StoryLanguage.parse(target.getLanguage()).orElseThrow().name();
                    return translationRepository.existsByOriginalStoryIdAndTargetLanguage(original.getId(), language)
                            .flatMap(exists -> exists
                                    ? Mono.<StaffUser>error(new DuplicateResourceException(
                                            "Story %d already has a %s translation".formatted(original.getId(), language)))
                                    : assigneeResolver.requireEligible(target.getTranslatorId(),
                                            TaskType.STORY_TRANSLATE, language));
                })
                .then();
    }

    private Mono<Translation> createAssignment(Story original, TranslationTarget target, Long actorId) {
        String language = StoryLanguage.parse(target.getLanguage()).orElseThrow().name();
        LocalDateTime now = LocalDateTime.now();
        Translation translation = Translation.builder()
                .id(idService.nextId())
                .status(TranslationStatus.PENDING.name())
                .targetLanguage(language)
                .originalStoryId(original.getId())
                .assignedToId(target.getTranslatorId())
                .createdAt(now)
                .updatedAt(now)
                .build();

        return translationRepository.save(translation)
                .flatMap(saved -> taskOrchestrator.createTask(NewTask.builder()
                                .type(TaskType.STORY_TRANSLATE)
                                .content(ContentRef.story(original.getId()))
                                .assigneeId(saved.getAssignedToId())
                                .createdById(actorId)
                                .targetLanguage(language)
                                .title("Translate to %s: %s".formatted(language, original.getTitle()))
                                .build())
                        .then(auditService.logTranslationStatus(saved, null, actorId, null))
                        .thenReturn(saved));
    }

    /**
     * Translator starts or continues work. The first call creates the translated
     * story as a DRAFT owned by the translator.
     */
    @Transactional
    public Mono<Translation> startWork(Long translationId, Long actorId, TranslationDraftRequest draft) {
        return loadTranslation(translationId)
                .flatMap(translation -> {
                    if (!actorId.equals(translation.getAssignedToId())) {
                        return Mono.error(new AccessDeniedException(
                                "Translation %d is assigned to someone else".formatted(translationId)));
                    }
                    TranslationStatus status = translation.statusValue();
                    if (status == TranslationStatus.APPROVED) {
                        return Mono.error(new AlreadyTerminalException("Translation", translationId, status));
                    }
                    if (status == TranslationStatus.NEEDS_REVIEW) {
                        return Mono.error(new InvalidTransitionException("Translation", status, "start work"));
                    }
                    return writeDraft(translation, actorId, draft)
                            .then(Mono.defer(() -> {
                                LocalDateTime now = LocalDateTime.now();
                                translation.setStatus(TranslationStatus.IN_PROGRESS.name());
                                if (translation.getStartedAt() == null) {
                                    translation.setStartedAt(now);
                                }
                                if (draft != null && draft.getTranslatorNotes() != null) {
                                    translation.setTranslatorNotes(draft.getTranslatorNotes());
                                }
                                translation.setUpdatedAt(now);
                                return saveTranslation(translation);
                            }))
                            .flatMap(saved -> status == TranslationStatus.IN_PROGRESS
                                    ? Mono.just(saved)
                                    : auditService.logTranslationStatus(saved, status.name(), actorId, null)
                                            .thenReturn(saved));
                });
    }

    private Mono<Void> writeDraft(Translation translation, Long actorId, TranslationDraftRequest draft) {
        String title = draft != null ? draft.getTitle() : null;
        String content = draft != null ? draft.getContent() : null;

        if (translation.getTranslatedStoryId() == null) {
            return loadStory(translation.getOriginalStoryId())
                    .zipWith(loadActor(actorId))
                    .flatMap(tuple -> {
                        Story original = tuple.getT1();
                        StaffUser translator = tuple.getT2();
                        LocalDateTime now = LocalDateTime.now();
                        Story translated = Story.builder()
                                .id(idService.nextId())
                                .slug(original.getSlug() + "-" + translation.getTargetLanguage().toLowerCase())
                                .title(title != null ? title : original.getTitle())
                                .content(content)
                                .stage(StoryStage.DRAFT.name())
                                .language(translation.getTargetLanguage())
                                .translation(true)
                                .originalStoryId(original.getId())
                                .categoryId(original.getCategoryId())
                                .authorId(translator.getId())
                                .authorRole(translator.getStaffRole())
                                .createdAt(now)
                                .updatedAt(now)
                                .build();
                        return storyRepository.save(translated);
                    })
                    .doOnNext(saved -> {
                        translation.setTranslatedStoryId(saved.getId());
                        log.info("Created {} draft {} for story {}", translation.getTargetLanguage(),
                                saved.getId(), translation.getOriginalStoryId());
                    })
                    .then();
        }

        if (title == null && content == null) {
            return Mono.empty();
        }
        return loadStory(translation.getTranslatedStoryId())
                .flatMap(current -> storyRepository.updateTranslationDraft(current.getId(),
                        title != null ? title : current.getTitle(),
                        content != null ? content : current.getContent()))
                .flatMap(updated -> updated == 0
                        ? Mono.<Void>error(new StaleStateException(
                                "Translated story %d is no longer a draft".formatted(translation.getTranslatedStoryId())))
                        : Mono.<Void>empty());
    }

    /**
     * Hands the translated draft to a reviewer. An explicit reviewer must be an
     * approver other than the translator; otherwise one is picked. Only IN_PROGRESS
     * work can be submitted: a rejected translation goes back through {@link #startWork}.
     */
    @Transactional
    public Mono<Translation> submitForReview(Long translationId, Long actorId, Long reviewerId,
                                             Long originatingTaskId, String metadataJson) {
        return loadTranslation(translationId)
                .flatMap(translation -> {
                    if (!actorId.equals(translation.getAssignedToId())) {
                        return Mono.error(new AccessDeniedException(
                                "Translation %d is assigned to someone else".formatted(translationId)));
                    }
                    TranslationStatus status = translation.statusValue();
                    if (status == TranslationStatus.APPROVED) {
                        return Mono.error(new AlreadyTerminalException("Translation", translationId, status));
                    }
                    if (status == TranslationStatus.REJECTED) {
                        return Mono.error(new InvalidTransitionException(
                                "Translation %d was rejected; rework the draft before submitting again"
                                        .formatted(translationId)));
                    }
                    if (status != TranslationStatus.IN_PROGRESS) {
                        return Mono.error(new InvalidTransitionException("Translation", status, "submit for review"));
                    }
                    if (translation.getTranslatedStoryId() == null) {
                        return Mono.error(new ValidationFailedException("content", "Translation has no draft yet"));
                    }
                    return loadStory(translation.getTranslatedStoryId())
                            .flatMap(draft -> isBlank(draft.getTitle()) || isBlank(draft.getContent())
                                    ? Mono.<Long>error(new ValidationFailedException("content",
                                            "Translated title and content are required"))
                                    : resolveReviewer(reviewerId, actorId))
                            .flatMap(reviewer -> submit(translation, status, reviewer, actorId,
                                    originatingTaskId, metadataJson));
                });
    }

    private Mono<Long> resolveReviewer(Long reviewerId, Long actorId) {
        if (reviewerId != null) {
            if (reviewerId.equals(actorId)) {
                return Mono.error(new ValidationFailedException("reviewerId", "Translators cannot review their own work"));
            }
            return assigneeResolver.requireEligible(reviewerId, TaskType.STORY_TRANSLATION_REVIEW, null)
                    .map(StaffUser::getId);
        }
        return assigneeResolver.pick(TaskType.STORY_TRANSLATION_REVIEW, null, List.of(actorId))
                .switchIfEmpty(Mono.error(new ValidationFailedException("reviewerId",
                        "No eligible reviewer available")));
    }

    private Mono<Translation> submit(Translation translation, TranslationStatus fromStatus, Long reviewerId,
                                     Long actorId, Long originatingTaskId, String metadataJson) {
        LocalDateTime now = LocalDateTime.now();
        String language = translation.getTargetLanguage();
        ContentRef original = ContentRef.story(translation.getOriginalStoryId());

        translation.setStatus(TranslationStatus.NEEDS_REVIEW.name());
        translation.setSubmittedAt(now);
        translation.setReviewerId(reviewerId);
        translation.setUpdatedAt(now);

        return saveTranslation(translation)
                .flatMap(saved -> taskOrchestrator.closeStep(original,
                                List.of(TaskType.STORY_TRANSLATE.stepKey(language, null)),
                                actorId, originatingTaskId, metadataJson)
                        .then(taskOrchestrator.createTask(NewTask.builder()
                                .type(TaskType.STORY_TRANSLATION_REVIEW)
                                .content(original)
                                .assigneeId(reviewerId)
                                .createdById(actorId)
                                .targetLanguage(language)
                                .build()))
                        .then(auditService.logTranslationStatus(saved, fromStatus.name(), actorId, null))
                        .thenReturn(saved))
                .doOnNext(saved -> log.info("Translation {} ({}) submitted for review to {}",
                        saved.getId(), language, reviewerId));
    }

    /**
     * Approves or rejects a submitted translation. Rejection needs notes and hands the
     * work back to the translator; approval marks the translated story APPROVED and
     * re-checks whether the whole group is ready.
     */
    @Transactional
    public Mono<Translation> review(Long translationId, Long actorId, boolean approve, String notes,
                                    Long originatingTaskId, String metadataJson) {
        return loadTranslation(translationId)
                .zipWith(loadActor(actorId))
                .flatMap(tuple -> {
                    Translation translation = tuple.getT1();
                    StaffUser actor = tuple.getT2();
                    if (!rolePolicy.canReviewTranslation(actor, translation.getReviewerId())) {
                        return Mono.error(new AccessDeniedException(
                                "Staff %d may not review translation %d".formatted(actorId, translationId)));
                    }
                    TranslationStatus status = translation.statusValue();
                    if (status == TranslationStatus.APPROVED) {
                        return Mono.error(new AlreadyTerminalException("Translation", translationId, status));
                    }
                    if (status != TranslationStatus.NEEDS_REVIEW) {
                        return Mono.error(new InvalidTransitionException("Translation", status, "review"));
                    }
                    if (!approve && isBlank(notes)) {
                        return Mono.error(new ValidationFailedException("notes", "A reason is required to reject a translation"));
                    }
                    return approve
                            ? approveTranslation(translation, actorId, notes, originatingTaskId, metadataJson)
                            : rejectTranslation(translation, actorId, notes, originatingTaskId, metadataJson);
                });
    }

    private Mono<Translation> approveTranslation(Translation translation, Long actorId, String notes,
                                                 Long originatingTaskId, String metadataJson) {
        LocalDateTime now = LocalDateTime.now();
        translation.setStatus(TranslationStatus.APPROVED.name());
        translation.setReviewerId(actorId);
        translation.setReviewerNotes(notes);
        translation.setReviewedAt(now);
        translation.setApprovedAt(now);
        translation.setUpdatedAt(now);

        return saveTranslation(translation)
                .flatMap(saved -> storyRepository.compareAndSetStage(saved.getTranslatedStoryId(),
                                StoryStage.DRAFT.name(), StoryStage.APPROVED.name(), now)
                        .flatMap(updated -> updated == 0
                                ? Mono.<Translation>error(new StaleStateException(
                                        "Translated story %d is no longer a draft".formatted(saved.getTranslatedStoryId())))
                                : Mono.just(saved)))
                .flatMap(saved -> closeReviewStep(saved, actorId, originatingTaskId, metadataJson)
                        .then(auditService.logTranslationStatus(saved, TranslationStatus.NEEDS_REVIEW.name(), actorId, notes))
                        .then(evaluateReadiness(saved.getOriginalStoryId(), actorId))
                        .thenReturn(saved))
                .doOnNext(saved -> log.info("Translation {} ({}) approved by {}",
                        saved.getId(), saved.getTargetLanguage(), actorId));
    }

    private Mono<Translation> rejectTranslation(Translation translation, Long actorId, String notes,
                                                Long originatingTaskId, String metadataJson) {
        LocalDateTime now = LocalDateTime.now();
        translation.setStatus(TranslationStatus.REJECTED.name());
        translation.setReviewerId(actorId);
        translation.setReviewerNotes(notes);
        translation.setRejectionReason(notes);
        translation.setReviewedAt(now);
        translation.setRejectedAt(now);
        translation.setUpdatedAt(now);

        return saveTranslation(translation)
                .flatMap(saved -> closeReviewStep(saved, actorId, originatingTaskId, metadataJson)
                        .then(taskOrchestrator.createTask(NewTask.builder()
                                .type(TaskType.STORY_TRANSLATE)
                                .content(ContentRef.story(saved.getOriginalStoryId()))
                                .assigneeId(saved.getAssignedToId())
                                .createdById(actorId)
                                .targetLanguage(saved.getTargetLanguage())
                                .description(notes)
                                .build()))
                        .then(auditService.logTranslationStatus(saved, TranslationStatus.NEEDS_REVIEW.name(), actorId, notes))
                        .thenReturn(saved))
                .doOnNext(saved -> log.info("Translation {} ({}) rejected by {}",
                        saved.getId(), saved.getTargetLanguage(), actorId));
    }

    private Mono<Void> closeReviewStep(Translation translation, Long actorId, Long originatingTaskId, String metadataJson) {
        return taskOrchestrator.closeStep(ContentRef.story(translation.getOriginalStoryId()),
                List.of(TaskType.STORY_TRANSLATION_REVIEW.stepKey(translation.getTargetLanguage(), null)),
                actorId, originatingTaskId, metadataJson);
    }

    /**
     * Moves the original to TRANSLATED once every assignment is approved. Safe to
     * call repeatedly.
     */
    public Mono<Boolean> evaluateReadiness(Long originalStoryId, Long triggeredBy) {
        return translationRepository.findByOriginalStoryId(originalStoryId)
                .all(Translation::isApproved)
                .flatMap(allApproved -> allApproved
                        ? storyWorkflowService.advanceWhenTranslated(originalStoryId, triggeredBy)
                        : Mono.just(false));
    }

    /** Points an assignment at a new translator when its task is reassigned. */
    public Mono<Void> reassignTranslator(Long originalStoryId, String language, Long translatorId) {
        return translationRepository.findByOriginalStoryIdAndTargetLanguage(originalStoryId, language)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException(
                        "No %s translation for story %d".formatted(language, originalStoryId))))
                .flatMap(translation -> {
                    if (translation.isApproved()) {
                        return Mono.error(new AlreadyTerminalException("Translation", translation.getId(),
                                translation.getStatus()));
                    }
                    translation.setAssignedToId(translatorId);
                    translation.setUpdatedAt(LocalDateTime.now());
                    return saveTranslation(translation);
                })
                .then();
    }

    public Mono<Translation> getTranslation(Long translationId) {
        return loadTranslation(translationId);
    }

    public Mono<Translation> findAssignment(Long originalStoryId, String language) {
        return translationRepository.findByOriginalStoryIdAndTargetLanguage(originalStoryId, language)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException(
                        "No %s translation for story %d".formatted(language, originalStoryId))));
    }

    public Flux<Translation> translationsForStory(Long originalStoryId) {
        return translationRepository.findByOriginalStoryId(originalStoryId);
    }

    public Flux<Translation> translationsForTranslator(Long translatorId) {
        return translationRepository.findByTranslator(translatorId);
    }

    private Mono<Translation> saveTranslation(Translation translation) {
        return translationRepository.save(translation)
                .onErrorMap(OptimisticLockingFailureException.class, e -> new StaleStateException(
                        "Translation %d was modified concurrently".formatted(translation.getId()), e));
    }

    private Mono<Translation> loadTranslation(Long translationId) {
        return translationRepository.findById(translationId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Translation", "id", translationId)));
    }

    private Mono<Story> loadStory(Long storyId) {
        return storyRepository.findById(storyId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Story", "id", storyId)));
    }

    private Mono<StaffUser> loadActor(Long actorId) {
        return staffUserRepository.findById(actorId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Staff", "id", actorId)));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
