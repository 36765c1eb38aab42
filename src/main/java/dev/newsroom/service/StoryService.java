package dev.newsroom.service;

import dev.newsroom.dto.AuditEntryResponse;
import dev.newsroom.dto.StoryRequest;
import dev.newsroom.dto.StoryResponse;
import dev.newsroom.entity.ContentRef;
import dev.newsroom.entity.StaffUser;
import dev.newsroom.entity.Story;
import dev.newsroom.entity.StoryLanguage;
import dev.newsroom.entity.StoryStage;
import dev.newsroom.entity.TaskType;
import dev.newsroom.exception.AlreadyTerminalException;
import dev.newsroom.exception.InvalidTransitionException;
import dev.newsroom.exception.ResourceNotFoundException;
import dev.newsroom.exception.StaleStateException;
import dev.newsroom.exception.ValidationFailedException;
import dev.newsroom.repository.StaffUserRepository;
import dev.newsroom.repository.StoryAudioRepository;
import dev.newsroom.repository.StoryRepository;
import dev.newsroom.repository.TranslationRepository;
import dev.newsroom.service.workflow.RolePolicy;
import dev.newsroom.util.SlugUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Story records outside of stage changes: creation, draft edits, deletion and reads.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StoryService {

    private static final int MAX_PAGE_SIZE = 100;

    private final StoryRepository storyRepository;
    private final StaffUserRepository staffUserRepository;
    private final TranslationRepository translationRepository;
    private final StoryAudioRepository storyAudioRepository;
    private final RolePolicy rolePolicy;
    private final TaskOrchestrator taskOrchestrator;
    private final AuditService auditService;
    private final IdService idService;

    /**
     * Creates an original story in DRAFT and opens the authoring task for its author.
     */
    @Transactional
    public Mono<StoryResponse> createStory(StoryRequest request, Long actorId) {
        StoryLanguage language = request.getLanguage() == null || request.getLanguage().isBlank()
                ? StoryLanguage.ENGLISH
                : StoryLanguage.parse(request.getLanguage()).orElse(null);
        if (language == null) {
            return Mono.error(new ValidationFailedException("language", "Unsupported language: " + request.getLanguage()));
        }
        List<Long> clipIds = request.getAudioClipIds() != null ? request.getAudioClipIds() : List.of();

        return loadActor(actorId)
                .flatMap(author -> {
                    if (!author.isActiveStaff()) {
                        return Mono.error(new AccessDeniedException("Inactive staff cannot create stories"));
                    }
                    return resolveUniqueSlug(SlugUtils.slugify(request.getTitle()))
                            .flatMap(slug -> {
                                LocalDateTime now = LocalDateTime.now();
                                Story story = Story.builder()
                                        .id(idService.nextId())
                                        .slug(slug)
                                        .title(request.getTitle().trim())
                                        .content(request.getContent())
                                        .stage(StoryStage.DRAFT.name())
                                        .language(language.name())
                                        .translation(false)
                                        .categoryId(request.getCategoryId())
                                        .authorId(author.getId())
                                        .authorRole(author.getStaffRole())
                                        .createdAt(now)
                                        .updatedAt(now)
                                        .build();
                                return storyRepository.save(story);
                            });
                })
                .flatMap(saved -> storyAudioRepository.linkClips(saved.getId(), clipIds)
                        .then(auditService.logStoryCreated(saved.getId(), saved.getSlug(), actorId))
                        .then(taskOrchestrator.openStoryStep(saved, TaskType.STORY_CREATE, actorId, null))
                        .thenReturn(saved))
                .map(saved -> StoryResponse.from(saved).withAudioClipIds(clipIds))
                .doOnNext(response -> log.info("Story created: {} by {}", response.getSlug(), actorId));
    }

    private Mono<String> resolveUniqueSlug(String slug) {
        return storyRepository.existsBySlug(slug)
                .map(exists -> {
                    if (!exists) {
                        return slug;
                    }
                    String suffixed = slug + "-" + UUID.randomUUID().toString().substring(0, 6);
                    log.info("Slug '{}' already exists, using '{}'", slug, suffixed);
                    return suffixed;
                });
    }

    public Mono<StoryResponse> getStory(Long storyId) {
        return loadStory(storyId)
                .flatMap(story -> audioClipIds(story).collectList()
                        .map(clips -> StoryResponse.from(story).withAudioClipIds(clips)));
    }

    public Flux<StoryResponse> storiesByAuthor(Long authorId, int page, int size) {
        int limit = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        return storyRepository.findByAuthor(authorId, limit, Math.max(page, 0) * limit)
                .map(StoryResponse::from);
    }

    public Flux<StoryResponse> translationsOf(Long originalStoryId) {
        return storyRepository.findByOriginalStoryId(originalStoryId).map(StoryResponse::from);
    }

    /**
     * Audio clips of a story. Translated items share the clips of their original.
     */
    public Flux<Long> audioClipIds(Long storyId) {
        return loadStory(storyId).flatMapMany(this::audioClipIds);
    }

    private Flux<Long> audioClipIds(Story story) {
        Long owner = story.isTranslationItem() ? story.getOriginalStoryId() : story.getId();
        return storyAudioRepository.findClipIds(owner);
    }

    /**
     * Edits an original story while it is a DRAFT. Translated drafts are edited
     * through their translation assignment.
     */
    @Transactional
    public Mono<StoryResponse> updateDraft(Long storyId, StoryRequest request, Long actorId) {
        return Mono.zip(loadStory(storyId), loadActor(actorId))
                .flatMap(tuple -> {
                    Story story = tuple.getT1();
                    StaffUser actor = tuple.getT2();
                    if (story.isTranslationItem()) {
                        return Mono.error(new InvalidTransitionException(
                                "Translated story %d is edited through its translation".formatted(storyId)));
                    }
                    if (!rolePolicy.canEditDraft(actor, story)) {
                        return Mono.error(new AccessDeniedException(
                                "Staff %d may not edit story %d".formatted(actorId, storyId)));
                    }
                    if (!story.isInStage(StoryStage.DRAFT)) {
                        return Mono.error(new InvalidTransitionException("Story", story.getStage(), "edit draft"));
                    }
                    String title = request.getTitle().trim();
                    return storyRepository.updateDraftContent(storyId, title, request.getContent(), request.getCategoryId())
                            .flatMap(updated -> updated == 0
                                    ? Mono.<Story>error(new StaleStateException(
                                            "Story %d left DRAFT while being edited".formatted(storyId)))
                                    : Mono.just(story))
                            .flatMap(unused -> replaceAudio(storyId, request.getAudioClipIds()))
                            .then(auditService.logStoryUpdated(storyId, actorId))
                            .then(Mono.defer(() -> getStory(storyId)));
                })
                .doOnNext(response -> log.info("Story {} draft updated by {}", storyId, actorId));
    }

    private Mono<Void> replaceAudio(Long storyId, List<Long> clipIds) {
        if (clipIds == null) {
            return Mono.empty();
        }
        return storyAudioRepository.deleteByStoryId(storyId)
                .then(storyAudioRepository.linkClips(storyId, clipIds));
    }

    /**
     * Deletes an unpublished original with its translations, audio links and open tasks.
     */
    @Transactional
    public Mono<Void> deleteStory(Long storyId, Long actorId) {
        return Mono.zip(loadStory(storyId), loadActor(actorId))
                .flatMap(tuple -> {
                    Story story = tuple.getT1();
                    StaffUser actor = tuple.getT2();
                    if (!rolePolicy.canDeleteStory(actor)) {
                        return Mono.error(new AccessDeniedException(
                                "Staff %d may not delete stories".formatted(actorId)));
                    }
                    if (story.isTranslationItem()) {
                        return Mono.error(new InvalidTransitionException(
                                "Translated story %d is deleted with its original".formatted(storyId)));
                    }
                    if (story.stageValue() == StoryStage.PUBLISHED) {
                        return Mono.error(new AlreadyTerminalException("Story", storyId, story.getStage()));
                    }
                    return translationRepository.findByOriginalStoryId(storyId)
                            .filter(translation -> !translation.isApproved())
                            .hasElements()
                            .flatMap(inFlight -> inFlight
                                    ? Mono.<Void>error(new InvalidTransitionException(
                                            "Story %d has translations still in progress".formatted(storyId)))
                                    : taskOrchestrator.cancelAllOpen(ContentRef.story(storyId), actorId))
                            .then(Mono.defer(() -> translationRepository.deleteByOriginalStoryId(storyId)))
                            .then(Mono.defer(() -> storyRepository.deleteTranslationsOf(storyId)))
                            .then(Mono.defer(() -> storyAudioRepository.deleteByStoryId(storyId)))
                            .then(Mono.defer(() -> storyRepository.deleteById(storyId)))
                            .then(Mono.defer(() -> auditService.logStoryDeleted(storyId, story.getSlug(),
                                    story.getStage(), actorId)))
                            .doOnSuccess(v -> log.info("Story {} deleted by {}", storyId, actorId));
                });
    }

    public Flux<AuditEntryResponse> history(Long storyId) {
        return loadStory(storyId)
                .flatMapMany(story -> auditService.getStoryHistory(storyId))
                .map(AuditEntryResponse::from);
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
