package dev.newsroom.service;

import dev.newsroom.dto.GroupPublishResponse;
import dev.newsroom.entity.ContentRef;
import dev.newsroom.entity.StaffUser;
import dev.newsroom.entity.Story;
import dev.newsroom.entity.StoryStage;
import dev.newsroom.entity.TaskType;
import dev.newsroom.entity.Translation;
import dev.newsroom.exception.AlreadyTerminalException;
import dev.newsroom.exception.InvalidTransitionException;
import dev.newsroom.exception.ResourceNotFoundException;
import dev.newsroom.exception.StaleStateException;
import dev.newsroom.metrics.NewsroomMetrics;
import dev.newsroom.repository.StaffUserRepository;
import dev.newsroom.repository.StoryRepository;
import dev.newsroom.repository.TranslationRepository;
import dev.newsroom.service.workflow.RolePolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Publishes an original story together with all of its approved translations.
 * Either every member of the group becomes PUBLISHED or none does.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GroupPublishService {

    private final StoryRepository storyRepository;
    private final TranslationRepository translationRepository;
    private final StaffUserRepository staffUserRepository;
    private final RolePolicy rolePolicy;
    private final TaskOrchestrator taskOrchestrator;
    private final AuditService auditService;
    private final NewsroomMetrics newsroomMetrics;

    /**
     * True when the original is TRANSLATED and every translation assignment is approved.
     */
    public Mono<Boolean> isGroupReady(Long originalStoryId) {
        return loadStory(originalStoryId)
                .flatMap(original -> {
                    if (original.isTranslationItem() || !original.isInStage(StoryStage.TRANSLATED)) {
                        return Mono.just(false);
                    }
                    return translationRepository.findByOriginalStoryId(originalStoryId).all(Translation::isApproved);
                });
    }

    @Transactional
    public Mono<GroupPublishResponse> publishGroup(Long originalStoryId, Long actorId) {
        return publishGroup(originalStoryId, actorId, null, null);
    }

    /**
     * Publishes the group. The original must be TRANSLATED and each translated story
     * APPROVED; a concurrent change to any member aborts the whole publish.
     */
    @Transactional
    public Mono<GroupPublishResponse> publishGroup(Long originalStoryId, Long actorId,
                                                   Long originatingTaskId, String metadataJson) {
        return loadActor(actorId)
                .flatMap(actor -> rolePolicy.canPublish(actor)
                        ? loadStory(originalStoryId)
                        : Mono.<Story>error(new AccessDeniedException(
                                "Staff %d may not publish stories".formatted(actorId))))
                .flatMap(original -> {
                    if (original.isTranslationItem()) {
                        return Mono.error(new InvalidTransitionException(
                                "Story %d is a translation; publish its original instead".formatted(originalStoryId)));
                    }
                    if (original.stageValue() == StoryStage.PUBLISHED) {
                        return Mono.error(new AlreadyTerminalException("Story", originalStoryId, original.getStage()));
                    }
                    if (!original.isInStage(StoryStage.TRANSLATED)) {
                        return Mono.error(new InvalidTransitionException("Story", original.getStage(), "publish"));
                    }
                    return loadMembers(originalStoryId)
                            .flatMap(memberIds -> publish(originalStoryId, memberIds, actorId,
                                    originatingTaskId, metadataJson));
                });
    }

    private Mono<List<Long>> loadMembers(Long originalStoryId) {
        return translationRepository.findByOriginalStoryId(originalStoryId)
                .collectList()
                .flatMap(translations -> {
                    for (Translation translation : translations) {
                        if (!translation.isApproved() || translation.getTranslatedStoryId() == null) {
                            return Mono.error(new InvalidTransitionException(
                                    "%s translation of story %d is %s, not approved".formatted(
                                            translation.getTargetLanguage(), originalStoryId, translation.getStatus())));
                        }
                    }
                    List<Long> ids = translations.stream().map(Translation::getTranslatedStoryId).toList();
                    return storyRepository.findAllById(ids)
                            .collectList()
                            .flatMap(members -> {
                                if (members.size() != ids.size()) {
                                    return Mono.error(new StaleStateException(
                                            "Translated stories of %d changed concurrently".formatted(originalStoryId)));
                                }
                                for (Story member : members) {
                                    if (!member.isInStage(StoryStage.APPROVED)) {
                                        return Mono.error(new InvalidTransitionException(
                                                "Translated story %d is %s, not APPROVED".formatted(
                                                        member.getId(), member.getStage())));
                                    }
                                }
                                return Mono.just(ids);
                            });
                });
    }

    private Mono<GroupPublishResponse> publish(Long originalStoryId, List<Long> memberIds, Long actorId,
                                               Long originatingTaskId, String metadataJson) {
        LocalDateTime now = LocalDateTime.now();
        return storyRepository.publishOriginal(originalStoryId, StoryStage.TRANSLATED.name(), now, actorId)
                .flatMap(updated -> updated == 1
                        ? publishMembers(memberIds, now, actorId)
                        : Mono.<Void>error(new StaleStateException(
                                "Story %d left TRANSLATED before it could be published".formatted(originalStoryId))))
                .then(Mono.defer(() -> taskOrchestrator.closeStep(ContentRef.story(originalStoryId),
                        List.of(TaskType.STORY_PUBLISH.step()), actorId, originatingTaskId, metadataJson)))
                .then(Mono.defer(() -> auditService.logGroupPublished(originalStoryId, memberIds.size(), actorId)))
                .then(Mono.fromCallable(() -> GroupPublishResponse.builder()
                        .originalStoryId(String.valueOf(originalStoryId))
                        .translatedStoryIds(memberIds.stream().map(String::valueOf).toList())
                        .publishedAt(now)
                        .publishedBy(String.valueOf(actorId))
                        .build()))
                .doOnNext(response -> {
                    newsroomMetrics.recordGroupPublished();
                    log.info("Published story {} with {} translation(s) by {}",
                            originalStoryId, memberIds.size(), actorId);
                });
    }

    private Mono<Void> publishMembers(List<Long> memberIds, LocalDateTime now, Long actorId) {
        if (memberIds.isEmpty()) {
            return Mono.empty();
        }
        return storyRepository.publishTranslations(memberIds, now, actorId)
                .flatMap(updated -> updated == memberIds.size()
                        ? Mono.<Void>empty()
                        : Mono.<Void>error(new StaleStateException(
                                "Only %d of %d translated stories could be published".formatted(updated, memberIds.size()))));
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
