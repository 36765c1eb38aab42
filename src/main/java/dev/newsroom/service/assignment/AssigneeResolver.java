package dev.newsroom.service.assignment;

import dev.newsroom.entity.StaffRole;
import dev.newsroom.entity.StaffUser;
import dev.newsroom.entity.TaskType;
import dev.newsroom.exception.ResourceNotFoundException;
import dev.newsroom.exception.ValidationFailedException;
import dev.newsroom.repository.StaffUserRepository;
import dev.newsroom.service.workflow.RolePolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.Set;

/**
 * Finds role-appropriate candidates for a task and hands them to the configured
 * {@link AssigneeSelectionStrategy}. Reads only; no locking.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssigneeResolver {

    private final StaffUserRepository staffUserRepository;
    private final RolePolicy rolePolicy;
    private final AssigneeSelectionStrategy selectionStrategy;

    /**
     * Active staff eligible for a task of this type. A target language restricts
     * the pool to translators of that language.
     */
    public Flux<StaffUser> candidates(TaskType type, String targetLanguage) {
        if (type == TaskType.STORY_TRANSLATE && targetLanguage != null) {
            return staffUserRepository.findActiveTranslators(targetLanguage);
        }
        Set<StaffRole> roles = type == TaskType.STORY_TRANSLATE
                ? rolePolicy.dispatcherRoles()
                : rolePolicy.candidateRoles(type);
        return staffUserRepository.findActiveByRoles(StaffRole.names(roles));
    }

    /**
     * Picks an assignee, skipping the excluded staff (typically the author).
     * Completes empty when nobody qualifies.
     */
    public Mono<Long> pick(TaskType type, String targetLanguage, Collection<Long> excludedIds) {
        return candidates(type, targetLanguage)
                .filter(staff -> !excludedIds.contains(staff.getId()))
                .collectList()
                .flatMap(list -> selectionStrategy.select(type, list))
                .doOnNext(id -> log.debug("Resolved assignee {} for {} {}", id, type, targetLanguage != null ? targetLanguage : ""));
    }

    /**
     * Keeps the preferred staff member when they are still eligible, otherwise picks.
     */
    public Mono<Long> preferOrPick(Long preferredId, TaskType type, String targetLanguage, Collection<Long> excludedIds) {
        if (preferredId == null) {
            return pick(type, targetLanguage, excludedIds);
        }
        return staffUserRepository.findById(preferredId)
                .filter(staff -> !excludedIds.contains(staff.getId()) && isEligible(staff, type, targetLanguage))
                .map(StaffUser::getId)
                .switchIfEmpty(Mono.defer(() -> pick(type, targetLanguage, excludedIds)));
    }

    /**
     * Loads an explicitly chosen assignee and checks they fit the task type.
     */
    public Mono<StaffUser> requireEligible(Long staffId, TaskType type, String targetLanguage) {
        return staffUserRepository.findById(staffId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Staff", "id", staffId)))
                .flatMap(staff -> isEligible(staff, type, targetLanguage)
                        ? Mono.just(staff)
                        : Mono.error(new ValidationFailedException("assigneeId",
                                "Staff %d is not eligible for %s tasks".formatted(staffId, type))));
    }

    public boolean isEligible(StaffUser staff, TaskType type, String targetLanguage) {
        if (!staff.isActiveStaff() || staff.role() == null) {
            return false;
        }
        if (type == TaskType.STORY_TRANSLATE && targetLanguage != null) {
            return targetLanguage.equals(staff.getTranslationLanguage());
        }
        Set<StaffRole> roles = type == TaskType.STORY_TRANSLATE
                ? rolePolicy.dispatcherRoles()
                : rolePolicy.candidateRoles(type);
        return roles.contains(staff.role());
    }
}
