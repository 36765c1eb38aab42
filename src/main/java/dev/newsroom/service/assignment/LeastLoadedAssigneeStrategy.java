package dev.newsroom.service.assignment;

import dev.newsroom.entity.StaffUser;
import dev.newsroom.entity.TaskType;
import dev.newsroom.repository.TaskWorkloadRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;

/**
 * Picks the candidate with the fewest open tasks; ties go to the lowest id.
 * Counts come from a single grouped query.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "newsroom.workflow.assignment-strategy", havingValue = "least-loaded", matchIfMissing = true)
public class LeastLoadedAssigneeStrategy implements AssigneeSelectionStrategy {

    private final TaskWorkloadRepository taskWorkloadRepository;

    @Override
    public Mono<Long> select(TaskType type, List<StaffUser> candidates) {
        if (candidates.isEmpty()) {
            return Mono.empty();
        }
        List<Long> ids = candidates.stream().map(StaffUser::getId).toList();
        return taskWorkloadRepository.countOpenTasksByAssignee(ids)
                .flatMap(load -> Mono.justOrEmpty(ids.stream()
                        .min(Comparator.<Long>comparingLong(id -> load.getOrDefault(id, 0L))
                                .thenComparing(Comparator.naturalOrder()))))
                .doOnNext(id -> log.debug("Least-loaded pick for {}: staff {}", type, id));
    }
}
