package dev.newsroom.service.assignment;

import dev.newsroom.entity.StaffUser;
import dev.newsroom.entity.TaskType;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Rotates through candidates in id order, keeping one cursor per task type.
 * Cursors live in memory, so rotation restarts with the process.
 */
@Component
@ConditionalOnProperty(name = "newsroom.workflow.assignment-strategy", havingValue = "round-robin")
public class RoundRobinAssigneeStrategy implements AssigneeSelectionStrategy {

    private final Map<TaskType, AtomicInteger> cursors = new ConcurrentHashMap<>();

    @Override
    public Mono<Long> select(TaskType type, List<StaffUser> candidates) {
        if (candidates.isEmpty()) {
            return Mono.empty();
        }
        List<Long> ordered = candidates.stream()
                .map(StaffUser::getId)
                .sorted(Comparator.naturalOrder())
                .toList();
        int next = cursors.computeIfAbsent(type, t -> new AtomicInteger()).getAndIncrement();
        return Mono.just(ordered.get(Math.floorMod(next, ordered.size())));
    }
}
