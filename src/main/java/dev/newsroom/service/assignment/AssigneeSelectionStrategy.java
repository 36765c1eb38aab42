package dev.newsroom.service.assignment;

import dev.newsroom.entity.StaffUser;
import dev.newsroom.entity.TaskType;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Chooses one assignee among already-filtered candidates. Completes empty when
 * the list is empty.
 */
public interface AssigneeSelectionStrategy {

    Mono<Long> select(TaskType type, List<StaffUser> candidates);
}
