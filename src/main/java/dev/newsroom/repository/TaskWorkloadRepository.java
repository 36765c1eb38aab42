package dev.newsroom.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.Map;

/**
 * Aggregate reads over open tasks, kept out of {@link TaskRepository} because they
 * return projections rather than entities.
 */
@Repository
@RequiredArgsConstructor
public class TaskWorkloadRepository {

    private final R2dbcEntityTemplate r2dbcTemplate;

    private static final String OPEN_TASKS_BY_ASSIGNEE =
            "SELECT assigned_to_id, COUNT(*) AS cnt FROM tasks " +
            "WHERE assigned_to_id IN (:ids) AND status IN ('PENDING', 'IN_PROGRESS', 'BLOCKED') " +
            "GROUP BY assigned_to_id";

    /**
     * Counts open tasks per assignee. Staff with no open tasks are absent from the map.
     */
    public Mono<Map<Long, Long>> countOpenTasksByAssignee(Collection<Long> staffIds) {
        if (staffIds.isEmpty()) {
            return Mono.just(Map.of());
        }
        return r2dbcTemplate.getDatabaseClient()
                .sql(OPEN_TASKS_BY_ASSIGNEE)
                .bind("ids", staffIds)
                .map((row, meta) -> Map.entry(
                        row.get("assigned_to_id", Long.class),
                        row.get("cnt", Long.class)))
                .all()
                .collectMap(Map.Entry::getKey, Map.Entry::getValue);
    }
}
