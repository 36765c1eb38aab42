package dev.newsroom.repository;

import dev.newsroom.entity.Task;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Collection;

/**
 * Status changes on existing tasks are conditional UPDATEs; a zero row count means
 * the task left the expected status in the meantime.
 */
@Repository
public interface TaskRepository extends ReactiveCrudRepository<Task, Long> {

    String OPEN_STATUSES = "('PENDING', 'IN_PROGRESS', 'BLOCKED', 'PENDING_ASSIGNMENT')";

    @Query("SELECT * FROM tasks WHERE content_type = :contentType AND content_id = :contentId " +
           "AND step_key IN (:stepKeys) AND status IN " + OPEN_STATUSES)
    Flux<Task> findOpenByContentAndSteps(String contentType, Long contentId, Collection<String> stepKeys);

    @Query("SELECT * FROM tasks WHERE content_type = :contentType AND content_id = :contentId " +
           "AND status IN " + OPEN_STATUSES)
    Flux<Task> findOpenByContent(String contentType, Long contentId);

    @Query("SELECT COUNT(*) > 0 FROM tasks WHERE content_type = :contentType AND content_id = :contentId " +
           "AND step_key = :stepKey AND status IN " + OPEN_STATUSES)
    Mono<Boolean> existsOpenStep(String contentType, Long contentId, String stepKey);

    @Query("SELECT * FROM tasks WHERE content_type = :contentType AND content_id = :contentId ORDER BY created_at ASC")
    Flux<Task> findByContent(String contentType, Long contentId);

    @Query("SELECT * FROM tasks WHERE assigned_to_id = :assigneeId ORDER BY created_at DESC LIMIT :limit OFFSET :offset")
    Flux<Task> findByAssignee(Long assigneeId, int limit, int offset);

    @Query("SELECT * FROM tasks WHERE assigned_to_id = :assigneeId AND status = :status " +
           "ORDER BY created_at DESC LIMIT :limit OFFSET :offset")
    Flux<Task> findByAssigneeAndStatus(Long assigneeId, String status, int limit, int offset);

    @Query("SELECT * FROM tasks WHERE status = 'PENDING_ASSIGNMENT' ORDER BY created_at ASC")
    Flux<Task> findUnassigned();

    @Modifying
    @Query("UPDATE tasks SET status = 'COMPLETED', completed_at = :now, updated_at = :now, " +
           "metadata = COALESCE(:metadata, metadata) " +
           "WHERE id = :id AND status IN ('PENDING', 'IN_PROGRESS')")
    Mono<Integer> completeIfOpen(Long id, String metadata, LocalDateTime now);

    @Modifying
    @Query("UPDATE tasks SET status = 'CANCELLED', updated_at = :now WHERE id = :id AND status IN " + OPEN_STATUSES)
    Mono<Integer> cancelIfOpen(Long id, LocalDateTime now);

    @Modifying
    @Query("UPDATE tasks SET status = 'IN_PROGRESS', updated_at = :now WHERE id = :id AND status = 'PENDING'")
    Mono<Integer> startIfPending(Long id, LocalDateTime now);

    @Modifying
    @Query("UPDATE tasks SET assigned_to_id = :assigneeId, " +
           "status = CASE WHEN status = 'PENDING_ASSIGNMENT' THEN 'PENDING' ELSE status END, " +
           "metadata = :metadata, updated_at = :now " +
           "WHERE id = :id AND status IN " + OPEN_STATUSES)
    Mono<Integer> reassignIfOpen(Long id, Long assigneeId, String metadata, LocalDateTime now);
}
