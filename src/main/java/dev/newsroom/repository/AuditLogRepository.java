package dev.newsroom.repository;

import dev.newsroom.entity.AuditLog;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.time.LocalDateTime;

@Repository
public interface AuditLogRepository extends ReactiveCrudRepository<AuditLog, Long> {

    Flux<AuditLog> findByEntityTypeAndEntityIdOrderByCreatedAtAsc(String entityType, String entityId);

    @Query("SELECT * FROM audit_logs WHERE created_at >= :since ORDER BY created_at DESC LIMIT :limit")
    Flux<AuditLog> findRecentLogs(LocalDateTime since, int limit);
}
