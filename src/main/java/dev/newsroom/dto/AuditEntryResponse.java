package dev.newsroom.dto;

import dev.newsroom.entity.AuditLog;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEntryResponse {
    private String action;
    private String performedBy;
    private String fromState;
    private String toState;
    private String details;
    private LocalDateTime createdAt;

    public static AuditEntryResponse from(AuditLog log) {
        return AuditEntryResponse.builder()
                .action(log.getAction())
                .performedBy(StoryResponse.toStr(log.getPerformedBy()))
                .fromState(log.getFromState())
                .toState(log.getToState())
                .details(log.getDetails())
                .createdAt(log.getCreatedAt())
                .build();
    }
}
