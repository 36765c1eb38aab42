package dev.newsroom.entity;

import java.util.Arrays;
import java.util.List;

public enum TaskStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED,
    BLOCKED,
    PENDING_ASSIGNMENT;

    /** Statuses that still occupy a workflow step. */
    public static final List<String> OPEN = List.of(
            PENDING.name(), IN_PROGRESS.name(), BLOCKED.name(), PENDING_ASSIGNMENT.name());

    public boolean matches(String status) {
        return this.name().equals(status);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    public boolean isCompletable() {
        return this == PENDING || this == IN_PROGRESS;
    }

    public static TaskStatus from(String status) {
        return Arrays.stream(values())
                .filter(s -> s.matches(status))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Unknown task status: " + status));
    }
}
