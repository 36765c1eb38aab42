package dev.newsroom.entity;

import java.util.Arrays;

/**
 * Status values for translation assignments.
 */
public enum TranslationStatus {
    PENDING,
    IN_PROGRESS,
    NEEDS_REVIEW,
    APPROVED,
    REJECTED;

    public boolean matches(String status) {
        return this.name().equals(status);
    }

    public static TranslationStatus from(String status) {
        return Arrays.stream(values())
                .filter(s -> s.matches(status))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Unknown translation status: " + status));
    }
}
