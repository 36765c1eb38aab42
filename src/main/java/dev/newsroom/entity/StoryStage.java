package dev.newsroom.entity;

import java.util.Arrays;

/**
 * Pipeline stages of a story. Translated items only ever use
 * {@link #DRAFT}, {@link #APPROVED} and {@link #PUBLISHED}.
 */
public enum StoryStage {
    DRAFT,
    NEEDS_JOURNALIST_REVIEW,
    NEEDS_SUB_EDITOR_APPROVAL,
    APPROVED,
    TRANSLATED,
    PUBLISHED;

    public boolean matches(String stage) {
        return this.name().equals(stage);
    }

    public boolean isTerminal() {
        return this == PUBLISHED;
    }

    public static StoryStage from(String stage) {
        if (stage == null) {
            return null;
        }
        return Arrays.stream(values())
                .filter(s -> s.matches(stage))
                .findFirst()
                .orElse(null);
    }
}
