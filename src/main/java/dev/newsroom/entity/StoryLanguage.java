package dev.newsroom.entity;

import java.util.Arrays;
import java.util.Optional;

public enum StoryLanguage {
    ENGLISH,
    AFRIKAANS,
    XHOSA;

    public boolean matches(String language) {
        return this.name().equals(language);
    }

    public static Optional<StoryLanguage> parse(String language) {
        if (language == null) {
            return Optional.empty();
        }
        String normalized = language.trim().toUpperCase();
        return Arrays.stream(values())
                .filter(l -> l.matches(normalized))
                .findFirst();
    }
}
