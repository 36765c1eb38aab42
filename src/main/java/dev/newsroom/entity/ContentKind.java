package dev.newsroom.entity;

/**
 * Kinds of content a task can point at.
 */
public enum ContentKind {
    STORY,
    BULLETIN,
    SHOW;

    public boolean matches(String kind) {
        return this.name().equals(kind);
    }
}
