package dev.newsroom.entity;

import java.util.Objects;

/**
 * Typed reference from a task to the content it concerns. Exactly one kind of
 * content is referenced; the variants replace a set of nullable foreign keys.
 */
public sealed interface ContentRef permits ContentRef.StoryRef, ContentRef.BulletinRef, ContentRef.ShowRef {

    ContentKind kind();

    Long id();

    record StoryRef(Long id) implements ContentRef {
        public StoryRef {
            Objects.requireNonNull(id, "story id");
        }

        @Override
        public ContentKind kind() {
            return ContentKind.STORY;
        }
    }

    record BulletinRef(Long id) implements ContentRef {
        public BulletinRef {
            Objects.requireNonNull(id, "bulletin id");
        }

        @Override
        public ContentKind kind() {
            return ContentKind.BULLETIN;
        }
    }

    record ShowRef(Long id) implements ContentRef {
        public ShowRef {
            Objects.requireNonNull(id, "show id");
        }

        @Override
        public ContentKind kind() {
            return ContentKind.SHOW;
        }
    }

    static ContentRef story(Long id) {
        return new StoryRef(id);
    }

    static ContentRef of(ContentKind kind, Long id) {
        return switch (kind) {
            case STORY -> new StoryRef(id);
            case BULLETIN -> new BulletinRef(id);
            case SHOW -> new ShowRef(id);
        };
    }
}
