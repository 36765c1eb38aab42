package dev.newsroom.entity;

import java.util.Arrays;
import java.util.Optional;

/**
 * Task types. Each type knows the content kind it applies to, the stage its story
 * sits in while the task is open (used for due dates), and the workflow step it
 * occupies. Two types share a step when they represent the same slot in the
 * pipeline, e.g. the initial draft and a revision returned to the author.
 */
public enum TaskType {
    STORY_CREATE(ContentKind.STORY, StoryStage.DRAFT, "AUTHORING"),
    STORY_REVIEW(ContentKind.STORY, StoryStage.NEEDS_JOURNALIST_REVIEW, "REVIEW"),
    STORY_REVISION_TO_AUTHOR(ContentKind.STORY, StoryStage.DRAFT, "AUTHORING"),
    STORY_APPROVAL(ContentKind.STORY, StoryStage.NEEDS_SUB_EDITOR_APPROVAL, "APPROVAL"),
    STORY_REVISION_TO_JOURNALIST(ContentKind.STORY, StoryStage.NEEDS_JOURNALIST_REVIEW, "REVIEW"),
    STORY_TRANSLATE(ContentKind.STORY, StoryStage.APPROVED, "TRANSLATE"),
    STORY_TRANSLATION_REVIEW(ContentKind.STORY, StoryStage.APPROVED, "TRANSLATION_REVIEW"),
    STORY_PUBLISH(ContentKind.STORY, StoryStage.TRANSLATED, "PUBLISH"),
    STORY_FOLLOW_UP(ContentKind.STORY, null, "FOLLOW_UP"),
    BULLETIN_CREATE(ContentKind.BULLETIN, null, "BULLETIN_CREATE"),
    BULLETIN_REVIEW(ContentKind.BULLETIN, null, "BULLETIN_REVIEW"),
    BULLETIN_PUBLISH(ContentKind.BULLETIN, null, "BULLETIN_PUBLISH"),
    SHOW_CREATE(ContentKind.SHOW, null, "SHOW_CREATE"),
    SHOW_REVIEW(ContentKind.SHOW, null, "SHOW_REVIEW"),
    SHOW_PUBLISH(ContentKind.SHOW, null, "SHOW_PUBLISH");

    private final ContentKind contentKind;
    private final StoryStage stage;
    private final String step;

    TaskType(ContentKind contentKind, StoryStage stage, String step) {
        this.contentKind = contentKind;
        this.stage = stage;
        this.step = step;
    }

    public ContentKind contentKind() {
        return contentKind;
    }

    public StoryStage stage() {
        return stage;
    }

    public String step() {
        return step;
    }

    public boolean matches(String type) {
        return this.name().equals(type);
    }

    /** Task types whose completion moves the story along the pre-translation pipeline. */
    public boolean isStageStep() {
        return this == STORY_CREATE || this == STORY_REVIEW || this == STORY_REVISION_TO_AUTHOR
                || this == STORY_APPROVAL || this == STORY_REVISION_TO_JOURNALIST;
    }

    /**
     * Key identifying the logical step a task of this type occupies. Translation
     * steps are qualified by language; follow-ups never collide.
     */
    public String stepKey(String targetLanguage, Long taskId) {
        if (this == STORY_FOLLOW_UP) {
            return step + ":" + taskId;
        }
        return targetLanguage != null ? step + ":" + targetLanguage : step;
    }

    /** Step key of the story-level task that belongs to the given stage, if any. */
    public static Optional<String> stepKeyForStage(StoryStage stage) {
        if (stage == null) {
            return Optional.empty();
        }
        return switch (stage) {
            case DRAFT -> Optional.of(STORY_CREATE.step);
            case NEEDS_JOURNALIST_REVIEW -> Optional.of(STORY_REVIEW.step);
            case NEEDS_SUB_EDITOR_APPROVAL -> Optional.of(STORY_APPROVAL.step);
            case APPROVED -> Optional.of(STORY_TRANSLATE.step);
            case TRANSLATED -> Optional.of(STORY_PUBLISH.step);
            case PUBLISHED -> Optional.empty();
        };
    }

    public static TaskType from(String type) {
        return Arrays.stream(values())
                .filter(t -> t.matches(type))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Unknown task type: " + type));
    }
}
