package dev.newsroom.service.workflow;

import dev.newsroom.entity.StoryStage;
import dev.newsroom.entity.TaskType;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Declared edges of the story stage graph. Each edge names its source and target
 * stage and the task type opened for whoever acts next.
 */
public enum StageTransition {
    SUBMIT_FOR_REVIEW(StoryStage.DRAFT, StoryStage.NEEDS_JOURNALIST_REVIEW, TaskType.STORY_REVIEW),
    SUBMIT_FOR_APPROVAL(StoryStage.DRAFT, StoryStage.NEEDS_SUB_EDITOR_APPROVAL, TaskType.STORY_APPROVAL),
    SEND_FOR_APPROVAL(StoryStage.NEEDS_JOURNALIST_REVIEW, StoryStage.NEEDS_SUB_EDITOR_APPROVAL, TaskType.STORY_APPROVAL),
    REVISE(StoryStage.NEEDS_JOURNALIST_REVIEW, StoryStage.DRAFT, TaskType.STORY_REVISION_TO_AUTHOR),
    APPROVE(StoryStage.NEEDS_SUB_EDITOR_APPROVAL, StoryStage.APPROVED, TaskType.STORY_TRANSLATE),
    SEND_BACK(StoryStage.NEEDS_SUB_EDITOR_APPROVAL, StoryStage.NEEDS_JOURNALIST_REVIEW, TaskType.STORY_REVISION_TO_JOURNALIST),
    RETURN_TO_AUTHOR(StoryStage.NEEDS_SUB_EDITOR_APPROVAL, StoryStage.DRAFT, TaskType.STORY_REVISION_TO_AUTHOR),
    MARK_TRANSLATED(StoryStage.APPROVED, StoryStage.TRANSLATED, TaskType.STORY_PUBLISH),
    PUBLISH(StoryStage.TRANSLATED, StoryStage.PUBLISHED, null);

    private final StoryStage from;
    private final StoryStage to;
    private final TaskType nextTask;

    StageTransition(StoryStage from, StoryStage to, TaskType nextTask) {
        this.from = from;
        this.to = to;
        this.nextTask = nextTask;
    }

    public StoryStage from() {
        return from;
    }

    public StoryStage to() {
        return to;
    }

    public Optional<TaskType> nextTask() {
        return Optional.ofNullable(nextTask);
    }

    /** Rejection edges send the story backwards and must carry a reason. */
    public boolean isRejection() {
        return this == REVISE || this == SEND_BACK || this == RETURN_TO_AUTHOR;
    }

    /** Fired by the engine itself, never requested by a person. */
    public boolean isSystemOnly() {
        return this == MARK_TRANSLATED;
    }

    /** Only reachable through group publish, which moves the translations too. */
    public boolean isGroupOnly() {
        return this == PUBLISH;
    }

    public static List<StageTransition> from(StoryStage stage) {
        return Arrays.stream(values())
                .filter(t -> t.from == stage)
                .toList();
    }
}
