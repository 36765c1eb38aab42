package dev.newsroom.service.workflow;

import dev.newsroom.entity.StaffRole;
import dev.newsroom.entity.StoryStage;
import dev.newsroom.exception.InvalidTransitionException;

import java.util.Optional;

/**
 * Picks the stage edge for a task outcome. Intern-authored stories go through a
 * journalist review before approval; everyone else's drafts go straight to a
 * sub-editor, and a sub-editor's rejection routes back accordingly.
 */
public final class StageRouter {

    private StageRouter() {
    }

    public static Optional<StageTransition> nextEdge(StoryStage stage, StaffRole authorRole, TaskOutcome outcome) {
        if (stage == null || outcome == null) {
            return Optional.empty();
        }
        boolean internAuthored = authorRole == StaffRole.INTERN;
        StageTransition edge = switch (stage) {
            case DRAFT -> outcome == TaskOutcome.SUBMIT
                    ? (internAuthored ? StageTransition.SUBMIT_FOR_REVIEW : StageTransition.SUBMIT_FOR_APPROVAL)
                    : null;
            case NEEDS_JOURNALIST_REVIEW -> switch (outcome) {
                case APPROVE -> StageTransition.SEND_FOR_APPROVAL;
                case REVISE -> StageTransition.REVISE;
                default -> null;
            };
            case NEEDS_SUB_EDITOR_APPROVAL -> switch (outcome) {
                case APPROVE -> StageTransition.APPROVE;
                case REVISE -> internAuthored ? StageTransition.SEND_BACK : StageTransition.RETURN_TO_AUTHOR;
                default -> null;
            };
            case APPROVED, TRANSLATED, PUBLISHED -> null;
        };
        return Optional.ofNullable(edge);
    }

    public static StageTransition requireEdge(StoryStage stage, StaffRole authorRole, TaskOutcome outcome) {
        return nextEdge(stage, authorRole, outcome)
                .orElseThrow(() -> new InvalidTransitionException("Story", stage, outcome));
    }

    /**
     * Whether the edge is the one routing picks for stories by this author.
     * SEND_BACK and SUBMIT_FOR_REVIEW only exist for intern-authored stories.
     */
    public static boolean appliesTo(StageTransition transition, StaffRole authorRole) {
        boolean internAuthored = authorRole == StaffRole.INTERN;
        return switch (transition) {
            case SUBMIT_FOR_REVIEW, SEND_BACK -> internAuthored;
            case SUBMIT_FOR_APPROVAL, RETURN_TO_AUTHOR -> !internAuthored;
            default -> true;
        };
    }
}
