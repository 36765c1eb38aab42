package dev.newsroom.service.workflow;

import dev.newsroom.config.WorkflowProperties;
import dev.newsroom.entity.StaffRole;
import dev.newsroom.entity.StaffUser;
import dev.newsroom.entity.Story;
import dev.newsroom.entity.TaskType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Who may do what. Every check is a pure function of the actor, the item and
 * configuration; nothing here touches storage.
 */
@Component
@RequiredArgsConstructor
public class RolePolicy {

    private final WorkflowProperties workflowProperties;

    public boolean canRequest(StageTransition transition, StaffUser actor, Story story) {
        if (actor == null || !actor.isActiveStaff() || actor.role() == null) {
            return false;
        }
        return switch (transition) {
            case SUBMIT_FOR_REVIEW, SUBMIT_FOR_APPROVAL ->
                    actor.getId().equals(story.getAuthorId()) || actor.hasRoleAtLeast(StaffRole.EDITOR);
            case SEND_FOR_APPROVAL, REVISE -> canActAsReviewer(actor, story);
            case APPROVE, SEND_BACK, RETURN_TO_AUTHOR -> actor.hasRoleAtLeast(StaffRole.SUB_EDITOR);
            case MARK_TRANSLATED -> false;
            case PUBLISH -> canPublish(actor);
        };
    }

    /**
     * Journalists review stories assigned to them; sub-editors and above may step in on any.
     */
    private boolean canActAsReviewer(StaffUser actor, Story story) {
        if (actor.hasRoleAtLeast(StaffRole.SUB_EDITOR)) {
            return true;
        }
        if (actor.role() != StaffRole.JOURNALIST) {
            return false;
        }
        return story.getAssignedReviewerId() == null || story.getAssignedReviewerId().equals(actor.getId());
    }

    public boolean canPublish(StaffUser actor) {
        if (actor == null || !actor.isActiveStaff()) {
            return false;
        }
        StaffRole minimum = workflowProperties.isSubEditorCanPublish() ? StaffRole.SUB_EDITOR : StaffRole.EDITOR;
        return actor.hasRoleAtLeast(minimum);
    }

    public boolean canDispatchTranslations(StaffUser actor) {
        return actor.hasRoleAtLeast(StaffRole.SUB_EDITOR);
    }

    public boolean canReviewTranslation(StaffUser actor, Long recordedReviewerId) {
        return actor.getId().equals(recordedReviewerId) || actor.hasRoleAtLeast(StaffRole.SUB_EDITOR);
    }

    public boolean canEditDraft(StaffUser actor, Story story) {
        return actor.getId().equals(story.getAuthorId()) || actor.hasRoleAtLeast(StaffRole.EDITOR);
    }

    public boolean canDeleteStory(StaffUser actor) {
        return actor.hasRoleAtLeast(StaffRole.EDITOR);
    }

    public boolean canManageTasks(StaffUser actor) {
        return actor.hasRoleAtLeast(StaffRole.SUB_EDITOR);
    }

    /**
     * The task creator, its current assignee, or anyone SUB_EDITOR and above.
     */
    public boolean canReassign(StaffUser actor, Long taskCreatorId, Long currentAssigneeId) {
        return actor.getId().equals(taskCreatorId)
                || actor.getId().equals(currentAssigneeId)
                || actor.hasRoleAtLeast(StaffRole.SUB_EDITOR);
    }

    /**
     * Roles eligible to be assigned a task of this type. Per-language translation
     * tasks are filtered by translation language instead, so every role is eligible.
     */
    public Set<StaffRole> candidateRoles(TaskType type) {
        return switch (type) {
            case STORY_REVIEW, STORY_REVISION_TO_JOURNALIST -> EnumSet.of(StaffRole.JOURNALIST);
            case STORY_APPROVAL, STORY_TRANSLATION_REVIEW -> StaffRole.APPROVERS;
            case STORY_PUBLISH, BULLETIN_PUBLISH, SHOW_PUBLISH -> publishRoles();
            default -> EnumSet.allOf(StaffRole.class);
        };
    }

    /** Candidate roles for the dispatch variant of STORY_TRANSLATE. */
    public Set<StaffRole> dispatcherRoles() {
        return StaffRole.APPROVERS;
    }

    private Set<StaffRole> publishRoles() {
        return workflowProperties.isSubEditorCanPublish()
                ? StaffRole.APPROVERS
                : EnumSet.of(StaffRole.EDITOR, StaffRole.ADMIN, StaffRole.SUPERADMIN);
    }
}
