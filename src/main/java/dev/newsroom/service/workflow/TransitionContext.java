package dev.newsroom.service.workflow;

/**
 * Extra inputs carried alongside a stage transition.
 *
 * @param originatingTaskId task whose completion triggered the move, or null for a direct request
 * @param reason            revision reason, required on rejection edges
 * @param nextAssigneeId    explicit assignee for the next step's task, or null to pick one
 * @param metadataJson      JSON stored on the completed task
 */
public record TransitionContext(Long originatingTaskId, String reason, Long nextAssigneeId, String metadataJson) {

    public static TransitionContext direct(String reason) {
        return new TransitionContext(null, reason, null, null);
    }

    public static TransitionContext system() {
        return new TransitionContext(null, null, null, null);
    }

    public boolean hasReason() {
        return reason != null && !reason.isBlank();
    }
}
