package dev.newsroom.service.workflow;

/**
 * What the assignee decided when completing a task.
 */
public enum TaskOutcome {
    /** Hand a draft on. */
    SUBMIT,
    APPROVE,
    /** Send a story back for changes. */
    REVISE,
    /** Reject a translation. */
    REJECT,
    /** Plain completion for tasks with no decision attached. */
    DONE
}
