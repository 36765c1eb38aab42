package dev.newsroom.service;

/**
 * Audit actions recorded by {@link AuditService}.
 */
public enum AuditEventType {
    // Stories
    STORY_CREATE,
    STORY_UPDATE,
    STORY_DELETE,
    STAGE_TRANSITION,
    GROUP_PUBLISH,

    // Tasks
    TASK_CREATE,
    TASK_COMPLETE,
    TASK_CANCEL,
    TASK_REASSIGN,

    // Translations
    TRANSLATIONS_DISPATCHED,
    TRANSLATION_STATUS;

    public String action() {
        return name();
    }
}
