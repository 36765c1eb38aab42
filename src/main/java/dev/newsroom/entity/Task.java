package dev.newsroom.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

@Table("tasks")
@Getter
@Setter
@ToString(exclude = {"description", "metadata"})
@EqualsAndHashCode(of = "id")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Task implements Persistable<Long>, NewRecordAware {

    @Id
    private Long id;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    private String type;

    @Builder.Default
    private String status = TaskStatus.PENDING.name();

    @Builder.Default
    private String priority = TaskPriority.MEDIUM.name();

    private String title;
    private String description;

    @Column("assigned_to_id")
    private Long assignedToId;

    @Column("created_by_id")
    private Long createdById;

    @Column("content_type")
    private String contentType;

    @Column("content_id")
    private Long contentId;

    @Column("step_key")
    private String stepKey;

    @Column("target_language")
    private String targetLanguage;

    @Column("due_date")
    private LocalDateTime dueDate;

    @Column("completed_at")
    private LocalDateTime completedAt;

    /** Free-form JSON: outcome, reasons, reassignment notes. */
    private String metadata;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;

    public TaskType typeValue() {
        return TaskType.from(type);
    }

    public TaskStatus statusValue() {
        return TaskStatus.from(status);
    }

    public ContentRef contentRef() {
        return ContentRef.of(ContentKind.valueOf(contentType), contentId);
    }

    public boolean isAssignedTo(Long staffId) {
        return assignedToId != null && assignedToId.equals(staffId);
    }

    /** True for the STORY_TRANSLATE task that dispatches languages, as opposed to a per-language one. */
    public boolean isTranslationDispatch() {
        return TaskType.STORY_TRANSLATE.matches(type) && targetLanguage == null;
    }
}
