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

/**
 * An editorial item. Originals carry the full pipeline; translated items point
 * back to their original through {@code originalStoryId}.
 */
@Table("stories")
@Getter
@Setter
@ToString(exclude = {"content"})
@EqualsAndHashCode(of = "id")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Story implements Persistable<Long>, NewRecordAware {

    @Id
    private Long id;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    private String slug;
    private String title;
    private String content;

    @Builder.Default
    private String stage = StoryStage.DRAFT.name();

    @Builder.Default
    private String language = StoryLanguage.ENGLISH.name();

    @Column("is_translation")
    @Builder.Default
    private Boolean translation = false;

    @Column("original_story_id")
    private Long originalStoryId;

    @Column("category_id")
    private Long categoryId;

    @Column("author_id")
    private Long authorId;

    /** Role of the author when the story was created; drives routing. */
    @Column("author_role")
    private String authorRole;

    @Column("assigned_reviewer_id")
    private Long assignedReviewerId;

    @Column("assigned_approver_id")
    private Long assignedApproverId;

    @Column("published_by")
    private Long publishedBy;

    @Column("published_at")
    private LocalDateTime publishedAt;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;

    public StoryStage stageValue() {
        return StoryStage.from(stage);
    }

    public boolean isInStage(StoryStage expected) {
        return expected.matches(stage);
    }

    public boolean isTranslationItem() {
        return Boolean.TRUE.equals(translation);
    }

    public StaffRole authorRoleValue() {
        return StaffRole.from(authorRole);
    }

    /** Time the item entered its current stage, falling back to creation time. */
    public LocalDateTime stageEnteredAt() {
        return updatedAt != null ? updatedAt : createdAt;
    }
}
