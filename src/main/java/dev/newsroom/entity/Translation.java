package dev.newsroom.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.annotation.Version;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Translation assignment: one original story, one target language, one translator.
 * Updates are guarded by {@link #version}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("translations")
public class Translation implements Persistable<Long>, NewRecordAware {

    @Id
    private Long id;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    @Version
    private Long version;

    @Builder.Default
    private String status = TranslationStatus.PENDING.name();

    @Column("target_language")
    private String targetLanguage;

    @Column("original_story_id")
    private Long originalStoryId;

    @Column("translated_story_id")
    private Long translatedStoryId;

    @Column("assigned_to_id")
    private Long assignedToId;

    @Column("reviewer_id")
    private Long reviewerId;

    @Column("translator_notes")
    private String translatorNotes;

    @Column("reviewer_notes")
    private String reviewerNotes;

    @Column("rejection_reason")
    private String rejectionReason;

    @Column("started_at")
    private LocalDateTime startedAt;

    @Column("submitted_at")
    private LocalDateTime submittedAt;

    @Column("reviewed_at")
    private LocalDateTime reviewedAt;

    @Column("approved_at")
    private LocalDateTime approvedAt;

    @Column("rejected_at")
    private LocalDateTime rejectedAt;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;

    public TranslationStatus statusValue() {
        return TranslationStatus.from(status);
    }

    public boolean isApproved() {
        return TranslationStatus.APPROVED.matches(status);
    }
}
