package dev.newsroom.repository;

import dev.newsroom.entity.Story;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Collection;

/**
 * Stories are never rewritten with {@code save()} once created: every change to an
 * existing row goes through a conditional UPDATE whose row count tells the caller
 * whether the expected state still held.
 */
@Repository
public interface StoryRepository extends ReactiveCrudRepository<Story, Long> {

    Mono<Boolean> existsBySlug(String slug);

    Flux<Story> findByOriginalStoryId(Long originalStoryId);

    @Modifying
    @Query("UPDATE stories SET stage = :toStage, updated_at = :now WHERE id = :id AND stage = :fromStage")
    Mono<Integer> compareAndSetStage(Long id, String fromStage, String toStage, LocalDateTime now);

    @Modifying
    @Query("UPDATE stories SET assigned_reviewer_id = :reviewerId WHERE id = :id")
    Mono<Integer> updateAssignedReviewer(Long id, Long reviewerId);

    @Modifying
    @Query("UPDATE stories SET assigned_approver_id = :approverId WHERE id = :id")
    Mono<Integer> updateAssignedApprover(Long id, Long approverId);

    @Modifying
    @Query("UPDATE stories SET title = :title, content = :content, category_id = :categoryId " +
           "WHERE id = :id AND stage = 'DRAFT'")
    Mono<Integer> updateDraftContent(Long id, String title, String content, Long categoryId);

    @Modifying
    @Query("UPDATE stories SET title = :title, content = :content " +
           "WHERE id = :id AND is_translation = TRUE AND stage = 'DRAFT'")
    Mono<Integer> updateTranslationDraft(Long id, String title, String content);

    @Modifying
    @Query("UPDATE stories SET stage = 'PUBLISHED', published_at = :now, published_by = :publishedBy, updated_at = :now " +
           "WHERE id = :id AND is_translation = FALSE AND stage = :expectedStage")
    Mono<Integer> publishOriginal(Long id, String expectedStage, LocalDateTime now, Long publishedBy);

    @Modifying
    @Query("UPDATE stories SET stage = 'PUBLISHED', published_at = :now, published_by = :publishedBy, updated_at = :now " +
           "WHERE id IN (:ids) AND is_translation = TRUE AND stage = 'APPROVED'")
    Mono<Integer> publishTranslations(Collection<Long> ids, LocalDateTime now, Long publishedBy);

    @Modifying
    @Query("DELETE FROM stories WHERE original_story_id = :originalId AND is_translation = TRUE")
    Mono<Integer> deleteTranslationsOf(Long originalId);

    @Query("SELECT * FROM stories WHERE is_translation = FALSE AND stage <> 'PUBLISHED'")
    Flux<Story> findPipelineItems();

    @Query("SELECT * FROM stories WHERE is_translation = FALSE AND stage = :stage " +
           "ORDER BY COALESCE(updated_at, created_at) ASC")
    Flux<Story> findOriginalsInStageOldestFirst(String stage);

    @Query("SELECT COUNT(*) FROM stories WHERE is_translation = FALSE AND stage = 'PUBLISHED' AND published_at >= :since")
    Mono<Long> countOriginalsPublishedSince(LocalDateTime since);

    @Query("SELECT * FROM stories WHERE author_id = :authorId ORDER BY created_at DESC LIMIT :limit OFFSET :offset")
    Flux<Story> findByAuthor(Long authorId, int limit, int offset);
}
