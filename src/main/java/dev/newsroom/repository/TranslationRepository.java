package dev.newsroom.repository;

import dev.newsroom.entity.Translation;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface TranslationRepository extends ReactiveCrudRepository<Translation, Long> {

    Flux<Translation> findByOriginalStoryId(Long originalStoryId);

    Mono<Translation> findByTranslatedStoryId(Long translatedStoryId);

    Mono<Boolean> existsByOriginalStoryIdAndTargetLanguage(Long originalStoryId, String targetLanguage);

    Mono<Translation> findByOriginalStoryIdAndTargetLanguage(Long originalStoryId, String targetLanguage);

    @Query("SELECT * FROM translations WHERE assigned_to_id = :translatorId ORDER BY created_at DESC")
    Flux<Translation> findByTranslator(Long translatorId);

    @Query("SELECT * FROM translations WHERE status = :status ORDER BY created_at ASC")
    Flux<Translation> findByStatusOldestFirst(String status);

    @Modifying
    @Query("DELETE FROM translations WHERE original_story_id = :originalId")
    Mono<Integer> deleteByOriginalStoryId(Long originalId);
}
